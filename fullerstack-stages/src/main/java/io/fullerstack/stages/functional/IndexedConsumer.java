package io.fullerstack.stages.functional;

/**
 * Consumer that also receives the zero-based position of each element.
 *
 * @param <E> element type
 * @see io.fullerstack.stages.Stage#forEachIndexed(IndexedConsumer)
 */
@FunctionalInterface
public interface IndexedConsumer<E> {

    /**
     * @param index position of {@code value} within the range, starting at 0
     * @param value the element
     */
    void accept(long index, E value);
}
