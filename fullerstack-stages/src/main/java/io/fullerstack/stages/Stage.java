package io.fullerstack.stages;

import io.fullerstack.stages.container.ContainerAdapter;
import io.fullerstack.stages.container.ContainerKind;
import io.fullerstack.stages.functional.IndexedConsumer;

import java.util.Collection;
import java.util.Iterator;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * One link of a collection pipeline: a read-only range of elements plus every operation that can
 * follow it.
 *
 * <p>Intermediate operations return a new stage and never touch the stage they are called on:
 * <ul>
 *   <li><b>Narrowing</b> ({@link #take}, {@link #skip}, {@link #takeWhile}, {@link #skipWhile})
 *       reuse the input's storage and only move the range bounds.</li>
 *   <li><b>Transforming</b> ({@link #map}, {@link #filter}) run eagerly, building a new container
 *       of the current {@link #kind() kind} that the returned stage owns.</li>
 * </ul>
 *
 * <p>Terminal operations consume the range and return a plain value.
 *
 * <p>Stages are single-threaded and never mutate their source. A chain reads its source
 * collection until a transforming stage has copied what it needs; modifying the source while
 * such a chain is in use leaves its results undefined.
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * TreeSet<Double> result = Stages.of(numbers)
 *     .filter(x -> x % 2 != 0)
 *     .map(x -> x / 2.0)
 *     .take(10)
 *     .takeWhile(x -> x < 8)
 *     .collect(Containers.treeSet());
 * }</pre>
 *
 * @param <E> element type of this stage
 * @see Stages
 */
public interface Stage<E> extends Iterable<E> {

    /**
     * @return the container kind that {@link #map} and {@link #filter} materialize into
     */
    ContainerKind kind();

    /**
     * @return the adapter that {@link #map} and {@link #filter} materialize through
     */
    ContainerAdapter<E, ? extends Collection<E>> adapter();

    // =========================================================================
    // Transforming
    // =========================================================================

    /**
     * Applies {@code mapper} to every element in order and collects the results into a new
     * container of the same kind. Set kinds drop mapped duplicates.
     *
     * @param mapper element transformation
     * @param <R> new element type
     * @return a stage over the mapped elements
     * @throws NullPointerException if mapper is null
     */
    <R> Stage<R> map(Function<? super E, ? extends R> mapper);

    /**
     * Keeps the elements that satisfy {@code predicate}, preserving their relative order.
     *
     * @param predicate condition for keeping an element
     * @return a stage over the kept elements, of the same kind
     * @throws NullPointerException if predicate is null
     */
    Stage<E> filter(Predicate<? super E> predicate);

    // =========================================================================
    // Narrowing
    // =========================================================================

    /**
     * @param count maximum number of leading elements to keep
     * @return a stage over at most the first {@code count} elements
     * @throws IllegalArgumentException if count is negative
     */
    Stage<E> take(long count);

    /**
     * Keeps the longest prefix whose elements all satisfy {@code predicate}.
     *
     * @param predicate condition every kept element meets
     * @return a stage ending just before the first element failing {@code predicate}
     * @throws NullPointerException if predicate is null
     */
    Stage<E> takeWhile(Predicate<? super E> predicate);

    /**
     * @param count number of leading elements to drop
     * @return a stage without the first {@code count} elements; empty if there are no more
     * @throws IllegalArgumentException if count is negative
     */
    Stage<E> skip(long count);

    /**
     * Drops the longest prefix whose elements all satisfy {@code predicate}.
     *
     * @param predicate condition for dropping a leading element
     * @return a stage starting at the first element failing {@code predicate}
     * @throws NullPointerException if predicate is null
     */
    Stage<E> skipWhile(Predicate<? super E> predicate);

    // =========================================================================
    // Terminal
    // =========================================================================

    /**
     * Calls {@code consumer} once per element, in order.
     */
    @Override
    void forEach(Consumer<? super E> consumer);

    /**
     * Calls {@code consumer} once per element with its position, starting at 0.
     *
     * @param consumer receives (index, element)
     */
    void forEachIndexed(IndexedConsumer<? super E> consumer);

    /**
     * Folds the range from the left, seeded with its first element. {@code reducer} is not
     * called for a single-element range.
     *
     * @param reducer combines (accumulator, element)
     * @return the folded value
     * @throws EmptyRangeException if the range is empty
     */
    E reduce(BinaryOperator<E> reducer);

    /**
     * Folds the range from the left starting at {@code seed}.
     *
     * @param seed initial accumulator, returned unchanged for an empty range
     * @param reducer combines (accumulator, element)
     * @param <R> accumulator type
     * @return the folded value
     */
    <R> R reduce(R seed, BiFunction<R, ? super E, R> reducer);

    /**
     * @return true if some element satisfies {@code predicate}; false for an empty range
     */
    boolean any(Predicate<? super E> predicate);

    /**
     * @return true if every element satisfies {@code predicate}; true for an empty range
     */
    boolean all(Predicate<? super E> predicate);

    /**
     * @return true if no element satisfies {@code predicate}; true for an empty range
     */
    boolean none(Predicate<? super E> predicate);

    /**
     * @return number of elements in the range
     */
    long count();

    /**
     * @return true if the range holds no elements
     */
    boolean isEmpty();

    /**
     * @return the first element, or empty for an empty range
     * @throws NullPointerException if the first element is null
     */
    Optional<E> findFirst();

    /**
     * @return the first element
     * @throws EmptyRangeException if the range is empty
     */
    E first();

    /**
     * Builds a new container of the caller's choice holding the range's elements in order.
     *
     * @param adapter kind of container to build
     * @param <C> container type
     * @return a new container the caller owns
     */
    <C extends Collection<E>> C collect(ContainerAdapter<E, C> adapter);

    /**
     * @return a read-only iterator over the range
     */
    @Override
    Iterator<E> iterator();

    /**
     * @return a sequential stream over the range
     */
    Stream<E> stream();
}
