package io.fullerstack.stages.container;

import java.util.Collection;

/**
 * Capability set that lets a stage work with one concrete container kind.
 *
 * <p>An adapter answers three questions about its container:
 * <ul>
 *   <li>how to create an empty one ({@link #newContainer(int)})</li>
 *   <li>how to insert into it ({@link #insert(Collection, Object)}): append for sequences,
 *       insert-if-absent for sets</li>
 *   <li>which adapter describes the same kind of container holding a different element type
 *       ({@link #withElementType()})</li>
 * </ul>
 *
 * <p>Supporting a new backing container means writing one new adapter; stages never look at the
 * concrete collection class.
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * ContainerAdapter<String, ArrayDeque<String>> deques = Containers.sequence(ArrayDeque::new);
 * ArrayDeque<String> names = Stages.of(people).map(Person::name).collect(deques);
 * }</pre>
 *
 * @param <E> element type
 * @param <C> concrete container type
 * @see Containers
 */
public interface ContainerAdapter<E, C extends Collection<E>> {

    /**
     * @return the family this adapter's containers belong to
     */
    ContainerKind kind();

    /**
     * Creates an empty container.
     *
     * @param expectedSize number of insertions the caller expects; a sizing hint only, may be 0
     * @return a new mutable container owned by the caller
     */
    C newContainer(int expectedSize);

    /**
     * Creates an empty container with no sizing hint.
     *
     * @return a new mutable container owned by the caller
     */
    default C newContainer() {
        return newContainer(0);
    }

    /**
     * Inserts a value. Sequences append; sets insert only if absent.
     *
     * @param container the container to insert into
     * @param value the value to insert
     */
    void insert(C container, E value);

    /**
     * Returns the adapter for the same kind of container holding {@code R} instead of {@code E}.
     *
     * @param <R> the new element type
     * @return an adapter of the same {@link #kind()} for {@code R}
     */
    <R> ContainerAdapter<R, ? extends Collection<R>> withElementType();
}
