package io.fullerstack.stages.stage;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Read-only handle onto the elements a {@link Range} points into.
 *
 * <p>Storage is either <em>borrowed</em> (a caller's source collection, never copied and never
 * mutated) or <em>owned</em> (a container a transforming stage built and froze). Positions are
 * plain {@code int} indices, so a range never holds a live iterator into storage it does not
 * control.
 *
 * @param <E> element type
 */
interface Storage<E> {

    /**
     * @return number of elements in the underlying container
     */
    int size();

    /**
     * Iterates positions {@code [start, end)}.
     *
     * @param start first position, inclusive
     * @param end last position, exclusive
     * @return a read-only iterator
     */
    Iterator<E> iterator(int start, int end);

    /**
     * @return true if this storage belongs to a stage rather than to the caller
     */
    boolean isOwned();

    /**
     * Wraps a caller's collection without copying it.
     *
     * <p>Random-access lists are indexed directly; any other collection is re-walked from its
     * own iterator on each traversal.
     *
     * @param source the collection to borrow
     * @param <E> element type
     * @return borrowed storage
     */
    static <E> Storage<E> borrow(Collection<E> source) {
        Objects.requireNonNull(source, "Source collection cannot be null");
        if (source instanceof List<E> list && source instanceof RandomAccess) {
            return new IndexedStorage<>(list, false);
        }
        return new IteratedStorage<>(source, false);
    }

    /**
     * Freezes a container a stage has just built and takes ownership of it.
     *
     * <p>The container must not be reachable by anyone but the caller, who must drop it after
     * this call.
     *
     * @param container a freshly built container
     * @param <E> element type
     * @return owned storage over an unmodifiable view of {@code container}
     */
    static <E> Storage<E> own(Collection<E> container) {
        Objects.requireNonNull(container, "Owned container cannot be null");
        if (container instanceof List<E> list && container instanceof RandomAccess) {
            return new IndexedStorage<>(Collections.unmodifiableList(list), true);
        }
        return new IteratedStorage<>(Collections.unmodifiableCollection(container), true);
    }
}
