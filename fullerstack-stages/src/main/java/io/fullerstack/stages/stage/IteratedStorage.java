package io.fullerstack.stages.stage;

import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Storage over a collection without index access (hash and tree sets, linked lists).
 *
 * <p>Each traversal opens a fresh iterator on the collection and advances it to {@code start}.
 * Iteration order is the collection's own, which is stable while the collection is not modified.
 *
 * @param <E> element type
 */
final class IteratedStorage<E> implements Storage<E> {

    private final Collection<E> elements;
    private final boolean owned;

    IteratedStorage(Collection<E> elements, boolean owned) {
        this.elements = elements;
        this.owned = owned;
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public Iterator<E> iterator(int start, int end) {
        Iterator<E> delegate = elements.iterator();
        for (int i = 0; i < start; i++) {
            delegate.next();
        }
        return new Iterator<>() {
            private int remaining = end - start;

            @Override
            public boolean hasNext() {
                return remaining > 0;
            }

            @Override
            public E next() {
                if (remaining <= 0) {
                    throw new NoSuchElementException();
                }
                remaining--;
                return delegate.next();
            }
        };
    }

    @Override
    public boolean isOwned() {
        return owned;
    }

    @Override
    public String toString() {
        return (owned ? "owned" : "borrowed") + " iterated[" + elements.size() + "]";
    }
}
