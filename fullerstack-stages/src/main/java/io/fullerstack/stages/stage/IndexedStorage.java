package io.fullerstack.stages.stage;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Storage over a random-access list; positions map straight to list indices.
 *
 * @param <E> element type
 */
final class IndexedStorage<E> implements Storage<E> {

    private final List<E> elements;
    private final boolean owned;

    IndexedStorage(List<E> elements, boolean owned) {
        this.elements = elements;
        this.owned = owned;
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public Iterator<E> iterator(int start, int end) {
        return new Iterator<>() {
            private int next = start;

            @Override
            public boolean hasNext() {
                return next < end;
            }

            @Override
            public E next() {
                if (next >= end) {
                    throw new NoSuchElementException();
                }
                return elements.get(next++);
            }
        };
    }

    @Override
    public boolean isOwned() {
        return owned;
    }

    @Override
    public String toString() {
        return (owned ? "owned" : "borrowed") + " indexed[" + elements.size() + "]";
    }
}
