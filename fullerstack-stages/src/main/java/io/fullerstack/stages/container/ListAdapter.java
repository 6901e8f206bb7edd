package io.fullerstack.stages.container;

import java.util.ArrayList;
import java.util.Collection;

/**
 * {@link ContainerKind#SEQUENCE} adapter backed by {@link ArrayList}.
 *
 * @param <E> element type
 */
final class ListAdapter<E> implements ContainerAdapter<E, ArrayList<E>> {

    static final ListAdapter<Object> INSTANCE = new ListAdapter<>();

    private ListAdapter() {
    }

    @Override
    public ContainerKind kind() {
        return ContainerKind.SEQUENCE;
    }

    @Override
    public ArrayList<E> newContainer(int expectedSize) {
        return new ArrayList<>(Math.max(expectedSize, 0));
    }

    @Override
    public void insert(ArrayList<E> container, E value) {
        container.add(value);
    }

    @Override
    public <R> ContainerAdapter<R, ? extends Collection<R>> withElementType() {
        return Containers.list();
    }

    @Override
    public String toString() {
        return "ArrayList";
    }
}
