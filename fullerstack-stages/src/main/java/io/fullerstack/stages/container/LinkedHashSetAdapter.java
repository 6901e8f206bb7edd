package io.fullerstack.stages.container;

import java.util.Collection;
import java.util.LinkedHashSet;

/**
 * {@link ContainerKind#LINKED_HASH_SET} adapter backed by {@link LinkedHashSet}.
 *
 * @param <E> element type
 */
final class LinkedHashSetAdapter<E> implements ContainerAdapter<E, LinkedHashSet<E>> {

    static final LinkedHashSetAdapter<Object> INSTANCE = new LinkedHashSetAdapter<>();

    private LinkedHashSetAdapter() {
    }

    @Override
    public ContainerKind kind() {
        return ContainerKind.LINKED_HASH_SET;
    }

    @Override
    public LinkedHashSet<E> newContainer(int expectedSize) {
        return new LinkedHashSet<>(Containers.hashCapacity(expectedSize));
    }

    @Override
    public void insert(LinkedHashSet<E> container, E value) {
        container.add(value);
    }

    @Override
    public <R> ContainerAdapter<R, ? extends Collection<R>> withElementType() {
        return Containers.linkedHashSet();
    }

    @Override
    public String toString() {
        return "LinkedHashSet";
    }
}
