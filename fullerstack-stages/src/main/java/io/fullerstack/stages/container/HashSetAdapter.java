package io.fullerstack.stages.container;

import java.util.Collection;
import java.util.HashSet;

/**
 * {@link ContainerKind#HASH_SET} adapter backed by {@link HashSet}.
 *
 * @param <E> element type
 */
final class HashSetAdapter<E> implements ContainerAdapter<E, HashSet<E>> {

    static final HashSetAdapter<Object> INSTANCE = new HashSetAdapter<>();

    private HashSetAdapter() {
    }

    @Override
    public ContainerKind kind() {
        return ContainerKind.HASH_SET;
    }

    @Override
    public HashSet<E> newContainer(int expectedSize) {
        return new HashSet<>(Containers.hashCapacity(expectedSize));
    }

    @Override
    public void insert(HashSet<E> container, E value) {
        container.add(value);
    }

    @Override
    public <R> ContainerAdapter<R, ? extends Collection<R>> withElementType() {
        return Containers.hashSet();
    }

    @Override
    public String toString() {
        return "HashSet";
    }
}
