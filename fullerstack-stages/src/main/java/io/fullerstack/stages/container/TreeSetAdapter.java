package io.fullerstack.stages.container;

import java.util.Collection;
import java.util.Comparator;
import java.util.TreeSet;

/**
 * {@link ContainerKind#ORDERED_SET} adapter backed by {@link TreeSet}.
 *
 * <p>Uniqueness follows the ordering: two elements the comparator ranks equal are the same
 * element. The comparator only applies to {@code E}, so {@link #withElementType()} falls back to
 * natural ordering and the mapped elements must be {@link Comparable}.
 *
 * @param <E> element type
 */
final class TreeSetAdapter<E> implements ContainerAdapter<E, TreeSet<E>> {

    static final TreeSetAdapter<Object> NATURAL = new TreeSetAdapter<>(null);

    private final Comparator<? super E> comparator;

    TreeSetAdapter(Comparator<? super E> comparator) {
        this.comparator = comparator;
    }

    @Override
    public ContainerKind kind() {
        return ContainerKind.ORDERED_SET;
    }

    @Override
    public TreeSet<E> newContainer(int expectedSize) {
        return new TreeSet<>(comparator);
    }

    @Override
    public void insert(TreeSet<E> container, E value) {
        container.add(value);
    }

    @Override
    public <R> ContainerAdapter<R, ? extends Collection<R>> withElementType() {
        return Containers.treeSet();
    }

    @Override
    public String toString() {
        return comparator == null ? "TreeSet" : "TreeSet(" + comparator + ")";
    }
}
