package io.fullerstack.stages.container;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link ContainerKind#SEQUENCE} adapter for any caller-supplied collection that appends on
 * {@link Collection#add(Object)} ({@code LinkedList}, {@code ArrayDeque}, ...).
 *
 * <p>Mapping a stage over such a container materializes into an {@code ArrayList}, since the
 * supplier only knows how to build containers of the input element type.
 *
 * @param <E> element type
 * @param <C> concrete collection type
 */
final class SequenceAdapter<E, C extends Collection<E>> implements ContainerAdapter<E, C> {

    private final Supplier<? extends C> factory;

    SequenceAdapter(Supplier<? extends C> factory) {
        this.factory = Objects.requireNonNull(factory, "Container factory cannot be null");
    }

    @Override
    public ContainerKind kind() {
        return ContainerKind.SEQUENCE;
    }

    @Override
    public C newContainer(int expectedSize) {
        return Objects.requireNonNull(factory.get(), "Container factory returned null");
    }

    @Override
    public void insert(C container, E value) {
        container.add(value);
    }

    @Override
    public <R> ContainerAdapter<R, ? extends Collection<R>> withElementType() {
        return Containers.list();
    }

    @Override
    public String toString() {
        return "Sequence";
    }
}
