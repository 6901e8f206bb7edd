package io.fullerstack.stages.container;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Factory for the built-in {@link ContainerAdapter}s.
 *
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * // Collect into an ordered set
 * TreeSet<Double> halves = Stages.of(numbers)
 *     .map(n -> n / 2.0)
 *     .collect(Containers.treeSet());
 *
 * // Collect into any appendable collection
 * LinkedList<String> names = Stages.of(people)
 *     .map(Person::name)
 *     .collect(Containers.sequence(LinkedList::new));
 * }</pre>
 */
@UtilityClass
public class Containers {

    /**
     * @param <E> element type
     * @return the {@link ArrayList} sequence adapter
     */
    @SuppressWarnings("unchecked")
    public static <E> ContainerAdapter<E, ArrayList<E>> list() {
        return (ContainerAdapter<E, ArrayList<E>>) (ContainerAdapter<?, ?>) ListAdapter.INSTANCE;
    }

    /**
     * Sequence adapter for an arbitrary appendable collection.
     *
     * @param factory creates empty containers
     * @param <E> element type
     * @param <C> container type
     * @return a sequence adapter using {@link Collection#add(Object)} for insertion
     * @throws NullPointerException if factory is null
     */
    public static <E, C extends Collection<E>> ContainerAdapter<E, C> sequence(Supplier<? extends C> factory) {
        return new SequenceAdapter<>(factory);
    }

    /**
     * @param <E> element type
     * @return the {@link HashSet} adapter
     */
    @SuppressWarnings("unchecked")
    public static <E> ContainerAdapter<E, HashSet<E>> hashSet() {
        return (ContainerAdapter<E, HashSet<E>>) (ContainerAdapter<?, ?>) HashSetAdapter.INSTANCE;
    }

    /**
     * @param <E> element type
     * @return the {@link LinkedHashSet} adapter
     */
    @SuppressWarnings("unchecked")
    public static <E> ContainerAdapter<E, LinkedHashSet<E>> linkedHashSet() {
        return (ContainerAdapter<E, LinkedHashSet<E>>) (ContainerAdapter<?, ?>) LinkedHashSetAdapter.INSTANCE;
    }

    /**
     * Ordered set adapter using natural ordering. Elements must be {@link Comparable}.
     *
     * @param <E> element type
     * @return the natural-order {@link TreeSet} adapter
     */
    @SuppressWarnings("unchecked")
    public static <E> ContainerAdapter<E, TreeSet<E>> treeSet() {
        return (ContainerAdapter<E, TreeSet<E>>) (ContainerAdapter<?, ?>) TreeSetAdapter.NATURAL;
    }

    /**
     * Ordered set adapter using the given comparator.
     *
     * @param comparator ordering and uniqueness of elements
     * @param <E> element type
     * @return a {@link TreeSet} adapter
     * @throws NullPointerException if comparator is null
     */
    public static <E> ContainerAdapter<E, TreeSet<E>> treeSet(Comparator<? super E> comparator) {
        Objects.requireNonNull(comparator, "Comparator cannot be null");
        return new TreeSetAdapter<>(comparator);
    }

    /**
     * Initial capacity for a hash container expected to receive {@code expectedSize} entries
     * without rehashing at the default load factor.
     */
    static int hashCapacity(int expectedSize) {
        if (expectedSize <= 0) {
            return 16;
        }
        return (int) Math.min((long) Integer.MAX_VALUE >> 1, (long) Math.ceil(expectedSize / 0.75d));
    }
}
