package io.fullerstack.stages;

import io.fullerstack.stages.container.ContainerAdapter;
import io.fullerstack.stages.container.Containers;
import io.fullerstack.stages.stage.RangeStage;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * Entry points that wrap a caller's collection as the head of a pipeline.
 *
 * <p>The head borrows the collection: nothing is copied, and the collection must stay
 * unmodified while the pipeline reads from it. The overload chosen decides the container kind
 * that later {@code map} and {@code filter} stages build:
 * <ul>
 *   <li>{@link List} → {@code ArrayList}</li>
 *   <li>{@link Set} → {@code HashSet}</li>
 *   <li>{@link LinkedHashSet} → {@code LinkedHashSet}</li>
 *   <li>{@link SortedSet} → {@code TreeSet} with the set's comparator</li>
 * </ul>
 *
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * List<Integer> numbers = List.of(1, 2, 3, 4);
 * int sum = Stages.of(numbers).reduce(0, Integer::sum);
 *
 * ArrayDeque<String> queue = ...;
 * Stage<String> head = Stages.of(queue, Containers.sequence(ArrayDeque::new));
 * }</pre>
 */
@UtilityClass
public class Stages {

    public static <E> Stage<E> of(List<E> source) {
        return of(source, Containers.list());
    }

    public static <E> Stage<E> of(Set<E> source) {
        return of(source, Containers.hashSet());
    }

    public static <E> Stage<E> of(LinkedHashSet<E> source) {
        return of(source, Containers.linkedHashSet());
    }

    /**
     * Wraps a sorted set; the pipeline keeps the set's ordering.
     */
    public static <E> Stage<E> of(SortedSet<E> source) {
        Objects.requireNonNull(source, "Source collection cannot be null");
        ContainerAdapter<E, ? extends Collection<E>> adapter = source.comparator() == null
            ? Containers.treeSet()
            : Containers.treeSet(source.comparator());
        return of(source, adapter);
    }

    /**
     * Wraps any collection, materializing later stages through the given adapter.
     *
     * @param source the collection to borrow
     * @param adapter container kind for {@code map} and {@code filter} results
     * @param <E> element type
     * @return the head stage
     * @throws NullPointerException if either argument is null
     */
    public static <E> Stage<E> of(Collection<E> source, ContainerAdapter<E, ? extends Collection<E>> adapter) {
        Objects.requireNonNull(source, "Source collection cannot be null");
        Objects.requireNonNull(adapter, "Container adapter cannot be null");
        return RangeStage.borrowing(source, adapter);
    }

    /**
     * @param adapter container kind for later stages
     * @param <E> element type
     * @return a stage with no elements
     */
    public static <E> Stage<E> empty(ContainerAdapter<E, ? extends Collection<E>> adapter) {
        Objects.requireNonNull(adapter, "Container adapter cannot be null");
        return RangeStage.borrowing(List.<E>of(), adapter);
    }
}
