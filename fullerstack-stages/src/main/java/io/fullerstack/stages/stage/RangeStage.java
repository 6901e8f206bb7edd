package io.fullerstack.stages.stage;

import io.fullerstack.stages.EmptyRangeException;
import io.fullerstack.stages.Stage;
import io.fullerstack.stages.container.ContainerAdapter;
import io.fullerstack.stages.container.ContainerKind;
import io.fullerstack.stages.functional.IndexedConsumer;

import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The single {@link Stage} implementation: a {@link Range} plus the adapter for the container
 * kind the chain materializes into.
 *
 * <p>Every stage of a chain is a {@code RangeStage}. What differs is where its range points:
 * <ul>
 *   <li>the head and all narrowing stages borrow storage from upstream</li>
 *   <li>map and filter stages point into storage they built and own</li>
 * </ul>
 * Once constructed a stage never changes, so every operation is a read over the range. The
 * range and its storage stay inside this package: a narrowed stage cannot be widened again.
 *
 * @param <E> element type
 * @see NarrowingStages
 * @see TransformingStages
 */
public final class RangeStage<E> implements Stage<E> {

    private final Range<E> range;
    private final ContainerAdapter<E, ? extends Collection<E>> adapter;

    RangeStage(Range<E> range, ContainerAdapter<E, ? extends Collection<E>> adapter) {
        this.range = Objects.requireNonNull(range, "Range cannot be null");
        this.adapter = Objects.requireNonNull(adapter, "Container adapter cannot be null");
    }

    /**
     * Head of a chain: a stage covering all of {@code source}, which it borrows without copying.
     *
     * @param source the collection to borrow
     * @param adapter container kind for later map and filter stages
     * @param <E> element type
     * @return the head stage
     * @throws NullPointerException if either argument is null
     */
    public static <E> RangeStage<E> borrowing(
        Collection<E> source, ContainerAdapter<E, ? extends Collection<E>> adapter
    ) {
        return new RangeStage<>(Range.over(Storage.borrow(source)), adapter);
    }

    Range<E> range() {
        return range;
    }

    @Override
    public ContainerAdapter<E, ? extends Collection<E>> adapter() {
        return adapter;
    }

    @Override
    public ContainerKind kind() {
        return adapter.kind();
    }

    @Override
    public <R> Stage<R> map(Function<? super E, ? extends R> mapper) {
        return TransformingStages.map(this, mapper);
    }

    @Override
    public Stage<E> filter(Predicate<? super E> predicate) {
        return TransformingStages.filter(this, predicate);
    }

    @Override
    public Stage<E> take(long count) {
        return NarrowingStages.take(this, count);
    }

    @Override
    public Stage<E> takeWhile(Predicate<? super E> predicate) {
        return NarrowingStages.takeWhile(this, predicate);
    }

    @Override
    public Stage<E> skip(long count) {
        return NarrowingStages.skip(this, count);
    }

    @Override
    public Stage<E> skipWhile(Predicate<? super E> predicate) {
        return NarrowingStages.skipWhile(this, predicate);
    }

    @Override
    public void forEach(Consumer<? super E> consumer) {
        Objects.requireNonNull(consumer, "Consumer cannot be null");
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            consumer.accept(it.next());
        }
    }

    @Override
    public void forEachIndexed(IndexedConsumer<? super E> consumer) {
        Objects.requireNonNull(consumer, "Consumer cannot be null");
        long index = 0;
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            consumer.accept(index++, it.next());
        }
    }

    @Override
    public E reduce(BinaryOperator<E> reducer) {
        Objects.requireNonNull(reducer, "Reducer cannot be null");
        Iterator<E> it = range.iterator();
        if (!it.hasNext()) {
            throw new EmptyRangeException("reduce without a seed");
        }
        E accumulator = it.next();
        while (it.hasNext()) {
            accumulator = reducer.apply(accumulator, it.next());
        }
        return accumulator;
    }

    @Override
    public <R> R reduce(R seed, BiFunction<R, ? super E, R> reducer) {
        Objects.requireNonNull(reducer, "Reducer cannot be null");
        R accumulator = seed;
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            accumulator = reducer.apply(accumulator, it.next());
        }
        return accumulator;
    }

    @Override
    public boolean any(Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            if (predicate.test(it.next())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean all(Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            if (!predicate.test(it.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean none(Predicate<? super E> predicate) {
        return !any(predicate);
    }

    @Override
    public long count() {
        return range.size();
    }

    @Override
    public boolean isEmpty() {
        return range.isEmpty();
    }

    @Override
    public Optional<E> findFirst() {
        Iterator<E> it = range.iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    @Override
    public E first() {
        Iterator<E> it = range.iterator();
        if (!it.hasNext()) {
            throw new EmptyRangeException("first");
        }
        return it.next();
    }

    @Override
    public <C extends Collection<E>> C collect(ContainerAdapter<E, C> target) {
        Objects.requireNonNull(target, "Container adapter cannot be null");
        C result = target.newContainer(range.size());
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            target.insert(result, it.next());
        }
        return result;
    }

    @Override
    public Iterator<E> iterator() {
        return range.iterator();
    }

    @Override
    public Stream<E> stream() {
        Spliterator<E> spliterator = Spliterators.spliterator(
            range.iterator(), range.size(), Spliterator.ORDERED | Spliterator.IMMUTABLE
        );
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public String toString() {
        return "RangeStage[" + adapter + ", " + range + "]";
    }
}
