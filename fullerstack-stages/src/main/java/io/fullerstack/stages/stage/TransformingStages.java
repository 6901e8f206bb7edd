package io.fullerstack.stages.stage;

import io.fullerstack.stages.container.ContainerAdapter;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Builds map and filter stages.
 *
 * <p>Both run to completion before returning: one pass over the input range, inserting through
 * the target adapter into a fresh container, which is then frozen and handed to the new stage as
 * owned storage. The container never leaves this class before it is frozen. The new stage's range covers that storage and never sees it change.
 *
 * <p>Map targets {@code withElementType()} of the input's adapter; filter reuses the input's
 * adapter, so an ordered set keeps its comparator.
 */
@UtilityClass
class TransformingStages {

    private static final Logger logger = LoggerFactory.getLogger(TransformingStages.class);

    /** Largest initial capacity requested for materialized storage. */
    static final int MAX_PRESIZE = 1 << 16;

    static <E, R> RangeStage<R> map(RangeStage<E> input, Function<? super E, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "Mapper cannot be null");
        ContainerAdapter<R, ? extends Collection<R>> target = input.adapter().withElementType();
        return mapInto(input.range(), target, mapper);
    }

    static <E> RangeStage<E> filter(RangeStage<E> input, Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return filterInto(input.range(), input.adapter(), predicate);
    }

    private static <E, R, C extends Collection<R>> RangeStage<R> mapInto(
        Range<E> range, ContainerAdapter<R, C> target, Function<? super E, ? extends R> mapper
    ) {
        C mapped = target.newContainer(sizeHint(range.size()));
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            target.insert(mapped, mapper.apply(it.next()));
        }
        return owning("map", range, target, mapped);
    }

    private static <E, C extends Collection<E>> RangeStage<E> filterInto(
        Range<E> range, ContainerAdapter<E, C> target, Predicate<? super E> predicate
    ) {
        C filtered = target.newContainer(sizeHint(range.size()));
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            E element = it.next();
            if (predicate.test(element)) {
                target.insert(filtered, element);
            }
        }
        return owning("filter", range, target, filtered);
    }

    private static <R, C extends Collection<R>> RangeStage<R> owning(
        String operation, Range<?> input, ContainerAdapter<R, C> target, C container
    ) {
        Storage<R> owned = Storage.own(container);
        logger.trace("{} materialized {} of {} elements into {}", operation, owned.size(), input.size(), target);
        return new RangeStage<>(Range.over(owned), target);
    }

    /**
     * Initial capacity for a container about to receive at most {@code inputSize} elements.
     */
    static int sizeHint(int inputSize) {
        return Math.min(inputSize, MAX_PRESIZE);
    }
}
