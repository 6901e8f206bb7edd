package io.fullerstack.stages.stage;

import lombok.experimental.UtilityClass;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Builds take, skip, takeWhile and skipWhile stages.
 *
 * <p>Each result shares its input's storage and adapter; only the range bounds move.
 * {@code take}/{@code takeWhile} keep the input's start and pull the end in, {@code skip}/
 * {@code skipWhile} keep the end and push the start forward. Counts past the end clamp.
 */
@UtilityClass
class NarrowingStages {

    static <E> RangeStage<E> take(RangeStage<E> input, long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Take count must be non-negative");
        }
        Range<E> range = input.range();
        int kept = (int) Math.min(count, range.size());
        return narrowed(input, range.start(), range.start() + kept);
    }

    static <E> RangeStage<E> takeWhile(RangeStage<E> input, Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        Range<E> range = input.range();
        int matched = leadingMatches(range, predicate);
        return narrowed(input, range.start(), range.start() + matched);
    }

    static <E> RangeStage<E> skip(RangeStage<E> input, long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Skip count must be non-negative");
        }
        Range<E> range = input.range();
        int dropped = (int) Math.min(count, range.size());
        return narrowed(input, range.start() + dropped, range.end());
    }

    static <E> RangeStage<E> skipWhile(RangeStage<E> input, Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        Range<E> range = input.range();
        int matched = leadingMatches(range, predicate);
        return narrowed(input, range.start() + matched, range.end());
    }

    /**
     * Length of the longest prefix of {@code range} whose elements satisfy {@code predicate}.
     */
    private static <E> int leadingMatches(Range<E> range, Predicate<? super E> predicate) {
        int matched = 0;
        for (Iterator<E> it = range.iterator(); it.hasNext(); ) {
            if (!predicate.test(it.next())) {
                break;
            }
            matched++;
        }
        return matched;
    }

    private static <E> RangeStage<E> narrowed(RangeStage<E> input, int start, int end) {
        Range<E> range = input.range();
        Range<E> sub = range.narrow(start, end);
        if (sub == range) {
            return input;
        }
        return new RangeStage<>(sub, input.adapter());
    }
}
