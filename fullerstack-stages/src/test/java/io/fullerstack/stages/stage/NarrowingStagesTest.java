package io.fullerstack.stages.stage;

import io.fullerstack.stages.Stage;
import io.fullerstack.stages.Stages;
import io.fullerstack.stages.container.Containers;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for take, skip, takeWhile and skipWhile.
 */
class NarrowingStagesTest {

    private static final List<Integer> DIGITS = List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);

    @Test
    void take_keepsLeadingElements() {
        assertThat(Stages.of(DIGITS).take(3).collect(Containers.list())).containsExactly(0, 1, 2);
    }

    @Test
    void take_zeroIsEmpty() {
        assertThat(Stages.of(DIGITS).take(0).isEmpty()).isTrue();
    }

    @Test
    void take_clampsToAvailable() {
        assertThat(Stages.of(DIGITS).take(Long.MAX_VALUE).count()).isEqualTo(10);
    }

    @Test
    void skip_dropsLeadingElements() {
        assertThat(Stages.of(DIGITS).skip(7).collect(Containers.list())).containsExactly(7, 8, 9);
    }

    @Test
    void skip_pastEndIsEmpty() {
        assertThat(Stages.of(DIGITS).skip(11).isEmpty()).isTrue();
    }

    @Test
    void negativeCounts_areRejected() {
        Stage<Integer> stage = Stages.of(DIGITS);

        assertThatThrownBy(() -> stage.take(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Take count must be non-negative");
        assertThatThrownBy(() -> stage.skip(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Skip count must be non-negative");
    }

    @Test
    void takeWhile_stopsAtFirstFailure() {
        List<Integer> result = Stages.of(List.of(1, 2, 5, 1, 2))
            .takeWhile(value -> value < 3)
            .collect(Containers.list());

        assertThat(result).containsExactly(1, 2);
    }

    @Test
    void takeWhile_failingFirstIsEmpty() {
        assertThat(Stages.of(DIGITS).takeWhile(value -> value > 0).isEmpty()).isTrue();
    }

    @Test
    void takeWhile_alwaysTrueKeepsAll() {
        Stage<Integer> head = Stages.of(DIGITS);

        assertThat(head.takeWhile(value -> true).count()).isEqualTo(10);
    }

    @Test
    void takeWhile_stopsTestingAfterFailure() {
        AtomicInteger tests = new AtomicInteger();

        Stages.of(DIGITS).takeWhile(value -> {
            tests.incrementAndGet();
            return value < 2;
        });

        assertThat(tests).hasValue(3);
    }

    @Test
    void skipWhile_startsAtFirstFailure() {
        List<Integer> result = Stages.of(List.of(1, 2, 5, 1, 2))
            .skipWhile(value -> value < 3)
            .collect(Containers.list());

        assertThat(result).containsExactly(5, 1, 2);
    }

    @Test
    void skipWhile_alwaysTrueIsEmpty() {
        assertThat(Stages.of(DIGITS).skipWhile(value -> true).isEmpty()).isTrue();
    }

    @Test
    void narrowing_sharesInputStorage() {
        RangeStage<Integer> head = (RangeStage<Integer>) Stages.of(DIGITS);

        RangeStage<Integer> narrowed = (RangeStage<Integer>) head.skip(2).take(5).skipWhile(v -> v < 3).takeWhile(v -> v < 6);

        assertThat(narrowed.range().storage()).isSameAs(head.range().storage());
        assertThat(narrowed.range().storage().isOwned()).isFalse();
        assertThat(narrowed.range().start()).isEqualTo(3);
        assertThat(narrowed.range().end()).isEqualTo(6);
    }

    @Test
    void narrowing_keepsContainerKind() {
        Stage<Integer> head = Stages.of(new TreeSet<>(DIGITS));

        assertThat(head.skip(3).take(2).kind()).isEqualTo(head.kind());
    }

    @Test
    void narrowing_noOpReturnsSameStage() {
        Stage<Integer> head = Stages.of(DIGITS);

        assertThat(head.take(100)).isSameAs(head);
        assertThat(head.skip(0)).isSameAs(head);
    }

    @Test
    void narrowing_nestedStaysInsideOuterRange() {
        Stage<Integer> window = Stages.of(DIGITS).skip(2).take(4);

        assertThat(window.skip(1).take(10).collect(Containers.list())).containsExactly(3, 4, 5);
    }

    @Test
    void narrowing_worksOverNonIndexedSource() {
        LinkedList<Integer> source = new LinkedList<>(DIGITS);

        List<Integer> result = Stages.of(source).skip(4).take(3).collect(Containers.list());

        assertThat(result).containsExactly(4, 5, 6);
    }

    @Test
    void narrowing_neverMutatesSource() {
        List<Integer> source = new ArrayList<>(DIGITS);

        Stages.of(source).skip(3).takeWhile(v -> v < 7).forEach(v -> { });

        assertThat(source).isEqualTo(DIGITS);
    }

    @Test
    void predicates_rejectNull() {
        Stage<Integer> stage = Stages.of(DIGITS);

        assertThatThrownBy(() -> stage.takeWhile(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> stage.skipWhile(null)).isInstanceOf(NullPointerException.class);
    }
}
