package io.fullerstack.stages.stage;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Range} and {@link Storage}.
 */
class RangeTest {

    @Test
    void over_coversWholeStorage() {
        Range<Integer> range = Range.over(Storage.borrow(List.of(1, 2, 3)));

        assertThat(range.start()).isZero();
        assertThat(range.end()).isEqualTo(3);
        assertThat(range.size()).isEqualTo(3);
        assertThat(range.isEmpty()).isFalse();
        assertThat(elements(range)).containsExactly(1, 2, 3);
    }

    @Test
    void narrow_sharesStorage() {
        Range<Integer> range = Range.over(Storage.borrow(List.of(1, 2, 3, 4, 5)));

        Range<Integer> sub = range.narrow(1, 4);

        assertThat(sub.storage()).isSameAs(range.storage());
        assertThat(elements(sub)).containsExactly(2, 3, 4);
    }

    @Test
    void narrow_toSameBoundsReturnsSameRange() {
        Range<Integer> range = Range.over(Storage.borrow(List.of(1, 2)));

        assertThat(range.narrow(0, 2)).isSameAs(range);
    }

    @Test
    void narrow_cannotWiden() {
        Range<Integer> range = Range.over(Storage.borrow(List.of(1, 2, 3, 4))).narrow(1, 3);

        assertThatThrownBy(() -> range.narrow(0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> range.narrow(1, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> range.narrow(3, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsBoundsOutsideStorage() {
        Storage<Integer> storage = Storage.borrow(List.of(1, 2));

        assertThatThrownBy(() -> new Range<>(storage, -1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Range<>(storage, 0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Range<>(null, 0, 0)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void emptyRange_iteratorHasNothing() {
        Range<Integer> range = Range.over(Storage.borrow(List.of(1, 2))).narrow(1, 1);
        Iterator<Integer> it = range.iterator();

        assertThat(range.isEmpty()).isTrue();
        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void borrow_doesNotCopySource() {
        List<Integer> source = new ArrayList<>(List.of(1, 2, 3));
        Storage<Integer> storage = Storage.borrow(source);

        source.set(0, 42);

        assertThat(storage.isOwned()).isFalse();
        assertThat(storage.iterator(0, 1).next()).isEqualTo(42);
    }

    @Test
    void borrow_nonIndexedCollectionWalksFromStart() {
        TreeSet<String> source = new TreeSet<>(List.of("d", "a", "c", "b"));
        Range<String> range = Range.over(Storage.borrow(source)).narrow(1, 3);

        assertThat(elements(range)).containsExactly("b", "c");
    }

    @Test
    void borrow_linkedListUsesIteration() {
        LinkedList<Integer> source = new LinkedList<>(List.of(10, 20, 30, 40));
        Range<Integer> range = Range.over(Storage.borrow(source)).narrow(2, 4);

        assertThat(elements(range)).containsExactly(30, 40);
    }

    @Test
    void own_freezesContainer() {
        ArrayList<Integer> list = new ArrayList<>(List.of(7, 8));

        Storage<Integer> storage = Storage.own(list);
        Iterator<Integer> it = storage.iterator(0, storage.size());

        assertThat(storage.isOwned()).isTrue();
        assertThat(storage.size()).isEqualTo(2);
        assertThat(it.next()).isEqualTo(7);
        assertThatThrownBy(it::remove).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void own_ofSetIteratesInSetOrder() {
        TreeSet<Integer> set = new TreeSet<>(List.of(5, 2, 9));

        Storage<Integer> storage = Storage.own(set);
        List<Integer> seen = new ArrayList<>();
        storage.iterator(1, 3).forEachRemaining(seen::add);

        assertThat(storage.isOwned()).isTrue();
        assertThat(seen).containsExactly(5, 9);
    }

    @Test
    void borrow_rejectsNull() {
        assertThatThrownBy(() -> Storage.borrow(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("Source collection");
    }

    private static <E> List<E> elements(Range<E> range) {
        List<E> out = new ArrayList<>();
        range.iterator().forEachRemaining(out::add);
        return out;
    }
}
