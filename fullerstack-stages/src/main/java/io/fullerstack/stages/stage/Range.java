package io.fullerstack.stages.stage;

import java.util.Iterator;
import java.util.Objects;

/**
 * A half-open window {@code [start, end)} into some {@link Storage}.
 *
 * <p>A range never copies or owns the elements it covers. Narrowing produces a new range over the
 * same storage whose bounds lie inside this one.
 *
 * @param storage the elements this range reads from
 * @param start first position, inclusive
 * @param end last position, exclusive
 * @param <E> element type
 */
record Range<E>(Storage<E> storage, int start, int end) {

    /**
     * @throws NullPointerException if storage is null
     * @throws IllegalArgumentException if the bounds do not satisfy {@code 0 <= start <= end <= storage.size()}
     */
    Range {
        Objects.requireNonNull(storage, "Range storage cannot be null");
        if (start < 0 || start > end || end > storage.size()) {
            throw new IllegalArgumentException(
                "Invalid range [" + start + ", " + end + ") over storage of size " + storage.size()
            );
        }
    }

    /**
     * Covers every element of the given storage.
     *
     * @param storage the storage
     * @param <E> element type
     * @return a range over {@code [0, storage.size())}
     */
    static <E> Range<E> over(Storage<E> storage) {
        Objects.requireNonNull(storage, "Range storage cannot be null");
        return new Range<>(storage, 0, storage.size());
    }

    /**
     * Returns a sub-range over the same storage.
     *
     * @param newStart new start, must not precede {@link #start()}
     * @param newEnd new end, must not pass {@link #end()}
     * @return the narrowed range
     * @throws IllegalArgumentException if the new bounds would widen this range
     */
    Range<E> narrow(int newStart, int newEnd) {
        if (newStart < start || newEnd > end || newStart > newEnd) {
            throw new IllegalArgumentException(
                "Cannot narrow [" + start + ", " + end + ") to [" + newStart + ", " + newEnd + ")"
            );
        }
        if (newStart == start && newEnd == end) {
            return this;
        }
        return new Range<>(storage, newStart, newEnd);
    }

    int size() {
        return end - start;
    }

    boolean isEmpty() {
        return start == end;
    }

    Iterator<E> iterator() {
        return storage.iterator(start, end);
    }

    @Override
    public String toString() {
        return "Range[" + start + ", " + end + ") over " + storage;
    }
}
