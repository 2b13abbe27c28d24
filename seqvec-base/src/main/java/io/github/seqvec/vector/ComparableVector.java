/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.seqvec.vector;

import io.github.seqvec.util.ArrayUtil;
import io.github.seqvec.util.QuickSorter;

import java.util.Objects;

/**
 * An {@link EquatableVector} whose elements are also ordered by an injected {@link LessThan}
 * predicate. Adds min/max scans, an in-place quicksort and, for vectors kept sorted by that
 * predicate, lower-bound search and sorted insertion.
 * <p>
 * The predicates must agree: two elements that are equal must not be less than one another.
 *
 * @param <T> the element type
 */
public class ComparableVector<T> extends EquatableVector<T> {
    protected final LessThan<? super T> lessThan;

    public ComparableVector(Equality<? super T> equality, LessThan<? super T> lessThan) {
        this(equality, lessThan, VectorOptions.DEFAULT);
    }

    public ComparableVector(Equality<? super T> equality, LessThan<? super T> lessThan, VectorOptions options) {
        super(equality, options);
        this.lessThan = Objects.requireNonNull(lessThan, "lessThan");
    }

    /**
     * @return a vector ordered by {@link Comparable#compareTo} and compared with {@link Object#equals}
     */
    public static <T extends Comparable<? super T>> ComparableVector<T> natural() {
        return natural(VectorOptions.DEFAULT);
    }

    public static <T extends Comparable<? super T>> ComparableVector<T> natural(VectorOptions options) {
        return new ComparableVector<>(Equality.natural(), LessThan.<T>natural(), options);
    }

    public LessThan<? super T> lessThan() {
        return lessThan;
    }

    @Override
    protected ComparableVector<T> emptyCopy() {
        return new ComparableVector<>(equality, lessThan, options);
    }

    @Override
    public ComparableVector<T> copy() {
        return (ComparableVector<T>) super.copy();
    }

    /**
     * @return the index of the first smallest element, or {@link #INDEX_NOT_FOUND} if empty
     */
    public int indexOfMin() {
        if (count == 0) {
            return INDEX_NOT_FOUND;
        }
        int min = 0;
        for (int i = 1; i < count; i++) {
            if (lessThan.lessThan(elementAt(i), elementAt(min))) {
                min = i;
            }
        }
        return min;
    }

    /**
     * @return the index of the first largest element, or {@link #INDEX_NOT_FOUND} if empty
     */
    public int indexOfMax() {
        if (count == 0) {
            return INDEX_NOT_FOUND;
        }
        int max = 0;
        for (int i = 1; i < count; i++) {
            if (lessThan.lessThan(elementAt(max), elementAt(i))) {
                max = i;
            }
        }
        return max;
    }

    public void sort() {
        sortRange(0, count);
    }

    /**
     * Sorts {@code len} elements starting at {@code start} in place. The sort is not stable.
     *
     * @see QuickSorter
     */
    public void sortRange(int start, int len) {
        assert start >= 0 && len >= 0 && start + len <= count : "Invalid range " + start + "+" + len + " for count " + count;
        new Sorter().sort(start, start + len);
    }

    /**
     * Finds where {@code item} belongs in a vector sorted by the less-than predicate: the leftmost
     * index {@code i} such that every element before {@code i} is less than {@code item}. Equal
     * elements therefore follow the returned index.
     * <p>
     * Halves the window while it is wider than a cache line's worth of slots, then scans it linearly.
     */
    public int insertionIndexSorted(T item) {
        int threshold = options.linearSearchThreshold(slotBytes());
        int l = 0;
        int r = count;

        while (r - l > threshold) {
            int m = l + (r - l) / 2;
            if (lessThan.lessThan(elementAt(m), item)) {
                l = m + 1;
            } else {
                r = m;
            }
        }

        while (l < r && lessThan.lessThan(elementAt(l), item)) {
            l++;
        }
        return l;
    }

    /**
     * @return the index of the first element equal to {@code item} in a sorted vector, or
     *         {@link #INDEX_NOT_FOUND}
     */
    public int indexOfSorted(T item) {
        int i = insertionIndexSorted(item);
        return i < count && equality.equal(elementAt(i), item) ? i : INDEX_NOT_FOUND;
    }

    public boolean containsSorted(T item) {
        return indexOfSorted(item) != INDEX_NOT_FOUND;
    }

    /**
     * Inserts {@code item} at its lower-bound position, keeping a sorted vector sorted.
     */
    public Status insertSorted(T item) {
        return insertAt(insertionIndexSorted(item), item);
    }

    /**
     * Like {@link #insertSorted}, unless an equal element already occupies the insertion index.
     *
     * @return {@link Status#ALREADY_PRESENT} if nothing was inserted
     */
    public Status insertSortedUnique(T item) {
        int i = insertionIndexSorted(item);
        if (i < count && equality.equal(elementAt(i), item)) {
            return Status.ALREADY_PRESENT;
        }
        return insertAt(i, item);
    }

    /**
     * Inserts every element of {@code other} at its sorted position. Either all of them are inserted
     * or, on {@link Status#ALLOCATION_FAILURE}, none is.
     */
    public Status insertAllSorted(ObjectVector<? extends T> other) {
        if (other == this) {
            ComparableVector<T> snapshot = copy();
            if (snapshot == null) {
                return Status.ALLOCATION_FAILURE;
            }
            try {
                return insertAllSorted(snapshot);
            } finally {
                snapshot.close();
            }
        }
        Status status = expand(other.count);
        if (status != Status.OK) {
            return status;
        }
        for (int i = 0; i < other.count; i++) {
            insertSorted(other.elementAt(i));
        }
        return Status.OK;
    }

    /**
     * Inserts every element of {@code other} that is not already stored at its sorted position.
     * Room for all of {@code other} is reserved first, duplicates included, so a failure inserts
     * nothing.
     */
    public Status insertAllSortedUnique(ObjectVector<? extends T> other) {
        if (other == this) {
            return Status.OK;
        }
        Status status = expand(other.count);
        if (status != Status.OK) {
            return status;
        }
        for (int i = 0; i < other.count; i++) {
            insertSortedUnique(other.elementAt(i));
        }
        return Status.OK;
    }

    private final class Sorter extends QuickSorter {
        private T pivot;

        @Override
        protected void setPivot(int i) {
            pivot = elementAt(i);
        }

        @Override
        protected boolean lessThanPivot(int j) {
            return lessThan.lessThan(elementAt(j), pivot);
        }

        @Override
        protected boolean pivotLessThan(int j) {
            return lessThan.lessThan(pivot, elementAt(j));
        }

        @Override
        protected void swap(int i, int j) {
            ArrayUtil.swap(storage, i, j);
        }
    }
}
