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

import java.util.Arrays;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;
import java.util.function.IntUnaryOperator;

/**
 * A growable, contiguous sequence of {@code int} values backed by an {@code int[]}.
 * <p>
 * Elements are compared with {@code ==} and ordered with {@code <}, so equality checks between
 * vectors compare the backing arrays in bulk, and none of the operations box. Apart from that,
 * the operations and their contracts are those of {@link ObjectVector}, {@link EquatableVector} and
 * {@link ComparableVector}.
 */
public class IntVector extends AbstractVector {
    private int[] storage;

    public IntVector() {
        this(VectorOptions.DEFAULT);
    }

    public IntVector(VectorOptions options) {
        super(options);
    }

    public static IntVector of(int... values) {
        IntVector vector = new IntVector();
        vector.appendArray(values, values.length);
        return vector;
    }

    @Override
    protected int slotBytes() {
        return Integer.BYTES;
    }

    @Override
    protected void resizeStorage(int capacity) {
        storage = storage == null ? new int[capacity] : Arrays.copyOf(storage, capacity);
    }

    @Override
    protected void releaseStorage() {
        storage = null;
    }

    // storage

    public int get(int i) {
        assert i >= 0 && i < count : "Index " + i + " out of bounds for count " + count;
        return storage[i];
    }

    public void set(int i, int value) {
        assert i >= 0 && i < count : "Index " + i + " out of bounds for count " + count;
        storage[i] = value;
    }

    public int first() {
        return get(0);
    }

    public int last() {
        return get(count - 1);
    }

    public Status push(int value) {
        Status status = expandIfRequired();
        if (status != Status.OK) {
            return status;
        }
        storage[count++] = value;
        return Status.OK;
    }

    public int pop() {
        assert count > 0 : "pop() on an empty vector";
        return storage[--count];
    }

    public Status insertAt(int i, int value) {
        assert i >= 0 && i <= count : "Insertion index " + i + " out of bounds for count " + count;
        Status status = expandIfRequired();
        if (status != Status.OK) {
            return status;
        }
        System.arraycopy(storage, i, storage, i + 1, count - i);
        storage[i] = value;
        count++;
        return Status.OK;
    }

    public int removeAt(int i) {
        assert i >= 0 && i < count : "Index " + i + " out of bounds for count " + count;
        int value = storage[i];
        System.arraycopy(storage, i + 1, storage, i, count - i - 1);
        count--;
        return value;
    }

    public Status appendArray(int[] array, int n) {
        return appendArray(array, 0, n);
    }

    public Status appendArray(int[] array, int offset, int n) {
        if (n == 0 || array == null) {
            return Status.OK;
        }
        Status status = expand(n);
        if (status != Status.OK) {
            return status;
        }
        System.arraycopy(array, offset, storage, count, n);
        count += n;
        return Status.OK;
    }

    public Status append(IntVector other) {
        return appendArray(other.storage, 0, other.count);
    }

    public Status appendItems(int... values) {
        return appendArray(values, 0, values.length);
    }

    public void reverse() {
        ArrayUtil.reverse(storage, count);
    }

    /**
     * @return a vector with the same options and elements backed by its own storage, or null if that
     *         storage could not be allocated
     */
    public IntVector copy() {
        IntVector copy = new IntVector(options);
        if (copy.appendArray(storage, 0, count) != Status.OK) {
            copy.close();
            return null;
        }
        return copy;
    }

    public IntVector deepCopy(IntUnaryOperator copyFunction) {
        IntVector copy = new IntVector(options);
        if (copy.reserveCapacity(count) != Status.OK) {
            copy.close();
            return null;
        }
        for (int i = 0; i < count; i++) {
            copy.storage[i] = copyFunction.applyAsInt(storage[i]);
        }
        copy.count = count;
        return copy;
    }

    public void copyToArray(int[] array) {
        if (count > 0) {
            System.arraycopy(storage, 0, array, 0, count);
        }
    }

    public int[] toArray() {
        return count == 0 ? new int[0] : Arrays.copyOf(storage, count);
    }

    public void forEach(IntConsumer action) {
        for (int i = 0; i < count; i++) {
            action.accept(storage[i]);
        }
    }

    public int firstIndexWhere(IntPredicate predicate) {
        for (int i = 0; i < count; i++) {
            if (predicate.test(storage[i])) {
                return i;
            }
        }
        return INDEX_NOT_FOUND;
    }

    public boolean containsWhere(IntPredicate predicate) {
        return firstIndexWhere(predicate) != INDEX_NOT_FOUND;
    }

    public boolean removeFirstWhere(IntPredicate predicate) {
        int i = firstIndexWhere(predicate);
        if (i == INDEX_NOT_FOUND) {
            return false;
        }
        removeAt(i);
        return true;
    }

    /**
     * @return the number of values removed
     * @see ObjectVector#removeWhere
     */
    public int removeWhere(IntPredicate predicate) {
        int kept = 0;
        for (int i = 0; i < count; i++) {
            int value = storage[i];
            if (!predicate.test(value)) {
                storage[kept++] = value;
            }
        }
        int removed = count - kept;
        count = kept;
        return removed;
    }

    public void qsort(IntComparator comparator) {
        qsortRange(0, count, comparator);
    }

    /**
     * Sorts {@code len} values starting at {@code start} by an ad hoc three-way comparator instead of
     * {@code <}. The sort is not stable.
     */
    public void qsortRange(int start, int len, IntComparator comparator) {
        assert start >= 0 && len >= 0 && start + len <= count : "Invalid range " + start + "+" + len + " for count " + count;
        new ComparatorSorter(comparator).sort(start, start + len);
    }

    // equatable

    public int indexOf(int value) {
        for (int i = 0; i < count; i++) {
            if (storage[i] == value) {
                return i;
            }
        }
        return INDEX_NOT_FOUND;
    }

    public int indexOfReverse(int value) {
        for (int i = count - 1; i >= 0; i--) {
            if (storage[i] == value) {
                return i;
            }
        }
        return INDEX_NOT_FOUND;
    }

    public boolean contains(int value) {
        return indexOf(value) != INDEX_NOT_FOUND;
    }

    public Status pushUnique(int value) {
        return contains(value) ? Status.ALREADY_PRESENT : push(value);
    }

    public boolean remove(int value) {
        int i = indexOf(value);
        if (i == INDEX_NOT_FOUND) {
            return false;
        }
        removeAt(i);
        return true;
    }

    public boolean contentEquals(IntVector other) {
        if (this == other) {
            return true;
        }
        if (count != other.count) {
            return false;
        }
        return count == 0 || Arrays.equals(storage, 0, count, other.storage, 0, count);
    }

    public boolean containsAll(IntVector other) {
        if (this == other) {
            return true;
        }
        for (int i = 0; i < other.count; i++) {
            if (!contains(other.storage[i])) {
                return false;
            }
        }
        return true;
    }

    public boolean containsAny(IntVector other) {
        if (this == other) {
            return true;
        }
        for (int i = 0; i < other.count; i++) {
            if (contains(other.storage[i])) {
                return true;
            }
        }
        return false;
    }

    /**
     * @see EquatableVector#appendUnique
     */
    public Status appendUnique(IntVector other) {
        if (other == this) {
            return Status.OK;
        }
        Status status = expand(other.count);
        if (status != Status.OK) {
            return status;
        }
        for (int i = 0; i < other.count; i++) {
            pushUnique(other.storage[i]);
        }
        return Status.OK;
    }

    public void removeAllFrom(IntVector other) {
        if (this == other) {
            removeAll();
            return;
        }
        for (int i = 0; i < other.count; i++) {
            remove(other.storage[i]);
        }
    }

    // comparable

    public int indexOfMin() {
        if (count == 0) {
            return INDEX_NOT_FOUND;
        }
        int min = 0;
        for (int i = 1; i < count; i++) {
            if (storage[i] < storage[min]) {
                min = i;
            }
        }
        return min;
    }

    public int indexOfMax() {
        if (count == 0) {
            return INDEX_NOT_FOUND;
        }
        int max = 0;
        for (int i = 1; i < count; i++) {
            if (storage[max] < storage[i]) {
                max = i;
            }
        }
        return max;
    }

    public void sort() {
        sortRange(0, count);
    }

    public void sortRange(int start, int len) {
        assert start >= 0 && len >= 0 && start + len <= count : "Invalid range " + start + "+" + len + " for count " + count;
        new Sorter().sort(start, start + len);
    }

    /**
     * @return the leftmost index whose preceding values are all less than {@code value}
     * @see ComparableVector#insertionIndexSorted
     */
    public int insertionIndexSorted(int value) {
        int threshold = options.linearSearchThreshold(Integer.BYTES);
        int l = 0;
        int r = count;

        while (r - l > threshold) {
            int m = l + (r - l) / 2;
            if (storage[m] < value) {
                l = m + 1;
            } else {
                r = m;
            }
        }

        while (l < r && storage[l] < value) {
            l++;
        }
        return l;
    }

    public int indexOfSorted(int value) {
        int i = insertionIndexSorted(value);
        return i < count && storage[i] == value ? i : INDEX_NOT_FOUND;
    }

    public boolean containsSorted(int value) {
        return indexOfSorted(value) != INDEX_NOT_FOUND;
    }

    public Status insertSorted(int value) {
        return insertAt(insertionIndexSorted(value), value);
    }

    public Status insertSortedUnique(int value) {
        int i = insertionIndexSorted(value);
        if (i < count && storage[i] == value) {
            return Status.ALREADY_PRESENT;
        }
        return insertAt(i, value);
    }

    public Status insertAllSorted(IntVector other) {
        // a snapshot, since inserting into ourselves would shift the values still to be read
        int[] values = other.toArray();
        Status status = expand(values.length);
        if (status != Status.OK) {
            return status;
        }
        for (int value : values) {
            insertSorted(value);
        }
        return Status.OK;
    }

    public Status insertAllSortedUnique(IntVector other) {
        if (other == this) {
            return Status.OK;
        }
        Status status = expand(other.count);
        if (status != Status.OK) {
            return status;
        }
        for (int i = 0; i < other.count; i++) {
            insertSortedUnique(other.storage[i]);
        }
        return Status.OK;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntVector && contentEquals((IntVector) o);
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = 0; i < count; i++) {
            h = 31 * h + storage[i];
        }
        return h;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("IntVector(");
        sb.append(count).append('/').append(allocated).append(") [");
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(storage[i]);
        }
        return sb.append(']').toString();
    }

    /**
     * Three-way comparison of two {@code int} values, negative, zero or positive as the first is less
     * than, equal to or greater than the second.
     */
    @FunctionalInterface
    public interface IntComparator {
        int compare(int a, int b);
    }

    private final class Sorter extends QuickSorter {
        private int pivot;

        @Override
        protected void setPivot(int i) {
            pivot = storage[i];
        }

        @Override
        protected boolean lessThanPivot(int j) {
            return storage[j] < pivot;
        }

        @Override
        protected boolean pivotLessThan(int j) {
            return pivot < storage[j];
        }

        @Override
        protected void swap(int i, int j) {
            ArrayUtil.swap(storage, i, j);
        }
    }

    private final class ComparatorSorter extends QuickSorter {
        private final IntComparator comparator;
        private int pivot;

        ComparatorSorter(IntComparator comparator) {
            this.comparator = comparator;
        }

        @Override
        protected void setPivot(int i) {
            pivot = storage[i];
        }

        @Override
        protected boolean lessThanPivot(int j) {
            return comparator.compare(storage[j], pivot) < 0;
        }

        @Override
        protected boolean pivotLessThan(int j) {
            return comparator.compare(pivot, storage[j]) < 0;
        }

        @Override
        protected void swap(int i, int j) {
            ArrayUtil.swap(storage, i, j);
        }
    }
}
