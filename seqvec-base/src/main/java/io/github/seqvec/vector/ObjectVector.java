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
import io.github.seqvec.util.RamUsageEstimator;

import java.util.Arrays;
import java.util.Comparator;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A growable, contiguous sequence of references with amortized O(1) append.
 * <p>
 * This class provides the storage operations only. {@link EquatableVector} adds searches driven by
 * an equality predicate, and {@link ComparableVector} adds ordered search, sorted insertion and
 * sorting driven by a less-than predicate.
 * <p>
 * Index arguments are not validated beyond Java's own array bounds checks: reading past
 * {@link #count()}, or popping an empty vector, is a caller error.
 *
 * @param <T> the element type
 */
public class ObjectVector<T> extends AbstractVector {
    protected Object[] storage;

    public ObjectVector() {
        this(VectorOptions.DEFAULT);
    }

    public ObjectVector(VectorOptions options) {
        super(options);
    }

    @SafeVarargs
    public static <T> ObjectVector<T> of(T... items) {
        ObjectVector<T> vector = new ObjectVector<>();
        vector.appendArray(items, items.length);
        return vector;
    }

    /**
     * Creates an empty vector of the same kind, options and predicates as this one.
     */
    protected ObjectVector<T> emptyCopy() {
        return new ObjectVector<>(options);
    }

    @Override
    protected int slotBytes() {
        return RamUsageEstimator.NUM_BYTES_OBJECT_REF;
    }

    @Override
    protected void resizeStorage(int capacity) {
        storage = storage == null ? new Object[capacity] : Arrays.copyOf(storage, capacity);
    }

    @Override
    protected void releaseStorage() {
        storage = null;
    }

    @SuppressWarnings("unchecked")
    protected final T elementAt(int i) {
        return (T) storage[i];
    }

    public T get(int i) {
        assert i >= 0 && i < count : "Index " + i + " out of bounds for count " + count;
        return elementAt(i);
    }

    public void set(int i, T item) {
        assert i >= 0 && i < count : "Index " + i + " out of bounds for count " + count;
        storage[i] = item;
    }

    public T first() {
        return get(0);
    }

    public T last() {
        return get(count - 1);
    }

    /**
     * Appends {@code item}, doubling capacity if the vector is full.
     */
    public Status push(T item) {
        Status status = expandIfRequired();
        if (status != Status.OK) {
            return status;
        }
        storage[count++] = item;
        return Status.OK;
    }

    /**
     * Removes and returns the last element. The vector must not be empty.
     */
    public T pop() {
        assert count > 0 : "pop() on an empty vector";
        T item = elementAt(--count);
        storage[count] = null;
        return item;
    }

    /**
     * Inserts {@code item} at index {@code i}, moving the elements from {@code i} onwards one slot to
     * the right. {@code i == count()} appends.
     */
    public Status insertAt(int i, T item) {
        assert i >= 0 && i <= count : "Insertion index " + i + " out of bounds for count " + count;
        Status status = expandIfRequired();
        if (status != Status.OK) {
            return status;
        }
        System.arraycopy(storage, i, storage, i + 1, count - i);
        storage[i] = item;
        count++;
        return Status.OK;
    }

    /**
     * Removes and returns the element at index {@code i}, moving the elements after it one slot to
     * the left.
     */
    public T removeAt(int i) {
        assert i >= 0 && i < count : "Index " + i + " out of bounds for count " + count;
        T item = elementAt(i);
        System.arraycopy(storage, i + 1, storage, i, count - i - 1);
        storage[--count] = null;
        return item;
    }

    @Override
    public void removeAll() {
        if (storage != null) {
            Arrays.fill(storage, 0, count, null);
        }
        super.removeAll();
    }

    public Status appendArray(T[] array, int n) {
        return appendArray(array, 0, n);
    }

    /**
     * Appends {@code n} elements of {@code array} starting at {@code offset}, with a single capacity
     * check and a single block copy.
     */
    public Status appendArray(T[] array, int offset, int n) {
        return appendSlots(array, offset, n);
    }

    /**
     * Appends every element of {@code other}, which may be this vector.
     */
    public Status append(ObjectVector<? extends T> other) {
        return appendSlots(other.storage, 0, other.count);
    }

    @SafeVarargs
    public final Status appendItems(T... items) {
        return appendSlots(items, 0, items.length);
    }

    private Status appendSlots(Object[] source, int offset, int n) {
        if (n == 0 || source == null) {
            return Status.OK;
        }
        Status status = expand(n);
        if (status != Status.OK) {
            return status;
        }
        System.arraycopy(source, offset, storage, count, n);
        count += n;
        return Status.OK;
    }

    public void reverse() {
        ArrayUtil.reverse(storage, count);
    }

    /**
     * Creates a vector with the same options, predicates and elements, backed by its own storage.
     *
     * @return the copy, or null if its storage could not be allocated
     */
    public ObjectVector<T> copy() {
        ObjectVector<T> copy = emptyCopy();
        if (copy.appendSlots(storage, 0, count) != Status.OK) {
            copy.close();
            return null;
        }
        return copy;
    }

    /**
     * Like {@link #copy()}, but stores {@code copyFunction.apply(e)} for every element {@code e},
     * in order.
     *
     * @return the copy, or null if its storage could not be allocated
     */
    public ObjectVector<T> deepCopy(UnaryOperator<T> copyFunction) {
        ObjectVector<T> copy = emptyCopy();
        if (copy.reserveCapacity(count) != Status.OK) {
            copy.close();
            return null;
        }
        for (int i = 0; i < count; i++) {
            copy.storage[i] = copyFunction.apply(elementAt(i));
        }
        copy.count = count;
        return copy;
    }

    /**
     * Copies the elements into the first {@link #count()} slots of {@code array}.
     */
    public void copyToArray(T[] array) {
        if (count > 0) {
            System.arraycopy(storage, 0, array, 0, count);
        }
    }

    public Object[] toArray() {
        return count == 0 ? new Object[0] : Arrays.copyOf(storage, count);
    }

    public void forEach(Consumer<? super T> action) {
        for (int i = 0; i < count; i++) {
            action.accept(elementAt(i));
        }
    }

    /**
     * @return the index of the first element matching {@code predicate}, or {@link #INDEX_NOT_FOUND}
     */
    public int firstIndexWhere(Predicate<? super T> predicate) {
        for (int i = 0; i < count; i++) {
            if (predicate.test(elementAt(i))) {
                return i;
            }
        }
        return INDEX_NOT_FOUND;
    }

    public boolean containsWhere(Predicate<? super T> predicate) {
        return firstIndexWhere(predicate) != INDEX_NOT_FOUND;
    }

    /**
     * Removes the first element matching {@code predicate}.
     *
     * @return true if an element was removed
     */
    public boolean removeFirstWhere(Predicate<? super T> predicate) {
        int i = firstIndexWhere(predicate);
        if (i == INDEX_NOT_FOUND) {
            return false;
        }
        removeAt(i);
        return true;
    }

    /**
     * Removes every element matching {@code predicate} in a single compacting pass. The remaining
     * elements keep their relative order.
     *
     * @return the number of elements removed
     */
    public int removeWhere(Predicate<? super T> predicate) {
        int kept = 0;
        for (int i = 0; i < count; i++) {
            T item = elementAt(i);
            if (!predicate.test(item)) {
                storage[kept++] = item;
            }
        }
        int removed = count - kept;
        if (removed > 0) {
            Arrays.fill(storage, kept, count, null);
            count = kept;
        }
        return removed;
    }

    public void qsort(Comparator<? super T> comparator) {
        qsortRange(0, count, comparator);
    }

    /**
     * Sorts {@code len} elements starting at {@code start} with an ad hoc comparator, independently of
     * any ordering the vector was created with.
     */
    @SuppressWarnings("unchecked")
    public void qsortRange(int start, int len, Comparator<? super T> comparator) {
        assert start >= 0 && len >= 0 && start + len <= count : "Invalid range " + start + "+" + len + " for count " + count;
        if (len > 1) {
            Arrays.sort(storage, start, start + len, (Comparator<Object>) comparator);
        }
    }

    /**
     * Passes every element to {@code destroy}, in order, then releases the storage.
     */
    public void close(Consumer<? super T> destroy) {
        forEach(destroy);
        close();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(getClass().getSimpleName()).append('(');
        sb.append(count).append('/').append(allocated).append(") [");
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(storage[i]);
        }
        return sb.append(']').toString();
    }
}
