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

import java.util.Objects;

/**
 * An {@link ObjectVector} whose elements can be compared for equality with an injected
 * {@link Equality}, enabling linear search and set-like queries.
 * <p>
 * When the predicate is {@link Equality#IDENTITY}, comparisons read the backing arrays directly.
 *
 * @param <T> the element type
 */
public class EquatableVector<T> extends ObjectVector<T> {
    protected final Equality<? super T> equality;
    private final boolean identity;

    public EquatableVector(Equality<? super T> equality) {
        this(equality, VectorOptions.DEFAULT);
    }

    public EquatableVector(Equality<? super T> equality, VectorOptions options) {
        super(options);
        this.equality = Objects.requireNonNull(equality, "equality");
        this.identity = equality == Equality.IDENTITY;
    }

    public Equality<? super T> equality() {
        return equality;
    }

    @Override
    protected EquatableVector<T> emptyCopy() {
        return new EquatableVector<>(equality, options);
    }

    @Override
    public EquatableVector<T> copy() {
        return (EquatableVector<T>) super.copy();
    }

    /**
     * @return the index of the first element equal to {@code item}, or {@link #INDEX_NOT_FOUND}
     */
    public int indexOf(T item) {
        for (int i = 0; i < count; i++) {
            if (equality.equal(elementAt(i), item)) {
                return i;
            }
        }
        return INDEX_NOT_FOUND;
    }

    /**
     * @return the index of the last element equal to {@code item}, or {@link #INDEX_NOT_FOUND}
     */
    public int indexOfReverse(T item) {
        for (int i = count - 1; i >= 0; i--) {
            if (equality.equal(elementAt(i), item)) {
                return i;
            }
        }
        return INDEX_NOT_FOUND;
    }

    public boolean contains(T item) {
        return indexOf(item) != INDEX_NOT_FOUND;
    }

    /**
     * Appends {@code item} unless an equal element is already stored.
     *
     * @return {@link Status#ALREADY_PRESENT} if nothing was appended
     */
    public Status pushUnique(T item) {
        if (contains(item)) {
            return Status.ALREADY_PRESENT;
        }
        return push(item);
    }

    /**
     * Removes the first element equal to {@code item}.
     *
     * @return true if an element was removed
     */
    public boolean remove(T item) {
        int i = indexOf(item);
        if (i == INDEX_NOT_FOUND) {
            return false;
        }
        removeAt(i);
        return true;
    }

    /**
     * @return true if both vectors hold the same number of elements and every pair at the same
     *         position is equal
     */
    public boolean contentEquals(ObjectVector<? extends T> other) {
        if (this == other) {
            return true;
        }
        if (count != other.count) {
            return false;
        }
        if (identity) {
            for (int i = 0; i < count; i++) {
                if (storage[i] != other.storage[i]) {
                    return false;
                }
            }
            return true;
        }
        for (int i = 0; i < count; i++) {
            if (!equality.equal(elementAt(i), other.elementAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if every element of {@code other} is contained in this vector
     */
    public boolean containsAll(ObjectVector<? extends T> other) {
        if (this == other) {
            return true;
        }
        for (int i = 0; i < other.count; i++) {
            if (!contains(other.elementAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if at least one element of {@code other} is contained in this vector
     */
    public boolean containsAny(ObjectVector<? extends T> other) {
        if (this == other) {
            return true;
        }
        for (int i = 0; i < other.count; i++) {
            if (contains(other.elementAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pushes every element of {@code other} that this vector does not contain yet, in order.
     * <p>
     * Room for all of {@code other} is reserved up front, so either every missing element is pushed
     * or, on {@link Status#ALLOCATION_FAILURE}, none is. The reservation counts duplicates too.
     */
    public Status appendUnique(ObjectVector<? extends T> other) {
        if (other == this) {
            return Status.OK;
        }
        Status status = expand(other.count);
        if (status != Status.OK) {
            return status;
        }
        for (int i = 0; i < other.count; i++) {
            pushUnique(other.elementAt(i));
        }
        return Status.OK;
    }

    /**
     * Removes the first occurrence of every element of {@code other}.
     */
    public void removeAllFrom(ObjectVector<? extends T> other) {
        if (this == other) {
            removeAll();
            return;
        }
        for (int i = 0; i < other.count; i++) {
            remove(other.elementAt(i));
        }
    }
}
