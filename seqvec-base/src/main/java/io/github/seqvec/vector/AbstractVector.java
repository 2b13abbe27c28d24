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

import io.github.seqvec.memory.Allocator;
import io.github.seqvec.util.ArrayUtil;
import io.github.seqvec.util.RamUsageEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Capacity engine shared by every vector: tracks the element count and the allocated capacity of a
 * single backing array owned by the subclass, and implements amortized growth, reservation and
 * shrinking on top of two storage hooks.
 * <p>
 * Capacity is always zero or a power of two, and the backing array is absent exactly when the
 * capacity is zero. Every new backing array is first requested from the configured
 * {@link Allocator}; when storage cannot be obtained the operation reports
 * {@link Status#ALLOCATION_FAILURE} and the vector keeps its previous count, capacity and contents.
 * <p>
 * Vectors are not thread-safe. Callers must not retain references to the backing array across
 * calls that may reallocate it.
 */
public abstract class AbstractVector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AbstractVector.class);

    /** Index returned by search operations that find no matching element. */
    public static final int INDEX_NOT_FOUND = -1;

    /** Capacity of the first backing array created by an append. */
    static final int INITIAL_CAPACITY = 2;

    protected final VectorOptions options;
    protected int count;
    protected int allocated;

    protected AbstractVector(VectorOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /** @return the size of one slot of the backing array, in bytes */
    protected abstract int slotBytes();

    /**
     * Replaces the backing array by one of {@code capacity} slots that holds the first {@code count}
     * elements of the current one. Creates the array if there is none yet.
     */
    protected abstract void resizeStorage(int capacity);

    /** Drops the backing array. */
    protected abstract void releaseStorage();

    public final int count() {
        return count;
    }

    public final boolean isEmpty() {
        return count == 0;
    }

    /** @return the number of slots of the backing array */
    public final int capacity() {
        return allocated;
    }

    public final VectorOptions options() {
        return options;
    }

    /**
     * Ensures room for at least {@code capacity} elements, rounding up to the next power of two.
     */
    public final Status reserveCapacity(int capacity) {
        if (capacity <= allocated) {
            return Status.OK;
        }
        int maxCapacity = options.indexWidth().maxCapacity();
        if (capacity > maxCapacity) {
            log.debug("Requested capacity {} exceeds the {} maximum of {}", capacity, options.indexWidth(), maxCapacity);
            return Status.ALLOCATION_FAILURE;
        }
        return reallocate(ArrayUtil.nextPowerOfTwo(capacity));
    }

    /**
     * Ensures room for {@code n} more elements than are currently stored.
     */
    public final Status expand(int n) {
        assert n >= 0 : "Negative expansion " + n;
        long required = (long) count + n;
        if (required > Integer.MAX_VALUE) {
            return Status.ALLOCATION_FAILURE;
        }
        return reserveCapacity((int) required);
    }

    /**
     * Reduces capacity to the smallest power of two that holds the current elements, or drops the
     * backing array entirely if the vector is empty.
     * <p>
     * A non-empty vector moves its elements to a new, smaller array, which is requested from the
     * allocator before the current array is released. An allocator at its limit may therefore
     * refuse the shrink with {@link Status#ALLOCATION_FAILURE}, leaving the vector unchanged.
     * Emptying the vector first always succeeds.
     */
    public final Status shrink() {
        if (count == 0) {
            freeStorage();
            return Status.OK;
        }
        int capacity = ArrayUtil.nextPowerOfTwo(count);
        return capacity < allocated ? reallocate(capacity) : Status.OK;
    }

    /**
     * Removes every element but keeps the backing array.
     */
    public void removeAll() {
        count = 0;
    }

    /**
     * Releases the backing array and resets the vector to its initial empty state. The vector may be
     * used again afterwards.
     */
    @Override
    public void close() {
        freeStorage();
        count = 0;
    }

    /**
     * Doubles capacity, starting from {@link #INITIAL_CAPACITY}, if the next append would not fit.
     */
    protected final Status expandIfRequired() {
        if (count < allocated) {
            return Status.OK;
        }
        if (allocated >= options.indexWidth().maxCapacity()) {
            log.debug("Vector is full at the {} maximum of {} elements", options.indexWidth(), allocated);
            return Status.ALLOCATION_FAILURE;
        }
        return reallocate(allocated == 0 ? INITIAL_CAPACITY : allocated * 2);
    }

    private Status reallocate(int capacity) {
        Allocator allocator = options.allocator();
        long bytes = RamUsageEstimator.sizeOfArray(capacity, slotBytes());
        if (!allocator.allocate(bytes)) {
            return Status.ALLOCATION_FAILURE;
        }
        try {
            resizeStorage(capacity);
        } catch (OutOfMemoryError e) {
            allocator.release(bytes);
            log.warn("Could not allocate {} slots ({} bytes)", capacity, bytes, e);
            return Status.ALLOCATION_FAILURE;
        }
        allocator.release(RamUsageEstimator.sizeOfArray(allocated, slotBytes()));
        allocated = capacity;
        return Status.OK;
    }

    private void freeStorage() {
        if (allocated == 0) {
            return;
        }
        releaseStorage();
        options.allocator().release(RamUsageEstimator.sizeOfArray(allocated, slotBytes()));
        allocated = 0;
    }
}
