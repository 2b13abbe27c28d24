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

package io.github.seqvec.util;

import io.github.seqvec.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for an in-place, iterative, randomized quicksort. Subclasses provide access to the
 * elements being sorted through a pivot slot, two comparisons against it and a swap, in the manner
 * of Lucene's {@code Sorter}.
 * <p>
 * Recursion is replaced by a fixed-size work-list holding the end bound of every pending
 * right-hand sub-range. Pivots are picked by a linear congruential generator that is reseeded on
 * every call, so that the same input always produces the same sequence of partitions. Partitioning
 * is Hoare-style: two scan pointers converge and swap the elements straddling the pivot value.
 * <p>
 * If the work-list is full, every pending bound is dropped and the current range is extended to the
 * outermost pending bound. All pending ranges lie to the right of the current range start, so the
 * merged range still covers them and the result stays sorted; only the running time suffers.
 * <p>
 * The sort is not stable.
 */
public abstract class QuickSorter {
    private static final Logger log = LoggerFactory.getLogger(QuickSorter.class);

    /**
     * Work-list capacity. Pending depth is not bounded by the input length, since the left partition
     * is always sorted first and unlucky pivots keep pushing bounds; overflow collapses the list.
     */
    public static final int DEFAULT_STACK_SIZE = 64;

    private static final int SEED = 31;
    private static final int LCG_MULTIPLIER = 69069;

    private final int stackSize;

    protected QuickSorter() {
        this(DEFAULT_STACK_SIZE);
    }

    @VisibleForTesting
    protected QuickSorter(int stackSize) {
        if (stackSize < 1) {
            throw new IllegalArgumentException("Work-list size must be positive: " + stackSize);
        }
        this.stackSize = stackSize;
    }

    /** Remembers the value at index {@code i} as the pivot of the current partition. */
    protected abstract void setPivot(int i);

    /** @return true if the element at index {@code j} is less than the pivot */
    protected abstract boolean lessThanPivot(int j);

    /** @return true if the pivot is less than the element at index {@code j} */
    protected abstract boolean pivotLessThan(int j);

    protected abstract void swap(int i, int j);

    /**
     * Sorts the elements in {@code [from, to)}.
     */
    public final void sort(int from, int to) {
        assert from >= 0 && from <= to : "Invalid range [" + from + ", " + to + ")";
        int[] stack = new int[stackSize];
        int pos = 0;
        int seed = SEED;
        int start = from;
        int end = to;

        while (true) {
            for (; start + 1 < end; ++end) {
                if (pos == stackSize) {
                    log.debug("Quicksort work-list full at {} pending ranges, merging them into [{}, {})",
                              pos, start, stack[0]);
                    pos = 0;
                    end = stack[0];
                }

                setPivot(start + Integer.remainderUnsigned(seed, end - start));
                seed = seed * LCG_MULTIPLIER + 1;
                stack[pos++] = end;

                int right = start - 1;
                while (true) {
                    do {
                        ++right;
                    } while (lessThanPivot(right));
                    do {
                        --end;
                    } while (pivotLessThan(end));
                    if (right >= end) {
                        break;
                    }
                    swap(right, end);
                }
                // [start, end] is now the left partition; the for-increment turns end into its exclusive bound
            }

            if (pos == 0) {
                break;
            }
            start = end;
            end = stack[--pos];
        }
    }
}
