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

/**
 * Width of the unsigned integer used to count elements, which bounds the capacity of a vector.
 * Capacities are powers of two, so the largest one is the highest power of two the width can
 * represent, further capped by what a Java array can hold.
 */
public enum IndexWidth {
    /** 16-bit counts, for many small vectors. */
    TINY(16),

    /** 32-bit counts. */
    STANDARD(32);

    private final int bits;
    private final int maxCapacity;

    IndexWidth(int bits) {
        this.bits = bits;
        this.maxCapacity = (int) Math.min(1L << (bits - 1), ArrayUtil.MAX_POWER_OF_TWO);
    }

    public int bits() {
        return bits;
    }

    /**
     * @return the largest capacity, and therefore count, a vector of this width can reach
     */
    public int maxCapacity() {
        return maxCapacity;
    }
}
