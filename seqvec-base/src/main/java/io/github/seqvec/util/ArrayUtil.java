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

/**
 * Capacity arithmetic and small array helpers shared by the vector implementations.
 */
public final class ArrayUtil {
    /**
     * Largest power of two that a Java array can hold.
     */
    public static final int MAX_POWER_OF_TWO = 1 << 30;

    private ArrayUtil() {
    }

    /**
     * Rounds {@code x} up to the next power of two. Powers of two are returned unchanged.
     *
     * @param x a value in {@code [1, MAX_POWER_OF_TWO]}
     * @return the smallest power of two greater than or equal to {@code x}
     */
    public static int nextPowerOfTwo(int x) {
        assert x > 0 && x <= MAX_POWER_OF_TWO : "Cannot round " + x + " to a power of two";
        x--;
        x |= x >>> 1;
        x |= x >>> 2;
        x |= x >>> 4;
        x |= x >>> 8;
        x |= x >>> 16;
        return x + 1;
    }

    public static boolean isPowerOfTwo(int x) {
        return x > 0 && (x & (x - 1)) == 0;
    }

    public static void swap(Object[] array, int i, int j) {
        Object tmp = array[i];
        array[i] = array[j];
        array[j] = tmp;
    }

    public static void swap(int[] array, int i, int j) {
        int tmp = array[i];
        array[i] = array[j];
        array[j] = tmp;
    }

    /**
     * Reverses the elements of {@code array} in {@code [0, count)} by swapping symmetric pairs.
     */
    public static void reverse(Object[] array, int count) {
        for (int i = 0, j = count - 1; i < j; i++, j--) {
            swap(array, i, j);
        }
    }

    public static void reverse(int[] array, int count) {
        for (int i = 0, j = count - 1; i < j; i++, j--) {
            swap(array, i, j);
        }
    }
}
