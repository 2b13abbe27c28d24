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

/**
 * Low-level helpers used by the vector implementations.
 *
 * <ul>
 *   <li><b>Capacity arithmetic</b>: {@link io.github.seqvec.util.ArrayUtil} rounds capacities to
 *       powers of two and swaps or reverses array slots.
 *   <li><b>Sorting</b>: {@link io.github.seqvec.util.QuickSorter} is the iterative randomized
 *       quicksort shared by every element representation.
 *   <li><b>Memory estimation</b>: {@link io.github.seqvec.util.RamUsageEstimator} estimates the
 *       heap footprint of backing arrays for allocator accounting.
 * </ul>
 *
 * <p>Classes in this package hold no state between calls and are not thread-safe to share across
 * concurrent sorts of the same array.
 */
package io.github.seqvec.util;
