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
 * Growable contiguous vectors.
 *
 * <p>A vector owns one backing array whose capacity is zero or a power of two. Appends double the
 * capacity when it runs out, so the total cost of {@code n} appends is O(n). The family is layered
 * the same way for every element representation:
 *
 * <ul>
 *   <li><b>Storage</b>: {@link io.github.seqvec.vector.ObjectVector} pushes, pops, inserts and
 *       removes at any index, appends arrays in bulk, reverses, copies and shrinks.
 *   <li><b>Equality</b>: {@link io.github.seqvec.vector.EquatableVector} adds linear search,
 *       containment and unique insertion driven by an {@link io.github.seqvec.vector.Equality}.
 *   <li><b>Ordering</b>: {@link io.github.seqvec.vector.ComparableVector} adds min/max, an in-place
 *       quicksort, lower-bound search and sorted insertion driven by a
 *       {@link io.github.seqvec.vector.LessThan}.
 * </ul>
 *
 * <p>{@link io.github.seqvec.vector.IntVector} provides all three layers for {@code int} values
 * without boxing.
 *
 * <p><b>Error reporting:</b> operations that may need storage return a
 * {@link io.github.seqvec.vector.Status}; searches that find nothing return
 * {@link io.github.seqvec.vector.AbstractVector#INDEX_NOT_FOUND}. Neither throws.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ComparableVector<String> names = ComparableVector.natural();
 * names.insertSorted("carol");
 * names.insertSorted("alice");
 * if (names.insertSortedUnique("alice") == Status.ALREADY_PRESENT) {
 *     // nothing inserted
 * }
 * int i = names.indexOfSorted("carol"); // 1
 * }</pre>
 */
package io.github.seqvec.vector;
