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
 * JMH benchmarks for the vector sort and the hybrid sorted search.
 * <ul>
 *   <li>{@link io.github.seqvec.bench.SortBenchmark} - quicksort of {@code int} and boxed vectors,
 *       with {@link java.util.Arrays#sort} as a baseline</li>
 *   <li>{@link io.github.seqvec.bench.SearchBenchmark} - lower-bound lookups across cache line
 *       sizes, with {@link java.util.Arrays#binarySearch} as a baseline</li>
 * </ul>
 * Run them through {@code org.openjdk.jmh.Main} with this module on the classpath.
 */
package io.github.seqvec.bench;
