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

package io.github.seqvec.bench;

import io.github.seqvec.vector.IntVector;
import io.github.seqvec.vector.VectorOptions;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Measures sorted lookups for several cache line sizes. A cache line of 4 bytes turns the hybrid
 * search into a pure binary search over ints.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Fork(value = 1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class SearchBenchmark {
    private static final Logger log = LoggerFactory.getLogger(SearchBenchmark.class);
    private static final int QUERY_COUNT = 1024;

    @Param({"16", "1000", "1000000"})
    private int size;

    @Param({"4", "64", "256"})
    private int cacheLineSize;

    private IntVector sorted;
    private int[] sortedArray;
    private int[] queries;

    @Setup
    public void setup() {
        Random random = new Random(42);
        sorted = new IntVector(VectorOptions.builder().withCacheLineSize(cacheLineSize).build());
        for (int i = 0; i < size; i++) {
            sorted.push(random.nextInt(size * 4));
        }
        sorted.sort();
        sortedArray = sorted.toArray();

        queries = new int[QUERY_COUNT];
        for (int i = 0; i < QUERY_COUNT; i++) {
            queries[i] = random.nextInt(size * 4);
        }
        log.info("Searching {} sorted values with {} byte cache lines", size, cacheLineSize);
    }

    @TearDown
    public void tearDown() {
        sorted.close();
    }

    @Benchmark
    @OperationsPerInvocation(QUERY_COUNT)
    public void insertionIndexSorted(Blackhole blackhole) {
        for (int query : queries) {
            blackhole.consume(sorted.insertionIndexSorted(query));
        }
    }

    @Benchmark
    @OperationsPerInvocation(QUERY_COUNT)
    public void indexOfSorted(Blackhole blackhole) {
        for (int query : queries) {
            blackhole.consume(sorted.indexOfSorted(query));
        }
    }

    @Benchmark
    @OperationsPerInvocation(QUERY_COUNT)
    public void arraysBinarySearch(Blackhole blackhole) {
        for (int query : queries) {
            blackhole.consume(Arrays.binarySearch(sortedArray, query));
        }
    }
}
