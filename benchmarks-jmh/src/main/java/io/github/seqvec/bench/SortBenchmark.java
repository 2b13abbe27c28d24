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

import io.github.seqvec.vector.ComparableVector;
import io.github.seqvec.vector.IntVector;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Measures the in-place quicksort of primitive and boxed vectors against {@link Arrays#sort}.
 * Every invocation refills the vector from the same unsorted source, so the refill cost is part of
 * each measurement.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(value = 1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class SortBenchmark {
    private static final Logger log = LoggerFactory.getLogger(SortBenchmark.class);

    @Param({"100", "10000", "1000000"})
    private int size;

    /**
     * Upper bound of the random values. Small bounds produce many duplicates.
     */
    @Param({"16", "2147483647"})
    private int valueBound;

    private int[] source;
    private Integer[] boxedSource;
    private IntVector ints;
    private ComparableVector<Integer> boxed;

    @Setup
    public void setup() {
        Random random = new Random(42);
        source = new int[size];
        boxedSource = new Integer[size];
        for (int i = 0; i < size; i++) {
            source[i] = random.nextInt(valueBound);
            boxedSource[i] = source[i];
        }
        ints = new IntVector();
        ints.reserveCapacity(size);
        boxed = ComparableVector.natural();
        boxed.reserveCapacity(size);
        log.info("Sorting {} values below {}", size, valueBound);
    }

    @TearDown
    public void tearDown() {
        ints.close();
        boxed.close();
    }

    @Benchmark
    public void intVectorSort(Blackhole blackhole) {
        ints.removeAll();
        ints.appendArray(source, size);
        ints.sort();
        blackhole.consume(ints.first());
    }

    @Benchmark
    public void intVectorComparatorSort(Blackhole blackhole) {
        ints.removeAll();
        ints.appendArray(source, size);
        ints.qsort(Integer::compare);
        blackhole.consume(ints.first());
    }

    @Benchmark
    public void comparableVectorSort(Blackhole blackhole) {
        boxed.removeAll();
        boxed.appendArray(boxedSource, size);
        boxed.sort();
        blackhole.consume(boxed.first());
    }

    @Benchmark
    public void arraysSort(Blackhole blackhole) {
        int[] copy = Arrays.copyOf(source, size);
        Arrays.sort(copy);
        blackhole.consume(copy[0]);
    }
}
