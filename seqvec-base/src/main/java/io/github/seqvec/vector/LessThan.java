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

import java.util.Comparator;

/**
 * Strict ordering predicate injected into a {@link ComparableVector}: {@code lessThan(a, b)} must be
 * irreflexive and transitive, like {@code a < b}.
 *
 * @param <T> the element type
 */
@FunctionalInterface
public interface LessThan<T> {
    boolean lessThan(T a, T b);

    static <T extends Comparable<? super T>> LessThan<T> natural() {
        return (a, b) -> a.compareTo(b) < 0;
    }

    static <T> LessThan<T> of(Comparator<? super T> comparator) {
        return (a, b) -> comparator.compare(a, b) < 0;
    }
}
