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

import java.util.Objects;

/**
 * Equality predicate injected into an {@link EquatableVector}.
 *
 * @param <T> the element type
 */
@FunctionalInterface
public interface Equality<T> {
    /**
     * Reference identity. Vectors recognize this instance and compare their storage slot by slot
     * without calling back into a predicate.
     */
    Equality<Object> IDENTITY = (a, b) -> a == b;

    boolean equal(T a, T b);

    @SuppressWarnings("unchecked")
    static <T> Equality<T> identity() {
        return (Equality<T>) IDENTITY;
    }

    /**
     * @return equality as defined by {@link Object#equals(Object)}, tolerating nulls
     */
    static <T> Equality<T> natural() {
        return Objects::equals;
    }
}
