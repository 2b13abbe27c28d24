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

/**
 * Outcome of an operation that may need to grow storage or that may decline to insert.
 */
public enum Status {
    /** The operation completed. */
    OK,

    /** A unique insert found an equal element and left the vector unchanged. */
    ALREADY_PRESENT,

    /**
     * Storage could not be obtained, because the allocator refused it, the JVM ran out of heap or the
     * requested capacity exceeds the configured {@link IndexWidth}. The vector is unchanged.
     */
    ALLOCATION_FAILURE;

    public boolean isOk() {
        return this == OK;
    }
}
