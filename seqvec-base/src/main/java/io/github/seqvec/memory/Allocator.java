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

package io.github.seqvec.memory;

/**
 * Accounting strategy consulted by vectors before they obtain or give back backing storage.
 * <p>
 * A vector asks for the full size of a new backing array before creating it, and releases the size
 * of the array it replaces once the copy succeeded. Refusing a request makes the vector report an
 * allocation failure without touching its current contents.
 * <p>
 * Implementations are injected through {@link io.github.seqvec.vector.VectorOptions}; the default is
 * {@link #unbounded()}.
 */
public interface Allocator {
    /**
     * Requests {@code bytes} of storage.
     *
     * @param bytes the size of the array about to be created
     * @return true if the request is granted, false to make the caller fail the operation
     */
    boolean allocate(long bytes);

    /**
     * Gives back storage previously granted by {@link #allocate(long)}.
     *
     * @param bytes the size of the array being dropped
     */
    void release(long bytes);

    /**
     * @return bytes currently granted and not yet released
     */
    long bytesUsed();

    /**
     * @return the shared allocator that grants every request and keeps no count, so it is safe to use
     *         from vectors owned by different threads
     */
    static Allocator unbounded() {
        return Unbounded.INSTANCE;
    }

    /** Grants everything; storage is left to the JVM heap. */
    final class Unbounded implements Allocator {
        private static final Unbounded INSTANCE = new Unbounded();

        private Unbounded() {
        }

        @Override
        public boolean allocate(long bytes) {
            return true;
        }

        @Override
        public void release(long bytes) {
        }

        @Override
        public long bytesUsed() {
            return 0;
        }

        @Override
        public String toString() {
            return "UnboundedAllocator";
        }
    }
}
