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

import io.github.seqvec.memory.Allocator;
import io.github.seqvec.util.ArrayUtil;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable settings shared by vectors: the {@link Allocator} consulted for storage, the cache
 * line size that decides when ordered search switches from binary to linear scanning, and the
 * {@link IndexWidth} bounding capacity.
 * <p>
 * {@link #DEFAULT} reads its values from the {@code seqvec.cache_line_size} and
 * {@code seqvec.index_width} system properties.
 */
public final class VectorOptions {
    /** Cache line size in bytes, configurable via the seqvec.cache_line_size system property. */
    private static final int configuredCacheLineSize = Integer.getInteger("seqvec.cache_line_size", 64);

    /** Index width, configurable via the seqvec.index_width system property (TINY or STANDARD). */
    private static final IndexWidth configuredIndexWidth =
            IndexWidth.valueOf(System.getProperty("seqvec.index_width", IndexWidth.STANDARD.name()).toUpperCase(Locale.ROOT));

    public static final VectorOptions DEFAULT = builder().build();

    private final Allocator allocator;
    private final int cacheLineBytes;
    private final IndexWidth width;

    private VectorOptions(Builder builder) {
        this.allocator = builder.allocator;
        this.cacheLineBytes = builder.cacheLineBytes;
        this.width = builder.width;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Allocator allocator() {
        return allocator;
    }

    public int cacheLineSize() {
        return cacheLineBytes;
    }

    public IndexWidth indexWidth() {
        return width;
    }

    /**
     * Number of elements of {@code elementBytes} bytes that fit in one cache line. Ordered search
     * scans windows of at most this many elements linearly.
     */
    public int linearSearchThreshold(int elementBytes) {
        return cacheLineBytes / elementBytes;
    }

    /**
     * @return a builder initialized with these options
     */
    public Builder toBuilder() {
        return new Builder().withAllocator(allocator).withCacheLineSize(cacheLineBytes).withIndexWidth(width);
    }

    @Override
    public String toString() {
        return String.format("VectorOptions(allocator=%s, cacheLineSize=%d, indexWidth=%s)", allocator, cacheLineBytes, width);
    }

    public static final class Builder {
        private Allocator allocator = Allocator.unbounded();
        private int cacheLineBytes = configuredCacheLineSize;
        private IndexWidth width = configuredIndexWidth;

        private Builder() {
        }

        public Builder withAllocator(Allocator allocator) {
            this.allocator = Objects.requireNonNull(allocator, "allocator");
            return this;
        }

        public Builder withCacheLineSize(int bytes) {
            if (!ArrayUtil.isPowerOfTwo(bytes)) {
                throw new IllegalArgumentException("Cache line size must be a positive power of two: " + bytes);
            }
            this.cacheLineBytes = bytes;
            return this;
        }

        public Builder withIndexWidth(IndexWidth width) {
            this.width = Objects.requireNonNull(width, "width");
            return this;
        }

        public VectorOptions build() {
            if (!ArrayUtil.isPowerOfTwo(cacheLineBytes)) {
                throw new IllegalArgumentException("Cache line size must be a positive power of two: " + cacheLineBytes);
            }
            return new VectorOptions(this);
        }
    }
}
