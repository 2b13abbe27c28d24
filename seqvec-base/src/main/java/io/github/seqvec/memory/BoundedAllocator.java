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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link Allocator} that grants requests until a fixed number of bytes is in use.
 * <p>
 * Usage is tracked with a plain field: vectors are single-threaded, and one allocator should not be
 * shared by vectors that are mutated concurrently.
 */
public class BoundedAllocator implements Allocator {
    private static final Logger log = LoggerFactory.getLogger(BoundedAllocator.class);

    private final long limitBytes;
    private long bytesUsed;

    public BoundedAllocator(long limitBytes) {
        if (limitBytes < 0) {
            throw new IllegalArgumentException("Allocator limit must not be negative: " + limitBytes);
        }
        this.limitBytes = limitBytes;
    }

    @Override
    public boolean allocate(long bytes) {
        assert bytes >= 0 : "Negative allocation request " + bytes;
        if (bytes > limitBytes - bytesUsed) {
            log.debug("Refusing {} bytes: {} of {} already in use", bytes, bytesUsed, limitBytes);
            return false;
        }
        bytesUsed += bytes;
        return true;
    }

    @Override
    public void release(long bytes) {
        assert bytes >= 0 && bytes <= bytesUsed : "Releasing " + bytes + " bytes with only " + bytesUsed + " in use";
        bytesUsed -= bytes;
    }

    @Override
    public long bytesUsed() {
        return bytesUsed;
    }

    public long limitBytes() {
        return limitBytes;
    }

    @Override
    public String toString() {
        return String.format("BoundedAllocator(%d/%d)", bytesUsed, limitBytes);
    }
}
