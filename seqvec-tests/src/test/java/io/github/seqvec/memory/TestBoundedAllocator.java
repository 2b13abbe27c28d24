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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TestBoundedAllocator extends RandomizedTest {

    @Test
    public void testGrantsUpToLimit() {
        BoundedAllocator allocator = new BoundedAllocator(100);
        assertTrue(allocator.allocate(60));
        assertTrue(allocator.allocate(40));
        assertEquals(100, allocator.bytesUsed());
        assertFalse(allocator.allocate(1));
        assertEquals(100, allocator.bytesUsed());

        allocator.release(40);
        assertEquals(60, allocator.bytesUsed());
        assertTrue(allocator.allocate(0));
        assertFalse(allocator.allocate(41));
        assertTrue(allocator.allocate(40));
    }

    @Test
    public void testRandomRequestsNeverExceedLimit() {
        long limit = randomIntBetween(0, 10_000);
        BoundedAllocator allocator = new BoundedAllocator(limit);
        for (int i = 0; i < 1000; i++) {
            long request = randomIntBetween(0, 500);
            long before = allocator.bytesUsed();
            boolean granted = allocator.allocate(request);
            assertEquals(before + request <= limit, granted);
            assertTrue(allocator.bytesUsed() <= limit);
            if (granted && randomBoolean()) {
                allocator.release(request);
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeLimit() {
        new BoundedAllocator(-1);
    }

    @Test
    public void testUnboundedIsShared() {
        Allocator allocator = Allocator.unbounded();
        assertSame(allocator, Allocator.unbounded());
        assertTrue(allocator.allocate(Long.MAX_VALUE));
        allocator.release(Long.MAX_VALUE);
        assertEquals(0, allocator.bytesUsed());
    }
}
