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

package io.github.seqvec.util;

import com.sun.management.HotSpotDiagnosticMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;

/**
 * Estimates the heap footprint of the backing arrays, so that allocators can account for them.
 * Sizes follow the HotSpot layout: an array header followed by the slots, rounded up to the
 * object alignment.
 */
public final class RamUsageEstimator {
    private static final Logger log = LoggerFactory.getLogger(RamUsageEstimator.class);

    /** Alignment of every object on the heap. */
    public static final int NUM_BYTES_OBJECT_ALIGNMENT = 8;

    /** Size of a reference slot: 4 with compressed oops, 8 otherwise. */
    public static final int NUM_BYTES_OBJECT_REF;

    /** Size of an array header (mark word, class pointer and length). */
    public static final int NUM_BYTES_ARRAY_HEADER;

    static {
        boolean compressedOops = compressedOopsEnabled();
        NUM_BYTES_OBJECT_REF = compressedOops ? 4 : 8;
        NUM_BYTES_ARRAY_HEADER = compressedOops ? 16 : 24;
    }

    private RamUsageEstimator() {
    }

    private static boolean compressedOopsEnabled() {
        try {
            HotSpotDiagnosticMXBean bean = ManagementFactory.getPlatformMXBean(HotSpotDiagnosticMXBean.class);
            return Boolean.parseBoolean(bean.getVMOption("UseCompressedOops").getValue());
        } catch (RuntimeException | LinkageError e) {
            // not HotSpot: compressed oops are only possible below 32GB of heap
            log.debug("Cannot read UseCompressedOops, guessing from max heap size", e);
            return Runtime.getRuntime().maxMemory() < (32L << 30);
        }
    }

    public static long alignObjectSize(long size) {
        size += NUM_BYTES_OBJECT_ALIGNMENT - 1L;
        return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
    }

    /**
     * @param length number of slots
     * @param slotBytes size of one slot
     * @return the estimated size of an array with {@code length} slots, or 0 for an absent array
     */
    public static long sizeOfArray(int length, int slotBytes) {
        if (length == 0) {
            return 0;
        }
        return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) length * slotBytes);
    }
}
