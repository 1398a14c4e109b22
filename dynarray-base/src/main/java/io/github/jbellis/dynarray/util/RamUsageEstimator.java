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

package io.github.jbellis.dynarray.util;

/**
 * Estimates the heap footprint of objects, assuming a 64-bit JVM with compressed oops
 * (the HotSpot default for heaps below 32 GB).
 */
public final class RamUsageEstimator {
    /** Number of bytes used to represent a reference. */
    public static final int NUM_BYTES_OBJECT_REF = 4;

    /** Number of bytes of an object header. */
    public static final int NUM_BYTES_OBJECT_HEADER = 12;

    /** Number of bytes of an array header, including the length field. */
    public static final int NUM_BYTES_ARRAY_HEADER = 16;

    /** Objects are aligned to this many bytes. */
    public static final int NUM_BYTES_OBJECT_ALIGNMENT = 8;

    private RamUsageEstimator() {}

    /**
     * Rounds {@code size} up to the next multiple of {@link #NUM_BYTES_OBJECT_ALIGNMENT}.
     */
    public static long alignObjectSize(long size) {
        size += NUM_BYTES_OBJECT_ALIGNMENT - 1L;
        return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
    }

    /**
     * @return the shallow size of an object array with {@code length} slots
     */
    public static long shallowSizeOfObjectArray(int length) {
        return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_OBJECT_REF * length);
    }
}
