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

package io.github.jbellis.dynarray.list;

import io.github.jbellis.dynarray.exceptions.CapacityExhaustedException;
import io.github.jbellis.dynarray.util.ArrayUtil;

/**
 * Decides when a {@link DynamicArray} reallocates its buffer, and to what size.
 * <p>
 * Growth happens before a write that would fill the buffer: the new capacity is
 * {@code growthFactor * (capacity + n)} for {@code n} incoming elements, which keeps appends
 * amortized O(1). Shrinking happens after a removal leaves the buffer at most
 * {@code shrinkFactor} full, and trims the buffer to exactly the number of elements.
 * A shrink factor of zero disables shrinking.
 */
public final class CapacityPolicy {
    public static final float DEFAULT_GROWTH_FACTOR = 2.0f;
    public static final float DEFAULT_SHRINK_FACTOR = 0.25f;

    /** Doubles on growth, trims once the buffer is a quarter full. */
    public static final CapacityPolicy DEFAULT = new CapacityPolicy(DEFAULT_GROWTH_FACTOR, DEFAULT_SHRINK_FACTOR);

    /** Doubles on growth, never gives memory back. */
    public static final CapacityPolicy NEVER_SHRINK = new CapacityPolicy(DEFAULT_GROWTH_FACTOR, 0.0f);

    private final float growthFactor;
    private final float shrinkFactor;

    private CapacityPolicy(float growthFactor, float shrinkFactor) {
        this.growthFactor = growthFactor;
        this.shrinkFactor = shrinkFactor;
    }

    /**
     * @param growthFactor multiplier applied on growth, finite and greater than 1
     * @param shrinkFactor occupancy ratio at or below which the buffer is trimmed, in [0, 1); 0 never trims
     */
    public static CapacityPolicy of(float growthFactor, float shrinkFactor) {
        if (!(growthFactor > 1.0f) || Float.isInfinite(growthFactor)) {
            throw new IllegalArgumentException(String.format("growthFactor must be a finite value greater than 1, got %s", growthFactor));
        }
        if (!(shrinkFactor >= 0.0f && shrinkFactor < 1.0f)) {
            throw new IllegalArgumentException(String.format("shrinkFactor must be in [0, 1), got %s", shrinkFactor));
        }
        return new CapacityPolicy(growthFactor, shrinkFactor);
    }

    public float getGrowthFactor() {
        return growthFactor;
    }

    public float getShrinkFactor() {
        return shrinkFactor;
    }

    public boolean shrinks() {
        return shrinkFactor != 0.0f;
    }

    /**
     * Computes the capacity needed before {@code n} elements are written after the first
     * {@code size} slots of a buffer of {@code capacity} slots.
     *
     * @return the new capacity, or -1 if the buffer does not need to grow
     * @throws CapacityExhaustedException if {@code size + n} exceeds {@link ArrayUtil#MAX_ARRAY_LENGTH}
     */
    public int grownCapacity(int capacity, int size, int n) {
        long required = (long) size + n;
        if (required < capacity) {
            return -1;
        }
        if (required > ArrayUtil.MAX_ARRAY_LENGTH) {
            throw new CapacityExhaustedException(required, ArrayUtil.MAX_ARRAY_LENGTH);
        }
        double target = Math.floor((double) growthFactor * ((long) capacity + n));
        // clamp, the product may overshoot the addressable range
        return (int) Math.min((long) target, ArrayUtil.MAX_ARRAY_LENGTH);
    }

    /**
     * @return true if a buffer of {@code capacity} slots holding {@code size} elements should be
     *         trimmed to {@code size}
     */
    public boolean shouldShrink(int size, int capacity) {
        if (!shrinks()) {
            return false;
        }
        return size <= (int) (capacity * shrinkFactor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapacityPolicy)) return false;
        CapacityPolicy that = (CapacityPolicy) o;
        return Float.compare(growthFactor, that.growthFactor) == 0
                && Float.compare(shrinkFactor, that.shrinkFactor) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Float.hashCode(growthFactor) + Float.hashCode(shrinkFactor);
    }

    @Override
    public String toString() {
        return String.format("CapacityPolicy(growth=%s, shrink=%s)", growthFactor, shrinkFactor);
    }
}
