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

import io.github.jbellis.dynarray.exceptions.CapacityExhaustedException;

import java.util.Objects;

/**
 * Methods for manipulating object arrays that back growable containers.
 * <p>
 * All shifting is done with {@link System#arraycopy}, which handles overlapping source and
 * destination ranges correctly.
 */
public final class ArrayUtil {
    /**
     * Maximum length for an array. Some JVMs reserve header words in the array body, so requests
     * close to {@link Integer#MAX_VALUE} fail even when the heap is large enough.
     */
    public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private ArrayUtil() {} // no instance

    /**
     * Copies the specified range of the given array into a new sub array.
     *
     * @param array the input array
     * @param from the initial index of range to be copied (inclusive)
     * @param to the final index of range to be copied (exclusive)
     * @param <T> the element type
     * @return a new array of length {@code to - from} holding the requested range
     */
    public static <T> T[] copyOfSubArray(T[] array, int from, int to) {
        Objects.checkFromToIndex(from, to, array.length);
        final int subLength = to - from;
        @SuppressWarnings("unchecked")
        final T[] copy = (T[]) java.lang.reflect.Array.newInstance(array.getClass().getComponentType(), subLength);
        System.arraycopy(array, from, copy, 0, subLength);
        return copy;
    }

    /**
     * Returns a new array of exactly {@code newLength} slots whose first {@code length} slots are
     * copied from {@code array}. Slots at or after {@code length} are null, so stale references
     * beyond the logical end of the source are never carried over.
     *
     * @throws CapacityExhaustedException if {@code newLength} exceeds {@link #MAX_ARRAY_LENGTH}
     *         or the JVM fails to allocate the array
     */
    public static <T> T[] resize(T[] array, int length, int newLength) {
        if (newLength < 0) {
            throw new IllegalArgumentException("newLength must be non-negative, got " + newLength);
        }
        if (newLength > MAX_ARRAY_LENGTH) {
            throw new CapacityExhaustedException(newLength, MAX_ARRAY_LENGTH);
        }
        Objects.checkFromToIndex(0, length, Math.min(array.length, newLength));

        T[] resized;
        try {
            @SuppressWarnings("unchecked")
            T[] allocated = (T[]) java.lang.reflect.Array.newInstance(array.getClass().getComponentType(), newLength);
            resized = allocated;
        } catch (OutOfMemoryError e) {
            throw new CapacityExhaustedException(newLength, e);
        }
        System.arraycopy(array, 0, resized, 0, length);
        return resized;
    }

    /**
     * Moves {@code array[index, size)} to {@code array[index + count, size + count)}, opening a gap
     * of {@code count} slots at {@code index}. The caller is responsible for the array being at
     * least {@code size + count} long. The gap keeps its previous contents.
     */
    public static void shiftRight(Object[] array, int index, int count, int size) {
        Objects.checkFromToIndex(index, size, array.length);
        assert size + count <= array.length : String.format("Cannot shift %d slots right in an array of length %d holding %d elements",
                                                            count, array.length, size);
        System.arraycopy(array, index, array, index + count, size - index);
    }

    /**
     * Moves {@code array[index + 1, size)} one slot to the left, overwriting {@code array[index]},
     * and nulls out the now unused slot {@code array[size - 1]}.
     */
    public static void shiftLeft(Object[] array, int index, int size) {
        Objects.checkIndex(index, size);
        System.arraycopy(array, index + 1, array, index, size - index - 1);
        array[size - 1] = null;
    }

    /**
     * Swaps the values of two array slots.
     */
    public static void swap(Object[] array, int i, int j) {
        final Object tmp = array[i];
        array[i] = array[j];
        array[j] = tmp;
    }
}
