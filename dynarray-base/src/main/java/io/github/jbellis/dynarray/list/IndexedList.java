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

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.RandomAccess;

/**
 * An ordered, index-addressable sequence.
 * <p>
 * Indexes are lenient: reading outside {@code [0, size)} reports "not found" instead of throwing,
 * and writing outside of it is silently ignored, with the single exception that writing at
 * {@code index == size} appends. Elements are never null.
 *
 * @param <T> the element type
 */
public interface IndexedList<T> extends Container<T>, Iterable<T> {
    /**
     * Returns the element at {@code index}.
     *
     * @return the element, or an empty Optional when {@code index} is outside {@code [0, size)}
     */
    Optional<T> get(int index);

    /**
     * Removes the element at {@code index}, shifting subsequent elements left.
     * Does nothing if {@code index} is outside {@code [0, size)}.
     */
    void remove(int index);

    /**
     * Appends the values, in argument order.
     *
     * @throws NullPointerException if any value is null; the list is left unchanged
     */
    @SuppressWarnings("unchecked")
    void add(T... values);

    /**
     * Checks that every value is present. Vacuously true when no values are given.
     */
    @SuppressWarnings("unchecked")
    boolean contains(T... values);

    /**
     * @return the position of the first element equal to {@code value}, or -1 if there is none
     */
    int indexOf(T value);

    /**
     * Sorts the elements in place.
     *
     * @param comparator a total order over the elements
     */
    void sort(Comparator<? super T> comparator);

    /**
     * Exchanges the elements at {@code i} and {@code j}. Does nothing unless both are within
     * {@code [0, size)}.
     */
    void swap(int i, int j);

    /**
     * Inserts the values at {@code index}, shifting the element currently there (if any) and all
     * subsequent ones right. {@code index == size} appends; any other index outside
     * {@code [0, size)} is ignored.
     *
     * @throws NullPointerException if any value is null; the list is left unchanged
     */
    @SuppressWarnings("unchecked")
    void insert(int index, T... values);

    /**
     * Replaces the element at {@code index}. {@code index == size} appends; any other index outside
     * {@code [0, size)} is ignored.
     *
     * @throws NullPointerException if value is null; the list is left unchanged
     */
    void set(int index, T value);

    /**
     * Returns a live {@link java.util.List} view backed by this list, for use with algorithms
     * written against the collections framework. The view implements {@link RandomAccess} and
     * follows the strict {@code java.util.List} contract, so out-of-range indexes throw
     * {@link IndexOutOfBoundsException} there.
     */
    List<T> asList();

    /**
     * Receives an element together with its position.
     */
    @FunctionalInterface
    interface IndexedConsumer<T> {
        void accept(int index, T value);
    }

    /**
     * Maps an element, given its position, to a new value.
     */
    @FunctionalInterface
    interface IndexedFunction<T, R> {
        R apply(int index, T value);
    }

    /**
     * Tests an element, given its position.
     */
    @FunctionalInterface
    interface IndexedPredicate<T> {
        boolean test(int index, T value);
    }
}
