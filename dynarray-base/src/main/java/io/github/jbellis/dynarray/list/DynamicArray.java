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

import io.github.jbellis.dynarray.annotations.VisibleForTesting;
import io.github.jbellis.dynarray.util.ArrayUtil;
import io.github.jbellis.dynarray.util.RamUsageEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.RandomAccess;

/**
 * DynamicArray stores elements contiguously in a single resizable buffer.
 * <p>
 * The logical elements occupy buffer slots {@code [0, size)}; the remaining slots are slack
 * kept for amortized growth and always hold null. When and how the buffer is reallocated is
 * governed by the array's {@link CapacityPolicy}.
 * <p>
 * Positional insert and remove move the affected sub-range of the buffer explicitly, so they cost
 * O(size - index). Appends are amortized O(1). {@link #contains} and {@link #indexOf} are linear
 * scans using {@link Object#equals}.
 * <p>
 * This class is not thread-safe.
 *
 * @param <T> the element type
 */
public class DynamicArray<T> implements IndexedList<T> {
    private static final Logger log = LoggerFactory.getLogger(DynamicArray.class);

    private static final Object[] EMPTY_ELEMENTS = {};

    private final CapacityPolicy policy;
    private Object[] elements;
    private int size;
    // structural modifications, checked by iterators
    private int modCount;

    public DynamicArray() {
        this(CapacityPolicy.DEFAULT);
    }

    public DynamicArray(CapacityPolicy policy) {
        this.policy = Objects.requireNonNull(policy);
        this.elements = EMPTY_ELEMENTS;
        this.size = 0;
    }

    /**
     * Creates an array holding the given values, in order, with the default capacity policy.
     */
    @SafeVarargs
    public static <T> DynamicArray<T> of(T... values) {
        return withPolicy(CapacityPolicy.DEFAULT, values);
    }

    /**
     * Creates an array holding the given values, in order, that reallocates according to {@code policy}.
     */
    @SafeVarargs
    public static <T> DynamicArray<T> withPolicy(CapacityPolicy policy, T... values) {
        DynamicArray<T> array = new DynamicArray<>(policy);
        if (values.length > 0) {
            array.add(values);
        }
        return array;
    }

    public CapacityPolicy getPolicy() {
        return policy;
    }

    @Override
    @SafeVarargs
    public final void add(T... values) {
        checkNoNulls(values);
        growBy(values.length);
        System.arraycopy(values, 0, elements, size, values.length);
        size += values.length;
        modCount++;
    }

    @Override
    public Optional<T> get(int index) {
        if (!withinRange(index)) {
            return Optional.empty();
        }
        return Optional.of(elementAt(index));
    }

    @Override
    public void remove(int index) {
        if (!withinRange(index)) {
            return;
        }
        ArrayUtil.shiftLeft(elements, index, size);
        size--;
        modCount++;
        shrink();
    }

    @Override
    @SafeVarargs
    public final boolean contains(T... values) {
        for (T value : values) {
            if (indexOf(value) < 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int indexOf(T value) {
        if (size == 0) {
            return -1;
        }
        for (int i = 0; i < size; i++) {
            if (elements[i].equals(value)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public List<T> values() {
        List<T> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(elementAt(i));
        }
        return copy;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * Drops every element and releases the buffer.
     */
    @Override
    public void clear() {
        if (elements.length > 0) {
            log.trace("Releasing buffer of {} slots ({} elements)", elements.length, size);
        }
        elements = EMPTY_ELEMENTS;
        size = 0;
        modCount++;
    }

    /**
     * Sorts the elements with {@link Arrays#sort(Object[], int, int, Comparator)}, which is stable:
     * equal elements keep their relative order.
     */
    @Override
    @SuppressWarnings("unchecked")
    public void sort(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator);
        if (size < 2) {
            return;
        }
        Arrays.sort((T[]) elements, 0, size, comparator);
        modCount++;
    }

    @Override
    public void swap(int i, int j) {
        if (withinRange(i) && withinRange(j)) {
            ArrayUtil.swap(elements, i, j);
        }
    }

    @Override
    @SafeVarargs
    public final void insert(int index, T... values) {
        checkNoNulls(values);
        if (!withinRange(index)) {
            if (index == size) {
                add(values);
            }
            return;
        }

        int n = values.length;
        growBy(n);
        ArrayUtil.shiftRight(elements, index, n, size);
        System.arraycopy(values, 0, elements, index, n);
        size += n;
        modCount++;
    }

    @Override
    public void set(int index, T value) {
        Objects.requireNonNull(value, "DynamicArray does not hold null elements");
        if (!withinRange(index)) {
            if (index == size) {
                add(value);
            }
            return;
        }
        elements[index] = value;
    }

    /**
     * @return the number of slots in the backing buffer
     */
    public int capacity() {
        return elements.length;
    }

    /**
     * @return estimated shallow heap usage of this array and its buffer, excluding the elements themselves
     */
    public long ramBytesUsed() {
        int REF_BYTES = RamUsageEstimator.NUM_BYTES_OBJECT_REF;
        int OH_BYTES = RamUsageEstimator.NUM_BYTES_OBJECT_HEADER;

        return RamUsageEstimator.alignObjectSize(OH_BYTES
                + REF_BYTES // policy
                + REF_BYTES // elements
                + Integer.BYTES // size
                + Integer.BYTES) // modCount
                + RamUsageEstimator.shallowSizeOfObjectArray(elements.length);
    }

    /**
     * Calls {@code consumer} with every element and its position, in order.
     */
    public void forEachIndexed(IndexedConsumer<? super T> consumer) {
        for (int i = 0; i < size; i++) {
            consumer.accept(i, elementAt(i));
        }
    }

    /**
     * @return a new array, with the same capacity policy, holding {@code function} applied to every element
     * @throws NullPointerException if {@code function} returns null
     */
    public <R> DynamicArray<R> map(IndexedFunction<? super T, ? extends R> function) {
        DynamicArray<R> mapped = new DynamicArray<>(policy);
        mapped.elements = new Object[size];
        for (int i = 0; i < size; i++) {
            mapped.elements[i] = Objects.requireNonNull(function.apply(i, elementAt(i)));
            mapped.size++;
        }
        return mapped;
    }

    /**
     * @return a new array, with the same capacity policy, holding the elements accepted by {@code predicate}
     */
    public DynamicArray<T> select(IndexedPredicate<? super T> predicate) {
        DynamicArray<T> selected = new DynamicArray<>(policy);
        for (int i = 0; i < size; i++) {
            T value = elementAt(i);
            if (predicate.test(i, value)) {
                selected.add(value);
            }
        }
        return selected;
    }

    /**
     * @return true if at least one element is accepted by {@code predicate}
     */
    public boolean any(IndexedPredicate<? super T> predicate) {
        return find(predicate).isPresent();
    }

    /**
     * @return true if every element is accepted by {@code predicate}, vacuously true when empty
     */
    public boolean all(IndexedPredicate<? super T> predicate) {
        for (int i = 0; i < size; i++) {
            if (!predicate.test(i, elementAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the position of the first element accepted by {@code predicate}, if any
     */
    public OptionalInt find(IndexedPredicate<? super T> predicate) {
        for (int i = 0; i < size; i++) {
            if (predicate.test(i, elementAt(i))) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Iterates the elements in order. {@link Iterator#remove} removes the last returned element
     * through {@link #remove(int)}. Any other structural change made while iterating causes the
     * next call to throw {@link ConcurrentModificationException}; this check is best-effort only.
     */
    @Override
    public Iterator<T> iterator() {
        return new ElementIterator();
    }

    /**
     * @return a bidirectional cursor positioned before the first element
     */
    public Cursor cursor() {
        return new Cursor();
    }

    @Override
    public List<T> asList() {
        return new ListView();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("DynamicArray\n");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(elements[i]);
        }
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private T elementAt(int index) {
        return (T) elements[index];
    }

    private boolean withinRange(int index) {
        return index >= 0 && index < size;
    }

    private static void checkNoNulls(Object[] values) {
        for (Object value : values) {
            Objects.requireNonNull(value, "DynamicArray does not hold null elements");
        }
    }

    /**
     * Grows the buffer if writing n more elements would fill it.
     */
    private void growBy(int n) {
        int newCapacity = policy.grownCapacity(elements.length, size, n);
        if (newCapacity > elements.length) {
            resize(newCapacity);
        }
    }

    /**
     * Trims the buffer to size once the policy considers it too empty.
     */
    private void shrink() {
        if (size < elements.length && policy.shouldShrink(size, elements.length)) {
            resize(size);
        }
    }

    @VisibleForTesting
    void resize(int newCapacity) {
        log.trace("Resizing buffer from {} to {} slots ({} elements)", elements.length, newCapacity, size);
        elements = ArrayUtil.resize(elements, size, newCapacity);
    }

    @VisibleForTesting
    Object[] buffer() {
        return elements;
    }

    private class ElementIterator implements Iterator<T> {
        private int next;
        private int lastReturned = -1;
        private int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return next < size;
        }

        @Override
        public T next() {
            checkForComodification();
            if (next >= size) {
                throw new NoSuchElementException();
            }
            lastReturned = next++;
            return elementAt(lastReturned);
        }

        @Override
        public void remove() {
            if (lastReturned < 0) {
                throw new IllegalStateException();
            }
            checkForComodification();
            DynamicArray.this.remove(lastReturned);
            next = lastReturned;
            lastReturned = -1;
            expectedModCount = modCount;
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }

    /**
     * A stateful, bidirectional position over the array. A fresh cursor sits before the first
     * element; {@link #next()} and {@link #prev()} move one step and report whether the cursor
     * now rests on an element. The cursor reads the array live and does not detect modification.
     */
    public class Cursor {
        private int index = -1;

        private Cursor() {
        }

        /**
         * Moves to the next element.
         * @return true if the cursor is on an element afterwards
         */
        public boolean next() {
            if (index < size) {
                index++;
            }
            return withinRange(index);
        }

        /**
         * Moves to the previous element.
         * @return true if the cursor is on an element afterwards
         */
        public boolean prev() {
            if (index >= 0) {
                index--;
            }
            return withinRange(index);
        }

        /**
         * @return the element under the cursor
         * @throws NoSuchElementException if the cursor is before the first or past the last element
         */
        public T value() {
            if (!withinRange(index)) {
                throw new NoSuchElementException(String.format("Cursor at %d is outside [0, %d)", index, size));
            }
            return elementAt(index);
        }

        /**
         * @return the position of the cursor, -1 before the first element and size past the last
         */
        public int index() {
            return index;
        }

        /** Moves before the first element. */
        public void begin() {
            index = -1;
        }

        /** Moves past the last element. */
        public void end() {
            index = size;
        }

        /**
         * Moves to the first element.
         * @return false if the array is empty
         */
        public boolean first() {
            begin();
            return next();
        }

        /**
         * Moves to the last element.
         * @return false if the array is empty
         */
        public boolean last() {
            end();
            return prev();
        }
    }

    private class ListView extends AbstractList<T> implements RandomAccess {
        @Override
        public T get(int index) {
            Objects.checkIndex(index, size);
            return elementAt(index);
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public T set(int index, T value) {
            Objects.checkIndex(index, size);
            T previous = elementAt(index);
            DynamicArray.this.set(index, value);
            return previous;
        }

        @Override
        public void add(int index, T value) {
            Objects.checkIndex(index, size + 1);
            DynamicArray.this.insert(index, value);
            modCount++;
        }

        @Override
        public T remove(int index) {
            Objects.checkIndex(index, size);
            T previous = elementAt(index);
            DynamicArray.this.remove(index);
            modCount++;
            return previous;
        }

        @Override
        public void clear() {
            DynamicArray.this.clear();
            modCount++;
        }

        @Override
        public int indexOf(Object o) {
            for (int i = 0; i < size; i++) {
                if (elements[i].equals(o)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
