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

import io.github.jbellis.dynarray.util.Comparators;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestDynamicArray {

    @Test
    public void testInsertRemoveSetSwapScenario() {
        DynamicArray<Integer> array = DynamicArray.of(1, 2, 3);

        array.insert(1, 10, 20);
        assertEquals(List.of(1, 10, 20, 2, 3), array.values());

        array.remove(0);
        assertEquals(List.of(10, 20, 2, 3), array.values());
        assertEquals(4, array.size());

        // index == size appends
        array.set(4, 99);
        assertEquals(List.of(10, 20, 2, 3, 99), array.values());

        // out of range is ignored
        array.set(10, 0);
        assertEquals(List.of(10, 20, 2, 3, 99), array.values());

        array.swap(0, 4);
        assertEquals(List.of(99, 20, 2, 3, 10), array.values());
    }

    @Test
    public void testNewArrayIsEmpty() {
        var array = new DynamicArray<String>();
        assertTrue(array.isEmpty());
        assertEquals(0, array.size());
        assertEquals(0, array.capacity());
        assertEquals(List.of(), array.values());
        assertSame(CapacityPolicy.DEFAULT, array.getPolicy());
    }

    @Test
    public void testAddPreservesArgumentOrderAcrossCalls() {
        var array = new DynamicArray<String>();
        array.add("a");
        array.add("b", "c");
        array.add();
        array.add("d", "e", "f");
        assertEquals(List.of("a", "b", "c", "d", "e", "f"), array.values());
        assertEquals(6, array.size());
        assertFalse(array.isEmpty());
    }

    @Test
    public void testGet() {
        var array = DynamicArray.of("a", "b", "c");
        assertEquals(Optional.of("a"), array.get(0));
        assertEquals(Optional.of("c"), array.get(2));
        assertEquals(Optional.empty(), array.get(3));
        assertEquals(Optional.empty(), array.get(-1));
        assertEquals(Optional.empty(), new DynamicArray<String>().get(0));
    }

    @Test
    public void testGetNeverSeesSlack() {
        var array = DynamicArray.of(1, 2, 3);
        assertTrue(array.capacity() > array.size());
        for (int i = array.size(); i < array.capacity(); i++) {
            assertEquals(Optional.empty(), array.get(i));
        }
    }

    @Test
    public void testSetWithinRange() {
        var array = DynamicArray.of("a", "b", "c");
        array.set(1, "x");
        assertEquals(Optional.of("x"), array.get(1));
        assertEquals(3, array.size());
    }

    @Test
    public void testSetNegativeIndexIsIgnored() {
        var array = DynamicArray.of("a");
        array.set(-1, "x");
        assertEquals(List.of("a"), array.values());
    }

    @Test
    public void testInsertAtFront() {
        var array = DynamicArray.of("c", "d");
        array.insert(0, "a", "b");
        assertEquals(List.of("a", "b", "c", "d"), array.values());
    }

    @Test
    public void testInsertAtSizeAppends() {
        var array = DynamicArray.of("a", "b");
        array.insert(2, "c", "d");
        assertEquals(List.of("a", "b", "c", "d"), array.values());

        var empty = new DynamicArray<String>();
        empty.insert(0, "a");
        assertEquals(List.of("a"), empty.values());
    }

    @Test
    public void testInsertOutOfRangeIsIgnored() {
        var array = DynamicArray.of("a", "b");
        array.insert(3, "x");
        array.insert(-1, "x");
        assertEquals(List.of("a", "b"), array.values());
    }

    @Test
    public void testInsertMoreThanCapacity() {
        var array = DynamicArray.of(1, 2);
        int capacity = array.capacity();
        Integer[] batch = new Integer[capacity * 3];
        for (int i = 0; i < batch.length; i++) {
            batch[i] = 100 + i;
        }
        array.insert(1, batch);

        assertEquals(batch.length + 2, array.size());
        assertEquals(Optional.of(1), array.get(0));
        assertEquals(Optional.of(100), array.get(1));
        assertEquals(Optional.of(100 + batch.length - 1), array.get(batch.length));
        assertEquals(Optional.of(2), array.get(batch.length + 1));
    }

    @Test
    public void testRemove() {
        var array = DynamicArray.of("a", "b", "c", "d");
        array.remove(3);
        assertEquals(List.of("a", "b", "c"), array.values());
        array.remove(1);
        assertEquals(List.of("a", "c"), array.values());
        array.remove(0);
        array.remove(0);
        assertTrue(array.isEmpty());
    }

    @Test
    public void testRemoveOutOfRangeIsIgnored() {
        var array = DynamicArray.of("a", "b");
        array.remove(2);
        array.remove(-1);
        assertEquals(List.of("a", "b"), array.values());
        new DynamicArray<String>().remove(0);
    }

    @Test
    public void testRemoveClearsVacatedSlot() {
        var array = DynamicArray.withPolicy(CapacityPolicy.NEVER_SHRINK, "a", "b", "c");
        array.remove(0);
        Object[] buffer = array.buffer();
        assertEquals("b", buffer[0]);
        assertEquals("c", buffer[1]);
        for (int i = array.size(); i < buffer.length; i++) {
            assertEquals(null, buffer[i]);
        }
    }

    @Test
    public void testContains() {
        var array = DynamicArray.of("a", "b", "c");
        assertTrue(array.contains("a"));
        assertTrue(array.contains("c", "a"));
        assertFalse(array.contains("a", "d"));
        assertFalse(array.contains("d"));
        // vacuous
        assertTrue(array.contains());
        assertTrue(new DynamicArray<String>().contains());
        assertFalse(new DynamicArray<String>().contains("a"));
    }

    @Test
    public void testContainsUsesEquals() {
        var array = DynamicArray.of(new String("key"));
        assertTrue(array.contains(new String("key")));
        assertEquals(0, array.indexOf(new String("key")));
    }

    @Test
    public void testContainsIgnoresRemovedElements() {
        var array = DynamicArray.withPolicy(CapacityPolicy.NEVER_SHRINK, "a", "b", "c");
        array.remove(2);
        assertFalse(array.contains("c"));
        assertEquals(-1, array.indexOf("c"));
    }

    @Test
    public void testIndexOf() {
        var array = DynamicArray.of("a", "b", "a");
        assertEquals(0, array.indexOf("a"));
        assertEquals(1, array.indexOf("b"));
        assertEquals(-1, array.indexOf("z"));
        assertEquals(-1, array.indexOf(null));
        assertEquals(-1, new DynamicArray<String>().indexOf("a"));
    }

    @Test
    public void testValuesIsIndependentCopy() {
        var array = DynamicArray.of(1, 2, 3);
        List<Integer> values = array.values();
        values.set(0, 42);
        values.add(4);
        assertEquals(List.of(1, 2, 3), array.values());

        array.set(1, 7);
        assertEquals(List.of(42, 2, 3, 4), values);
    }

    @Test
    public void testClear() {
        var array = DynamicArray.of(1, 2, 3);
        array.clear();
        assertEquals(0, array.size());
        assertTrue(array.isEmpty());
        assertEquals(0, array.capacity());
        for (int i = -1; i < 4; i++) {
            assertEquals(Optional.empty(), array.get(i));
        }

        array.add(5);
        assertEquals(List.of(5), array.values());
    }

    @Test
    public void testSort() {
        var array = DynamicArray.of(5, 1, 4, 2, 3);
        array.sort(Comparators.INTEGERS);
        assertEquals(List.of(1, 2, 3, 4, 5), array.values());

        array.sort(Comparators.reversed());
        assertEquals(List.of(5, 4, 3, 2, 1), array.values());
    }

    @Test
    public void testSortIsStable() {
        var array = DynamicArray.of("bb", "a", "cc", "b", "aa", "c");
        array.sort((s1, s2) -> Integer.compare(s1.length(), s2.length()));
        assertEquals(List.of("a", "b", "c", "bb", "cc", "aa"), array.values());
    }

    @Test
    public void testSortSmallArrays() {
        var empty = new DynamicArray<Integer>();
        empty.sort(Comparators.INTEGERS);
        assertTrue(empty.isEmpty());

        var single = DynamicArray.of(1);
        single.sort(Comparators.INTEGERS);
        assertEquals(List.of(1), single.values());
    }

    @Test
    public void testSortOnlyTouchesLogicalElements() {
        var array = DynamicArray.withPolicy(CapacityPolicy.NEVER_SHRINK, 3, 2, 1);
        array.remove(0);
        array.sort(Comparators.INTEGERS);
        assertEquals(List.of(1, 2), array.values());
    }

    @Test
    public void testSwap() {
        var array = DynamicArray.of("a", "b", "c");
        array.swap(0, 2);
        assertEquals(List.of("c", "b", "a"), array.values());
        array.swap(1, 1);
        assertEquals(List.of("c", "b", "a"), array.values());
    }

    @Test
    public void testSwapOutOfRangeIsIgnored() {
        var array = DynamicArray.of("a", "b", "c");
        array.swap(0, 3);
        array.swap(-1, 1);
        array.swap(5, 6);
        assertEquals(List.of("a", "b", "c"), array.values());
    }

    @Test
    public void testToString() {
        assertEquals("DynamicArray\n1, 2, 3", DynamicArray.of(1, 2, 3).toString());
        assertEquals("DynamicArray\n", new DynamicArray<Integer>().toString());
    }

    @Test
    public void testNullElementsAreRejected() {
        var array = DynamicArray.of("a");
        assertThrows(NullPointerException.class, () -> array.add("b", null));
        assertThrows(NullPointerException.class, () -> array.insert(0, "b", null));
        assertThrows(NullPointerException.class, () -> array.set(0, null));
        assertThrows(NullPointerException.class, () -> array.set(1, null));
        assertEquals(List.of("a"), array.values());
    }

    @Test
    public void testHeterogeneousElements() {
        DynamicArray<Object> array = DynamicArray.of(1, "two", 3.0);
        assertTrue(array.contains("two", 3.0));
        array.sort(Comparators.byString());
        assertEquals(List.of(1, 3.0, "two"), array.values());
    }

    @Test
    public void testRamBytesUsedTracksCapacity() {
        var array = new DynamicArray<Integer>();
        long empty = array.ramBytesUsed();
        for (int i = 0; i < 100; i++) {
            array.add(i);
        }
        assertTrue(array.ramBytesUsed() >= empty + 100L * 4);
        array.clear();
        assertEquals(empty, array.ramBytesUsed());
    }
}
