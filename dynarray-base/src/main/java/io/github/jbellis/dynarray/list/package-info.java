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

/**
 * Sequence containers backed by a single contiguous, resizable buffer.
 *
 * <p>{@link io.github.jbellis.dynarray.list.DynamicArray} is the implementation; it is written
 * against the {@link io.github.jbellis.dynarray.list.IndexedList} and
 * {@link io.github.jbellis.dynarray.list.Container} contracts, and reallocates its buffer as
 * directed by a per-instance {@link io.github.jbellis.dynarray.list.CapacityPolicy}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DynamicArray<Integer> array = DynamicArray.of(1, 2, 3);
 * array.insert(1, 10, 20);              // [1, 10, 20, 2, 3]
 * array.remove(0);                      // [10, 20, 2, 3]
 * array.set(array.size(), 99);          // index == size appends: [10, 20, 2, 3, 99]
 * array.set(10, 0);                     // out of range, ignored
 * array.swap(0, 4);                     // [99, 20, 2, 3, 10]
 * array.sort(Comparators.INTEGERS);     // [2, 3, 10, 20, 99]
 *
 * // interoperate with the collections framework
 * int pos = Collections.binarySearch(array.asList(), 20);
 * }</pre>
 *
 * <p>Index arguments are lenient throughout: out-of-range reads report "not found" and
 * out-of-range writes are ignored. None of the containers are thread-safe.
 */
package io.github.jbellis.dynarray.list;
