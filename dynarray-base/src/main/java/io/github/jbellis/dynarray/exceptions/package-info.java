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
 * Exception types raised by dynarray.
 * <p>
 * Out-of-range indexes are not errors in this library: they are reported through empty
 * {@code Optional}s, {@code -1} sentinels or silently ignored. The only failure that is surfaced
 * as an exception is running out of room for the backing buffer.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.dynarray.exceptions.CapacityExhaustedException} - An unchecked
 *       exception thrown when a buffer cannot grow to the requested capacity, either because the
 *       capacity exceeds the largest array the JVM can address or because the allocation itself
 *       failed. In the latter case the {@link OutOfMemoryError} is preserved as the cause.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     array.add(batch);
 * } catch (CapacityExhaustedException e) {
 *     // array is unchanged, the batch was not appended
 *     logger.warn("Could not grow to {} elements", e.getRequestedCapacity(), e);
 * }
 * }</pre>
 *
 * @see io.github.jbellis.dynarray.exceptions.CapacityExhaustedException
 */
package io.github.jbellis.dynarray.exceptions;
