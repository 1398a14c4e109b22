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
 * Array manipulation helpers and comparators shared by the containers in
 * {@link io.github.jbellis.dynarray.list}.
 *
 * <ul>
 *   <li>{@link io.github.jbellis.dynarray.util.ArrayUtil} resizes backing buffers and moves
 *       sub-ranges of them in place.
 *   <li>{@link io.github.jbellis.dynarray.util.RamUsageEstimator} estimates the shallow footprint
 *       of backing buffers.
 *   <li>{@link io.github.jbellis.dynarray.util.Comparators} provides total-order comparators for
 *       common element types.
 * </ul>
 */
package io.github.jbellis.dynarray.util;
