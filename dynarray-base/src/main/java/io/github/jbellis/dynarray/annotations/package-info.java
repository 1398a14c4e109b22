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
 * Marker annotations describing the visibility intent of dynarray APIs.
 * <p>
 * {@link io.github.jbellis.dynarray.annotations.VisibleForTesting} marks members whose visibility
 * was widened only so that the test suite can observe internal state (for instance the physical
 * capacity bookkeeping of {@link io.github.jbellis.dynarray.list.DynamicArray}). Library users
 * should not depend on them.
 *
 * @see io.github.jbellis.dynarray.annotations.VisibleForTesting
 */
package io.github.jbellis.dynarray.annotations;
