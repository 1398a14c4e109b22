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

import java.util.List;

/**
 * Base contract of every dynarray container.
 * <p>
 * Implementations are not thread-safe. Concurrent use from more than one thread is a precondition
 * violation; callers that share a container must provide their own locking.
 *
 * @param <T> the element type
 */
public interface Container<T> {
    /**
     * @return true if the container holds no elements
     */
    boolean isEmpty();

    /**
     * @return the number of elements in the container
     */
    int size();

    /**
     * Removes all elements.
     */
    void clear();

    /**
     * Returns the elements in container order. The returned list is a fresh copy: changing it does
     * not change the container, and vice versa.
     *
     * @return a new, mutable list of the elements
     */
    List<T> values();
}
