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

package io.github.jbellis.dynarray.exceptions;

/**
 * Thrown when a growable buffer cannot be resized to hold the requested number of elements.
 * The container that threw it is left exactly as it was before the failed operation.
 */
public class CapacityExhaustedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long requestedCapacity;

    public CapacityExhaustedException(long requestedCapacity, int maxCapacity) {
        super(String.format("Cannot hold %d elements, the maximum capacity is %d", requestedCapacity, maxCapacity));
        this.requestedCapacity = requestedCapacity;
    }

    public CapacityExhaustedException(long requestedCapacity, OutOfMemoryError cause) {
        super(String.format("Failed to allocate a buffer of %d elements", requestedCapacity), cause);
        this.requestedCapacity = requestedCapacity;
    }

    /**
     * @return the number of slots the failed operation needed
     */
    public long getRequestedCapacity() {
        return requestedCapacity;
    }
}
