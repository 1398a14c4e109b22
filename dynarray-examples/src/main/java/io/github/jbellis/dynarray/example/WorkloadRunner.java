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

package io.github.jbellis.dynarray.example;

import io.github.jbellis.dynarray.example.yaml.WorkloadConfig;
import io.github.jbellis.dynarray.list.CapacityPolicy;
import io.github.jbellis.dynarray.list.DynamicArray;
import io.github.jbellis.dynarray.util.Comparators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies workload steps to a DynamicArray and records every change of its capacity.
 */
public class WorkloadRunner {
    private static final Logger log = LoggerFactory.getLogger(WorkloadRunner.class);

    public enum Operation {
        ADD, INSERT, SET, REMOVE, SWAP, SORT, CLEAR;

        public static Operation parse(String op) {
            if (op == null) {
                throw new IllegalArgumentException("Step is missing 'op'");
            }
            try {
                return valueOf(op.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown operation: " + op, e);
            }
        }
    }

    /**
     * A reallocation observed after an operation.
     */
    public static final class CapacityChange {
        public final int step;
        public final String operation;
        public final int size;
        public final int fromCapacity;
        public final int toCapacity;

        CapacityChange(int step, String operation, int size, int fromCapacity, int toCapacity) {
            this.step = step;
            this.operation = operation;
            this.size = size;
            this.fromCapacity = fromCapacity;
            this.toCapacity = toCapacity;
        }

        public boolean isGrowth() {
            return toCapacity > fromCapacity;
        }

        @Override
        public String toString() {
            return String.format("step %d %s: capacity %d -> %d (size %d)", step, operation, fromCapacity, toCapacity, size);
        }
    }

    private final DynamicArray<Object> array;
    private final List<CapacityChange> changes = new ArrayList<>();
    private int steps;

    public WorkloadRunner(CapacityPolicy policy) {
        this.array = new DynamicArray<>(policy);
    }

    public static WorkloadRunner run(WorkloadConfig config) {
        var runner = new WorkloadRunner(config.getCapacityPolicy());
        if (config.initial != null && !config.initial.isEmpty()) {
            runner.add(config.initial);
        }
        if (config.steps != null) {
            for (WorkloadConfig.Step step : config.steps) {
                runner.apply(step);
            }
        }
        log.info("Applied {} operations: size {}, capacity {}, {} reallocations",
                 runner.steps, runner.array.size(), runner.array.capacity(), runner.changes.size());
        return runner;
    }

    public void apply(WorkloadConfig.Step step) {
        Operation operation = Operation.parse(step.op);
        log.debug("Applying {}", step);
        int before = array.capacity();
        switch (operation) {
            case ADD:
                array.add(valuesOf(step));
                break;
            case INSERT:
                array.insert(step.index, valuesOf(step));
                break;
            case SET: {
                Object[] values = valuesOf(step);
                if (values.length != 1) {
                    throw new IllegalArgumentException("set takes exactly one value, got " + values.length);
                }
                array.set(step.index, values[0]);
                break;
            }
            case REMOVE:
                array.remove(step.index);
                break;
            case SWAP:
                array.swap(step.index, step.other);
                break;
            case SORT:
                array.sort(comparatorFor(step.order));
                break;
            case CLEAR:
                array.clear();
                break;
        }
        record(operation.name().toLowerCase(Locale.ROOT), before);
    }

    /**
     * Appends the values one at a time.
     */
    public void add(List<?> values) {
        for (Object value : values) {
            int before = array.capacity();
            array.add(value);
            record("add", before);
        }
    }

    /**
     * Removes the last element.
     */
    public void removeLast() {
        int before = array.capacity();
        array.remove(array.size() - 1);
        record("remove", before);
    }

    public DynamicArray<Object> array() {
        return array;
    }

    public List<CapacityChange> capacityChanges() {
        return Collections.unmodifiableList(changes);
    }

    private void record(String operation, int before) {
        steps++;
        int after = array.capacity();
        if (after != before) {
            var change = new CapacityChange(steps, operation, array.size(), before, after);
            log.debug("{}", change);
            changes.add(change);
        }
    }

    private static Object[] valuesOf(WorkloadConfig.Step step) {
        if (step.values == null) {
            return new Object[0];
        }
        return step.values.toArray();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static Comparator<Object> comparatorFor(String order) {
        if (order == null || order.equalsIgnoreCase("natural")) {
            return (a, b) -> ((Comparable) a).compareTo(b);
        }
        if (order.equalsIgnoreCase("reversed")) {
            return (a, b) -> ((Comparable) b).compareTo(a);
        }
        if (order.equalsIgnoreCase("string")) {
            return Comparators.byString();
        }
        throw new IllegalArgumentException("Unknown sort order: " + order);
    }
}
