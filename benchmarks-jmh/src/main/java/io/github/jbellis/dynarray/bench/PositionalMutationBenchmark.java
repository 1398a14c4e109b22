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
package io.github.jbellis.dynarray.bench;

import io.github.jbellis.dynarray.list.CapacityPolicy;
import io.github.jbellis.dynarray.list.DynamicArray;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Measures positional insert and remove, which shift the tail of the buffer, and the cost of
 * the shrink policy when an array is drained.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Threads(1)
public class PositionalMutationBenchmark {
    private static final Logger log = LoggerFactory.getLogger(PositionalMutationBenchmark.class);

    @Param({"1000", "100000"})
    private int size;

    @Param({"DEFAULT", "NEVER_SHRINK"})
    private String policyName;

    private CapacityPolicy policy;
    private DynamicArray<Integer> array;
    private ArrayList<Integer> list;

    @Setup(Level.Invocation)
    public void setup() {
        policy = "NEVER_SHRINK".equals(policyName) ? CapacityPolicy.NEVER_SHRINK : CapacityPolicy.DEFAULT;
        array = new DynamicArray<>(policy);
        list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            array.add(i);
            list.add(i);
        }
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        log.info("{} elements left, capacity {}", array.size(), array.capacity());
    }

    @Benchmark
    public void insertRemoveMiddle(Blackhole blackhole) {
        int middle = array.size() / 2;
        array.insert(middle, -1);
        array.remove(middle);
        blackhole.consume(array.size());
    }

    @Benchmark
    public void insertRemoveMiddleArrayList(Blackhole blackhole) {
        int middle = list.size() / 2;
        list.add(middle, -1);
        list.remove(middle);
        blackhole.consume(list.size());
    }

    @Benchmark
    public void drainFromFront(Blackhole blackhole) {
        while (!array.isEmpty()) {
            array.remove(0);
        }
        blackhole.consume(array.capacity());
    }

    @Benchmark
    public void drainFromBack(Blackhole blackhole) {
        while (!array.isEmpty()) {
            array.remove(array.size() - 1);
        }
        blackhole.consume(array.capacity());
    }
}
