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

import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Measures appending a run of elements one at a time, against java.util.ArrayList.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Threads(1)
public class AppendBenchmark {
    @Param({"100", "10000", "1000000"})
    private int count;

    @Param({"2.0", "1.5"})
    private float growthFactor;

    private Integer[] values;

    @Setup
    public void setup() {
        values = new Integer[count];
        for (int i = 0; i < count; i++) {
            values[i] = i;
        }
    }

    @Benchmark
    public void appendOneByOne(Blackhole blackhole) {
        var array = new DynamicArray<Integer>(CapacityPolicy.of(growthFactor, CapacityPolicy.DEFAULT_SHRINK_FACTOR));
        for (Integer value : values) {
            array.add(value);
        }
        blackhole.consume(array);
    }

    @Benchmark
    public void appendBatch(Blackhole blackhole) {
        var array = new DynamicArray<Integer>(CapacityPolicy.of(growthFactor, CapacityPolicy.DEFAULT_SHRINK_FACTOR));
        array.add(values);
        blackhole.consume(array);
    }

    @Benchmark
    public void appendArrayList(Blackhole blackhole) {
        var list = new ArrayList<Integer>();
        for (Integer value : values) {
            list.add(value);
        }
        blackhole.consume(list);
    }
}
