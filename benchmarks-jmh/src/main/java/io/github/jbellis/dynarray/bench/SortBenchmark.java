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

import io.github.jbellis.dynarray.list.DynamicArray;
import io.github.jbellis.dynarray.util.Comparators;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Collections;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Compares the in-place sort with sorting through the java.util.List view.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Threads(1)
public class SortBenchmark {
    @Param({"1000", "100000"})
    private int size;

    private DynamicArray<Integer> array;

    @Setup(Level.Invocation)
    public void setup() {
        var random = new Random(42);
        array = new DynamicArray<>();
        for (int i = 0; i < size; i++) {
            array.add(random.nextInt());
        }
    }

    @Benchmark
    public void sortInPlace(Blackhole blackhole) {
        array.sort(Comparators.INTEGERS);
        blackhole.consume(array);
    }

    @Benchmark
    public void sortListView(Blackhole blackhole) {
        Collections.sort(array.asList());
        blackhole.consume(array);
    }
}
