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
 * JMH benchmarks for DynamicArray.
 * <ul>
 *   <li>{@link io.github.jbellis.dynarray.bench.AppendBenchmark} - single and batch appends under
 *       different growth factors, with {@code ArrayList} as a baseline</li>
 *   <li>{@link io.github.jbellis.dynarray.bench.PositionalMutationBenchmark} - insert/remove in the
 *       middle of the array, and draining an array with and without the shrink policy</li>
 *   <li>{@link io.github.jbellis.dynarray.bench.SortBenchmark} - in-place sort against sorting
 *       through the {@code java.util.List} view</li>
 * </ul>
 *
 * <h2>Running Benchmarks</h2>
 * <pre>
 * mvn clean package -pl benchmarks-jmh -am
 * java -jar benchmarks-jmh/target/benchmarks-jmh-*.jar AppendBenchmark
 * </pre>
 */
package io.github.jbellis.dynarray.bench;
