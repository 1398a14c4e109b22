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

package io.github.jbellis.dynarray.example.commands;

import io.github.jbellis.dynarray.example.WorkloadRunner;
import io.github.jbellis.dynarray.list.CapacityPolicy;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "grow",
    mixinStandardHelpOptions = true,
    description = "Append then remove a run of elements and print the capacity trajectory")
public class Grow_CMD implements Callable<Integer> {

  @CommandLine.Spec
  CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = {"-n", "--count"},
      description = "Number of elements to append, then remove",
      defaultValue = "1000")
  int count = 1000;

  @CommandLine.Option(names = {"-g", "--growth-factor"},
      description = "Growth factor, > 1",
      defaultValue = "2.0")
  float growthFactor = CapacityPolicy.DEFAULT_GROWTH_FACTOR;

  @CommandLine.Option(names = {"-s", "--shrink-factor"},
      description = "Shrink factor in [0, 1), 0 never shrinks",
      defaultValue = "0.25")
  float shrinkFactor = CapacityPolicy.DEFAULT_SHRINK_FACTOR;

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    if (count < 0) {
      throw new CommandLine.ParameterException(spec.commandLine(), "--count must be non-negative");
    }
    CapacityPolicy policy;
    try {
      policy = CapacityPolicy.of(growthFactor, shrinkFactor);
    } catch (IllegalArgumentException e) {
      throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
    }

    var runner = new WorkloadRunner(policy);
    out.println(policy);
    for (int i = 0; i < count; i++) {
      runner.add(List.of(i));
    }
    int peak = runner.array().capacity();
    for (int i = 0; i < count; i++) {
      runner.removeLast();
    }

    runner.capacityChanges().forEach(out::println);
    long growths = runner.capacityChanges().stream().filter(WorkloadRunner.CapacityChange::isGrowth).count();
    out.printf("appended %d, peak capacity %d, %d growths, %d shrinks, final capacity %d%n",
               count, peak, growths, runner.capacityChanges().size() - growths, runner.array().capacity());
    out.flush();
    return 0;
  }
}
