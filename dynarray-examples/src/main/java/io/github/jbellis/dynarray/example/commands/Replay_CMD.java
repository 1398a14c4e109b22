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
import io.github.jbellis.dynarray.example.yaml.WorkloadConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.FileNotFoundException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "replay",
    mixinStandardHelpOptions = true,
    description = "Replay a yaml workload and print the resulting array")
public class Replay_CMD implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(Replay_CMD.class);

  @CommandLine.Spec
  CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(index = "0",
      description = "Workload file, resolved as given and then under dynarray-examples/yaml-configs/",
      defaultValue = "workload.yml")
  String workload;

  @CommandLine.Option(names = {"-v", "--verbose"},
      description = "Print every reallocation")
  boolean verbose;

  @Override
  public Integer call() throws Exception {
    PrintWriter out = spec.commandLine().getOut();
    WorkloadConfig config;
    try {
      config = WorkloadConfig.load(workload);
    } catch (FileNotFoundException e) {
      log.error("Workload not found: {}", e.getMessage());
      return 2;
    }

    WorkloadRunner runner = WorkloadRunner.run(config);
    out.println(runner.array());
    out.printf("size=%d capacity=%d reallocations=%d%n",
               runner.array().size(), runner.array().capacity(), runner.capacityChanges().size());
    if (verbose) {
      runner.capacityChanges().forEach(out::println);
    }
    out.flush();
    return 0;
  }
}
