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

import picocli.AutoComplete;
import picocli.CommandLine;

@CommandLine.Command(name = "dynarray",
    header = "DynamicArray workbench",
    mixinStandardHelpOptions = true,
    description = "Replays workloads against DynamicArray and reports how its buffer is reallocated",
    subcommands = {CommandLine.HelpCommand.class, AutoComplete.GenerateCompletion.class,
                   Replay_CMD.class, Grow_CMD.class})
public class DynArray_CMD {

  public static void main(String[] args) {
    @SuppressWarnings("InstantiationOfUtilityClass") DynArray_CMD command = new DynArray_CMD();
    CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
    int exitCode = commandLine.execute(args);
    System.exit(exitCode);
  }

}
