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

import io.github.jbellis.dynarray.example.commands.DynArray_CMD;
import io.github.jbellis.dynarray.example.yaml.WorkloadConfig;
import io.github.jbellis.dynarray.list.CapacityPolicy;
import org.junit.Test;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class WorkloadRunnerTest {

    private static WorkloadConfig parse(String yaml) {
        return WorkloadConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void replaysBundledWorkload() {
        InputStream in = getClass().getResourceAsStream("/workload.yml");
        assertNotNull(in);
        var config = WorkloadConfig.load(in);
        assertEquals(CapacityPolicy.DEFAULT, config.getCapacityPolicy());

        var runner = WorkloadRunner.run(config);
        assertEquals(List.of(99, 20, 2, 3, 10), runner.array().values());
    }

    @Test
    public void missingPolicyUsesDefault() {
        var config = parse("initial: [a, b]\n");
        assertEquals(CapacityPolicy.DEFAULT, config.getCapacityPolicy());
        assertEquals(List.of("a", "b"), WorkloadRunner.run(config).array().values());
    }

    @Test
    public void customPolicyIsApplied() {
        var config = parse("policy:\n  growthFactor: 1.5\n  shrinkFactor: 0\n");
        assertEquals(CapacityPolicy.of(1.5f, 0.0f), config.getCapacityPolicy());
    }

    @Test
    public void invalidPolicyIsRejected() {
        var config = parse("policy:\n  growthFactor: 0.5\n");
        assertThrows(IllegalArgumentException.class, config::getCapacityPolicy);
    }

    @Test
    public void sortAndClearSteps() {
        var config = parse("initial: [3, 1, 2]\n"
                           + "steps:\n"
                           + "  - op: sort\n");
        assertEquals(List.of(1, 2, 3), WorkloadRunner.run(config).array().values());

        config = parse("initial: [3, 1, 2]\n"
                       + "steps:\n"
                       + "  - op: SORT\n"
                       + "    order: reversed\n"
                       + "  - op: add\n"
                       + "    values: [7]\n");
        assertEquals(List.of(3, 2, 1, 7), WorkloadRunner.run(config).array().values());

        config = parse("initial: [3, 1, 2]\n"
                       + "steps:\n"
                       + "  - op: clear\n");
        var runner = WorkloadRunner.run(config);
        assertTrue(runner.array().isEmpty());
        assertEquals(0, runner.array().capacity());
    }

    @Test
    public void unknownOperationIsRejected() {
        var config = parse("steps:\n  - op: explode\n");
        var e = assertThrows(IllegalArgumentException.class, () -> WorkloadRunner.run(config));
        assertEquals("Unknown operation: explode", e.getMessage());
    }

    @Test
    public void setTakesOneValue() {
        var config = parse("initial: [1]\nsteps:\n  - op: set\n    index: 0\n    values: [1, 2]\n");
        assertThrows(IllegalArgumentException.class, () -> WorkloadRunner.run(config));
    }

    @Test
    public void recordsCapacityChanges() {
        var runner = new WorkloadRunner(CapacityPolicy.DEFAULT);
        runner.add(List.of(1, 2, 3, 4, 5, 6));
        runner.removeLast();
        runner.removeLast();
        runner.removeLast();

        var changes = runner.capacityChanges();
        // 0 -> 2 -> 6 -> 14 while appending, 14 -> 3 once size 3 <= 14 / 4
        assertEquals(4, changes.size());
        assertEquals(2, changes.get(0).toCapacity);
        assertEquals(6, changes.get(1).toCapacity);
        assertEquals(14, changes.get(2).toCapacity);
        assertTrue(changes.get(2).isGrowth());
        assertEquals(3, changes.get(3).toCapacity);
        assertEquals(9, changes.get(3).step);
        assertEquals("step 9 remove: capacity 14 -> 3 (size 3)", changes.get(3).toString());
    }

    @Test
    public void loadReportsMissingFile() {
        assertThrows(FileNotFoundException.class, () -> WorkloadConfig.load("no-such-workload.yml"));
    }

    @Test
    public void replayCommandPrintsResult() throws Exception {
        File workload = new File(getClass().getResource("/workload.yml").toURI());
        var sw = new StringWriter();
        var commandLine = new CommandLine(new DynArray_CMD());
        commandLine.setOut(new PrintWriter(sw));

        int exitCode = commandLine.execute("replay", "--verbose", workload.getAbsolutePath());
        assertEquals(0, exitCode);
        String output = sw.toString();
        assertTrue(output, output.startsWith("DynamicArray\n99, 20, 2, 3, 10"));
        assertTrue(output, output.contains("size=5 capacity=6 reallocations=2"));
    }

    @Test
    public void growCommandReportsTrajectory() {
        var sw = new StringWriter();
        var commandLine = new CommandLine(new DynArray_CMD());
        commandLine.setOut(new PrintWriter(sw));

        int exitCode = commandLine.execute("grow", "--count", "6");
        assertEquals(0, exitCode);
        String output = sw.toString();
        assertTrue(output, output.contains("appended 6, peak capacity 14, 3 growths"));
        assertTrue(output, output.contains("final capacity 0"));
    }

    @Test
    public void growCommandRejectsBadFactors() {
        var commandLine = new CommandLine(new DynArray_CMD());
        commandLine.setErr(new PrintWriter(new StringWriter()));
        assertEquals(2, commandLine.execute("grow", "--growth-factor", "1"));
    }
}
