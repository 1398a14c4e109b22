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

package io.github.jbellis.dynarray.example.yaml;

import io.github.jbellis.dynarray.list.CapacityPolicy;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * A workload loaded from a yaml file under yaml-configs/: the capacity policy, the initial
 * contents and the steps to replay against a DynamicArray.
 */
public class WorkloadConfig {
    private static final String defaultDirectory = "dynarray-examples/yaml-configs/";

    /** Optional, defaults to {@link CapacityPolicy#DEFAULT}. */
    public PolicyParameters policy;

    /** Values the array starts with. */
    public List<Object> initial;

    public List<Step> steps;

    public CapacityPolicy getCapacityPolicy() {
        if (policy == null) {
            return CapacityPolicy.DEFAULT;
        }
        return CapacityPolicy.of(policy.growthFactor, policy.shrinkFactor);
    }

    public static WorkloadConfig load(String configName) throws IOException {
        File configFile = new File(configName);
        if (!configFile.exists() && !configName.startsWith("/") && !configName.contains(":")) {
            configFile = new File(defaultDirectory + configName);
        }
        if (!configFile.exists()) {
            throw new FileNotFoundException(configFile.getAbsolutePath());
        }
        try (InputStream inputStream = new FileInputStream(configFile)) {
            return load(inputStream);
        }
    }

    public static WorkloadConfig load(InputStream inputStream) {
        Yaml yaml = new Yaml();
        WorkloadConfig config = yaml.loadAs(inputStream, WorkloadConfig.class);
        if (config == null) {
            throw new IllegalArgumentException("Workload is empty");
        }
        return config;
    }

    public static class PolicyParameters {
        public float growthFactor = CapacityPolicy.DEFAULT_GROWTH_FACTOR;
        public float shrinkFactor = CapacityPolicy.DEFAULT_SHRINK_FACTOR;
    }

    /**
     * One operation. Which fields are read depends on {@code op}:
     * add(values), insert(index, values), set(index, values[0]), remove(index),
     * swap(index, other), sort(order), clear.
     */
    public static class Step {
        public String op;
        public int index;
        public int other;
        public List<Object> values;
        /** natural, reversed or string; natural if unset */
        public String order;

        @Override
        public String toString() {
            return String.format("%s(index=%d, other=%d, values=%s, order=%s)", op, index, other, values, order);
        }
    }
}
