/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepwise.core.step;

import dev.mars.stepwise.core.conversation.ConversationContext;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects a branch by exact match of the selector input against a mapping.
 * Absent or unmapped selector values take the {@value #DEFAULT_BRANCH} branch.
 */
public class BranchingStep extends Step {

    public static final String DEFAULT_BRANCH = "default";
    public static final String DEFAULT_INPUT = "next_step_name";

    private final Map<String, String> branchMapping;
    private final String inputName;

    public BranchingStep(String name, Map<String, String> branchMapping) {
        this(name, branchMapping, DEFAULT_INPUT);
    }

    public BranchingStep(String name, Map<String, String> branchMapping, String inputName) {
        super(name,
                List.of(Descriptor.withDefault(inputName, DescriptorType.any(), null)),
                List.of(),
                branchesOf(branchMapping));
        this.branchMapping = new LinkedHashMap<>(branchMapping);
        this.inputName = inputName;
    }

    private static List<String> branchesOf(Map<String, String> mapping) {
        Set<String> branches = new LinkedHashSet<>(mapping.values());
        branches.add(DEFAULT_BRANCH);
        return new ArrayList<>(branches);
    }

    public Map<String, String> getBranchMapping() {
        return Map.copyOf(branchMapping);
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) {
        Object selector = inputs.get(inputName);
        String branch = selector != null
                ? branchMapping.getOrDefault(String.valueOf(selector), DEFAULT_BRANCH)
                : DEFAULT_BRANCH;
        return StepResult.completed(Map.of(), branch);
    }
}
