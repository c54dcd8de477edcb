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
import dev.mars.stepwise.core.exceptions.StepwiseException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One unit of work in a flow.
 *
 * <p>A step declares its inputs, outputs and the branches it can complete through.
 * Steps are immutable configuration objects: anything a step must remember between
 * invocations (for example while suspended) goes into
 * {@link ConversationContext#getStepState()}.</p>
 *
 * <p>The engine resolves every declared input before calling {@link #invoke}; inputs
 * without a default are guaranteed to be present. An implementation either
 * completes with outputs and a branch, or suspends until the caller supplies a
 * value. Failures are reported by throwing a
 * {@link dev.mars.stepwise.core.exceptions.StepFailure} (or any runtime exception),
 * which a {@link CatchExceptionStep} can route.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public abstract class Step {

    /** Branch of a linear step. */
    public static final String NEXT = "next";

    private final String name;
    private final List<Descriptor> inputDescriptors;
    private final List<Descriptor> outputDescriptors;
    private final List<String> branches;

    protected Step(String name, List<Descriptor> inputDescriptors, List<Descriptor> outputDescriptors) {
        this(name, inputDescriptors, outputDescriptors, List.of(NEXT));
    }

    protected Step(String name, List<Descriptor> inputDescriptors, List<Descriptor> outputDescriptors,
                   List<String> branches) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name cannot be empty");
        }
        this.name = name;
        this.inputDescriptors = List.copyOf(inputDescriptors);
        this.outputDescriptors = List.copyOf(outputDescriptors);
        this.branches = List.copyOf(branches);
        requireUnique("input", this.inputDescriptors);
        requireUnique("output", this.outputDescriptors);
        if (this.branches.isEmpty()) {
            throw new IllegalArgumentException("Step '" + name + "' must declare at least one branch");
        }
        if (new HashSet<>(this.branches).size() != this.branches.size()) {
            throw new IllegalArgumentException("Step '" + name + "' declares duplicate branches: " + this.branches);
        }
    }

    /**
     * Runs the step.
     *
     * @param inputs  resolved values of every declared input
     * @param context the conversation this invocation belongs to
     * @return completion with outputs and branch, or a suspension
     * @throws StepwiseException if the step fails
     */
    public abstract StepResult invoke(Map<String, Object> inputs, ConversationContext context)
            throws StepwiseException;

    public String getName() {
        return name;
    }

    public List<Descriptor> getInputDescriptors() {
        return inputDescriptors;
    }

    public List<Descriptor> getOutputDescriptors() {
        return outputDescriptors;
    }

    public List<String> getBranches() {
        return branches;
    }

    public boolean isBranching() {
        return branches.size() > 1;
    }

    public Optional<Descriptor> getInputDescriptor(String inputName) {
        return inputDescriptors.stream().filter(d -> d.getName().equals(inputName)).findFirst();
    }

    public Optional<Descriptor> getOutputDescriptor(String outputName) {
        return outputDescriptors.stream().filter(d -> d.getName().equals(outputName)).findFirst();
    }

    private void requireUnique(String kind, List<Descriptor> descriptors) {
        Set<String> names = new HashSet<>();
        for (Descriptor descriptor : descriptors) {
            if (!names.add(descriptor.getName())) {
                throw new IllegalArgumentException("Step '" + name + "' declares duplicate " + kind
                        + " '" + descriptor.getName() + "'");
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "name='" + name + '\'' +
                ", inputs=" + inputDescriptors +
                ", outputs=" + outputDescriptors +
                ", branches=" + branches +
                '}';
    }
}
