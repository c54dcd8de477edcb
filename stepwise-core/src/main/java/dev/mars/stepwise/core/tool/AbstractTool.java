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

package dev.mars.stepwise.core.tool;

import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared configuration of server and client tools.
 */
public abstract class AbstractTool implements Tool {

    /** Output name used when a tool declares no outputs. */
    public static final String DEFAULT_OUTPUT = "tool_output";

    private final String name;
    private final String description;
    private final List<Descriptor> inputDescriptors;
    private final List<Descriptor> outputDescriptors;
    private final boolean requiresConfirmation;

    protected AbstractTool(Builder<?> builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Tool name cannot be empty");
        }
        this.name = builder.name;
        this.description = builder.description != null ? builder.description : "";
        this.inputDescriptors = List.copyOf(builder.inputs);
        this.outputDescriptors = builder.outputs.isEmpty()
                ? List.of(Descriptor.any(DEFAULT_OUTPUT))
                : List.copyOf(builder.outputs);
        this.requiresConfirmation = builder.requiresConfirmation;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public List<Descriptor> getInputDescriptors() {
        return inputDescriptors;
    }

    @Override
    public List<Descriptor> getOutputDescriptors() {
        return outputDescriptors;
    }

    @Override
    public boolean requiresConfirmation() {
        return requiresConfirmation;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', inputs=" + inputDescriptors
                + ", outputs=" + outputDescriptors + '}';
    }

    @SuppressWarnings("unchecked")
    public abstract static class Builder<B extends Builder<B>> {
        private final String name;
        private String description;
        private final List<Descriptor> inputs = new ArrayList<>();
        private final List<Descriptor> outputs = new ArrayList<>();
        private boolean requiresConfirmation;

        protected Builder(String name) {
            this.name = name;
        }

        public B description(String description) {
            this.description = description;
            return (B) this;
        }

        public B input(Descriptor input) {
            inputs.add(input);
            return (B) this;
        }

        public B input(String inputName, DescriptorType type) {
            return input(Descriptor.of(inputName, type));
        }

        public B output(Descriptor output) {
            outputs.add(output);
            return (B) this;
        }

        public B output(String outputName, DescriptorType type) {
            return output(Descriptor.of(outputName, type));
        }

        public B requiresConfirmation(boolean requiresConfirmation) {
            this.requiresConfirmation = requiresConfirmation;
            return (B) this;
        }
    }
}
