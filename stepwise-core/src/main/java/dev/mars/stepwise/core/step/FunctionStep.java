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
import dev.mars.stepwise.core.exceptions.StepwiseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Custom step whose body is supplied as a function.
 *
 * <pre>{@code
 * Step twice = FunctionStep.builder("twice")
 *         .input("x", DescriptorType.integer())
 *         .output("y", DescriptorType.integer())
 *         .compute(inputs -> Map.of("y", (Integer) inputs.get("x") * 2))
 *         .build();
 * }</pre>
 */
public class FunctionStep extends Step {

    /**
     * Full step body with access to the conversation.
     */
    @FunctionalInterface
    public interface Body {
        StepResult apply(Map<String, Object> inputs, ConversationContext context) throws StepwiseException;
    }

    /**
     * Body of a linear step that only maps inputs to outputs.
     */
    @FunctionalInterface
    public interface Computation {
        Map<String, Object> apply(Map<String, Object> inputs) throws StepwiseException;
    }

    private final Body body;

    private FunctionStep(Builder builder) {
        super(builder.name, builder.inputs, builder.outputs, builder.branches);
        this.body = Objects.requireNonNull(builder.body, "Step body cannot be null");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) throws StepwiseException {
        return body.apply(inputs, context);
    }

    public static final class Builder {
        private final String name;
        private final List<Descriptor> inputs = new ArrayList<>();
        private final List<Descriptor> outputs = new ArrayList<>();
        private List<String> branches = List.of(NEXT);
        private Body body;

        private Builder(String name) {
            this.name = name;
        }

        public Builder input(Descriptor input) {
            inputs.add(input);
            return this;
        }

        public Builder input(String inputName, DescriptorType type) {
            return input(Descriptor.of(inputName, type));
        }

        public Builder output(Descriptor output) {
            outputs.add(output);
            return this;
        }

        public Builder output(String outputName, DescriptorType type) {
            return output(Descriptor.of(outputName, type));
        }

        public Builder branches(String... branchNames) {
            this.branches = List.of(branchNames);
            return this;
        }

        public Builder body(Body body) {
            this.body = body;
            return this;
        }

        public Builder compute(Computation computation) {
            this.body = (inputs, context) -> StepResult.completed(computation.apply(inputs));
            return this;
        }

        public FunctionStep build() {
            return new FunctionStep(this);
        }
    }
}
