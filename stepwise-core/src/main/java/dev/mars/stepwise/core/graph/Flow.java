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

package dev.mars.stepwise.core.graph;

import dev.mars.stepwise.core.context.ContextProvider;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.step.StartStep;
import dev.mars.stepwise.core.step.Step;
import dev.mars.stepwise.core.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable graph of steps connected by control edges and data edges, plus the
 * variables and context providers its conversations use.
 *
 * <p>Flows are assembled with {@link #builder(String)} and validated once by
 * {@link Builder#build()}. A built flow never changes; all execution state lives
 * in the conversation.</p>
 *
 * <p>Flow inputs are the inputs of the begin {@link StartStep}, or, when the flow
 * does not begin with one, every step input that no data edge or context provider
 * feeds. Flow outputs default to the outputs produced on every path from the begin
 * step to a terminal control edge, excluding values that only a start step
 * produces.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public final class Flow {

    private final String id;
    private final String name;
    private final String description;
    private final String beginStep;
    private final Map<String, Step> steps;
    private final List<ControlEdge> controlEdges;
    private final List<DataEdge> dataEdges;
    private final List<Variable> variables;
    private final List<ContextProvider> contextProviders;
    private final Map<String, Integer> loopLimits;
    private final int maxStepVisits;
    private final Map<String, Map<String, ControlEdge>> controlIndex;
    private final Map<String, List<DataEdge>> dataIndex;
    private final List<Descriptor> inputDescriptors;
    private final List<Descriptor> outputDescriptors;
    private final List<String> exitBranches;

    private Flow(Builder builder) {
        this.name = builder.name;
        this.id = builder.id != null ? builder.id : builder.name;
        this.description = builder.description;
        this.beginStep = builder.beginStep;
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(builder.steps));
        this.controlEdges = List.copyOf(builder.controlEdges);
        this.dataEdges = List.copyOf(builder.dataEdges);
        this.variables = List.copyOf(builder.variables);
        this.contextProviders = List.copyOf(builder.contextProviders);
        this.loopLimits = Map.copyOf(builder.loopLimits);
        this.maxStepVisits = builder.maxStepVisits;

        Map<String, Map<String, ControlEdge>> control = new HashMap<>();
        for (ControlEdge edge : controlEdges) {
            control.computeIfAbsent(edge.sourceStep(), k -> new LinkedHashMap<>())
                    .putIfAbsent(edge.sourceBranch(), edge);
        }
        this.controlIndex = control;

        Map<String, List<DataEdge>> data = new HashMap<>();
        for (DataEdge edge : dataEdges) {
            data.computeIfAbsent(edge.destinationStep() + "." + edge.destinationInput(), k -> new ArrayList<>())
                    .add(edge);
        }
        this.dataIndex = data;

        this.inputDescriptors = List.copyOf(computeInputDescriptors());
        this.outputDescriptors = builder.outputDescriptors != null
                ? List.copyOf(builder.outputDescriptors)
                : List.copyOf(FlowOutputAnalyzer.guaranteedOutputs(this));
        Set<String> exits = new LinkedHashSet<>();
        for (ControlEdge edge : controlEdges) {
            if (edge.isTerminal()) {
                exits.add(edge.sourceBranch());
            }
        }
        this.exitBranches = List.copyOf(exits);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getBeginStep() {
        return beginStep;
    }

    public Map<String, Step> getSteps() {
        return steps;
    }

    public Step getStep(String stepName) {
        return steps.get(stepName);
    }

    public List<ControlEdge> getControlEdges() {
        return controlEdges;
    }

    public List<DataEdge> getDataEdges() {
        return dataEdges;
    }

    public List<Variable> getVariables() {
        return variables;
    }

    public Optional<Variable> getVariable(String variableName) {
        return variables.stream().filter(v -> v.getName().equals(variableName)).findFirst();
    }

    public List<ContextProvider> getContextProviders() {
        return contextProviders;
    }

    public Optional<ContextProvider> getContextProvider(String providerName) {
        return contextProviders.stream().filter(p -> p.getName().equals(providerName)).findFirst();
    }

    /**
     * Finds the context provider that outputs a value of the given name.
     */
    public Optional<ContextProvider> findProviderOf(String outputName) {
        return contextProviders.stream()
                .filter(p -> p.getOutputDescriptors().stream().anyMatch(d -> d.getName().equals(outputName)))
                .findFirst();
    }

    /**
     * Outgoing control edge of a step for the given branch, or {@code null} if none is declared.
     */
    public ControlEdge getControlEdge(String stepName, String branch) {
        Map<String, ControlEdge> byBranch = controlIndex.get(stepName);
        return byBranch != null ? byBranch.get(branch) : null;
    }

    public List<DataEdge> getDataEdgesInto(String stepName, String inputName) {
        return dataIndex.getOrDefault(stepName + "." + inputName, List.of());
    }

    public boolean isFedByEdge(String stepName, String inputName) {
        return dataIndex.containsKey(stepName + "." + inputName);
    }

    /**
     * Maximum number of times a step may be entered in one conversation, or 0
     * when the engine-wide limit applies.
     */
    public int getLoopLimit(String stepName) {
        return loopLimits.getOrDefault(stepName, maxStepVisits);
    }

    public List<Descriptor> getInputDescriptors() {
        return inputDescriptors;
    }

    public List<Descriptor> getOutputDescriptors() {
        return outputDescriptors;
    }

    public List<String> getExitBranches() {
        return exitBranches;
    }

    /**
     * Re-runs the static checks performed at build time.
     *
     * @throws GraphException if the graph is not well-formed
     */
    public void validate() throws GraphException {
        ValidationResult result = FlowValidator.validate(this);
        if (!result.isValid()) {
            throw new GraphException(name, result.getErrorMessages());
        }
    }

    private List<Descriptor> computeInputDescriptors() {
        Step begin = beginStep != null ? steps.get(beginStep) : null;
        if (begin instanceof StartStep) {
            return begin.getInputDescriptors();
        }
        Map<String, Descriptor> external = new LinkedHashMap<>();
        for (Step step : steps.values()) {
            for (Descriptor input : step.getInputDescriptors()) {
                if (!isFedByEdge(step.getName(), input.getName())
                        && findProviderOf(input.getName()).isEmpty()) {
                    external.putIfAbsent(input.getName(), input);
                }
            }
        }
        return new ArrayList<>(external.values());
    }

    @Override
    public String toString() {
        return "Flow{" +
                "id='" + id + '\'' +
                ", steps=" + steps.keySet() +
                ", controlEdges=" + controlEdges.size() +
                ", dataEdges=" + dataEdges.size() +
                '}';
    }

    /**
     * Assembles a flow. Steps passed to edge methods are registered automatically;
     * the first registered step is the begin step unless {@link #beginStep} says otherwise.
     */
    public static final class Builder {

        private final String name;
        private String id;
        private String description;
        private String beginStep;
        private final Map<String, Step> steps = new LinkedHashMap<>();
        private final List<ControlEdge> controlEdges = new ArrayList<>();
        private final List<DataEdge> dataEdges = new ArrayList<>();
        private final List<Variable> variables = new ArrayList<>();
        private final List<ContextProvider> contextProviders = new ArrayList<>();
        private final Map<String, Integer> loopLimits = new HashMap<>();
        private final List<String> builderErrors = new ArrayList<>();
        private List<Descriptor> outputDescriptors;
        private int maxStepVisits;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Flow name cannot be empty");
            }
            this.name = name;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder beginStep(Step step) {
            addStep(step);
            this.beginStep = step.getName();
            return this;
        }

        public Builder beginStep(String stepName) {
            this.beginStep = stepName;
            return this;
        }

        public Builder addStep(Step step) {
            Objects.requireNonNull(step, "Step cannot be null");
            Step existing = steps.get(step.getName());
            if (existing == null) {
                steps.put(step.getName(), step);
                if (beginStep == null) {
                    beginStep = step.getName();
                }
            } else if (existing != step) {
                builderErrors.add("Duplicate step name '" + step.getName() + "'");
            }
            return this;
        }

        /**
         * Control edge for the default {@code next} branch.
         */
        public Builder controlEdge(Step source, Step destination) {
            return controlEdge(source, Step.NEXT, destination);
        }

        public Builder controlEdge(Step source, String branch, Step destination) {
            addStep(source);
            if (destination != null) {
                addStep(destination);
            }
            return controlEdge(source.getName(), branch, destination != null ? destination.getName() : null);
        }

        public Builder controlEdge(String source, String branch, String destination) {
            controlEdges.add(new ControlEdge(source, branch, destination));
            return this;
        }

        /**
         * Ends the flow when {@code source} completes through its {@code next} branch.
         */
        public Builder endEdge(Step source) {
            return controlEdge(source, Step.NEXT, null);
        }

        public Builder endEdge(Step source, String branch) {
            return controlEdge(source, branch, null);
        }

        public Builder dataEdge(Step source, String sourceOutput, Step destination, String destinationInput) {
            addStep(source);
            addStep(destination);
            return dataEdge(source.getName(), sourceOutput, destination.getName(), destinationInput);
        }

        public Builder dataEdge(ContextProvider source, String sourceOutput, Step destination, String destinationInput) {
            contextProvider(source);
            addStep(destination);
            return dataEdge(source.getName(), sourceOutput, destination.getName(), destinationInput);
        }

        public Builder dataEdge(String source, String sourceOutput, String destination, String destinationInput) {
            dataEdges.add(new DataEdge(source, sourceOutput, destination, destinationInput));
            return this;
        }

        public Builder variable(Variable variable) {
            variables.add(Objects.requireNonNull(variable, "Variable cannot be null"));
            return this;
        }

        public Builder contextProvider(ContextProvider provider) {
            Objects.requireNonNull(provider, "Context provider cannot be null");
            if (!contextProviders.contains(provider)) {
                contextProviders.add(provider);
            }
            return this;
        }

        /**
         * Overrides the flow outputs instead of inferring them from the graph.
         */
        public Builder outputs(List<Descriptor> outputs) {
            this.outputDescriptors = outputs != null ? List.copyOf(outputs) : null;
            return this;
        }

        /**
         * Caps how often one step may be entered in a conversation.
         */
        public Builder loopLimit(String stepName, int limit) {
            if (limit < 1) {
                throw new IllegalArgumentException("Loop limit must be positive: " + limit);
            }
            loopLimits.put(stepName, limit);
            return this;
        }

        /**
         * Default visit cap for all steps of this flow; 0 uses the engine configuration.
         */
        public Builder maxStepVisits(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("Visit limit cannot be negative: " + limit);
            }
            this.maxStepVisits = limit;
            return this;
        }

        /**
         * Runs the static checks without building.
         */
        public ValidationResult validate() {
            ValidationResult result = FlowValidator.validate(new Flow(this));
            for (String error : builderErrors) {
                result.addError("steps", error);
            }
            return result;
        }

        /**
         * Builds and validates the flow.
         *
         * @throws GraphException listing every problem if the graph is not well-formed
         */
        public Flow build() throws GraphException {
            Flow flow = new Flow(this);
            ValidationResult result = FlowValidator.validate(flow);
            for (String error : builderErrors) {
                result.addError("steps", error);
            }
            if (!result.isValid()) {
                throw new GraphException(name, result.getErrorMessages());
            }
            return flow;
        }
    }
}
