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
import dev.mars.stepwise.core.step.MapStep;
import dev.mars.stepwise.core.step.Step;
import dev.mars.stepwise.core.step.VariableStep;
import dev.mars.stepwise.core.validation.ValidationResult;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static well-formedness checks of a flow graph. Pure analysis, no side effects.
 *
 * <p>Control-edge cycles are allowed since they model loops; data-edge cycles
 * between steps are not.</p>
 */
public final class FlowValidator {

    private FlowValidator() {
    }

    public static ValidationResult validate(Flow flow) {
        ValidationResult result = new ValidationResult();

        validateBeginStep(flow, result);
        validateControlEdges(flow, result);
        validateReachability(flow, result);
        validateContextProviders(flow, result);
        validateDataEdges(flow, result);
        validateDataCycles(flow, result);
        validateInputResolution(flow, result);
        validateVariables(flow, result);

        return result;
    }

    private static void validateBeginStep(Flow flow, ValidationResult result) {
        if (flow.getSteps().isEmpty()) {
            result.addError("steps", "Flow has no steps");
        }
        if (flow.getBeginStep() == null) {
            result.addError("beginStep", "Begin step is required");
        } else if (flow.getStep(flow.getBeginStep()) == null) {
            result.addError("beginStep", "Begin step '" + flow.getBeginStep() + "' is not a step of the flow");
        }
    }

    private static void validateControlEdges(Flow flow, ValidationResult result) {
        Map<String, Integer> edgeCounts = new HashMap<>();
        for (ControlEdge edge : flow.getControlEdges()) {
            Step source = flow.getStep(edge.sourceStep());
            if (source == null) {
                result.addError("controlEdges", "Control edge " + edge + " starts at unknown step '"
                        + edge.sourceStep() + "'");
                continue;
            }
            if (!source.getBranches().contains(edge.sourceBranch())) {
                result.addError("controlEdges", "Step '" + source.getName() + "' has no branch '"
                        + edge.sourceBranch() + "' (branches: " + source.getBranches() + ")");
            }
            if (edge.destinationStep() != null && flow.getStep(edge.destinationStep()) == null) {
                result.addError("controlEdges", "Control edge " + edge + " leads to unknown step '"
                        + edge.destinationStep() + "'");
            }
            edgeCounts.merge(edge.sourceStep() + "\u0000" + edge.sourceBranch(), 1, Integer::sum);
        }

        for (Step step : flow.getSteps().values()) {
            for (String branch : step.getBranches()) {
                int count = edgeCounts.getOrDefault(step.getName() + "\u0000" + branch, 0);
                if (count == 0) {
                    result.addError("controlEdges", "Branch '" + branch + "' of step '" + step.getName()
                            + "' has no outgoing control edge");
                } else if (count > 1) {
                    result.addError("controlEdges", "Branch '" + branch + "' of step '" + step.getName()
                            + "' has " + count + " outgoing control edges");
                }
            }
        }
    }

    private static void validateReachability(Flow flow, ValidationResult result) {
        if (flow.getBeginStep() == null || flow.getStep(flow.getBeginStep()) == null) {
            return;
        }
        Set<String> reachable = FlowOutputAnalyzer.reachableSteps(flow);
        for (String stepName : flow.getSteps().keySet()) {
            if (!reachable.contains(stepName)) {
                result.addError("steps", "Step '" + stepName + "' is not reachable from begin step '"
                        + flow.getBeginStep() + "'");
            }
        }
    }

    private static void validateContextProviders(Flow flow, ValidationResult result) {
        Set<String> providerNames = new HashSet<>();
        Map<String, String> outputOwners = new HashMap<>();
        for (ContextProvider provider : flow.getContextProviders()) {
            if (!providerNames.add(provider.getName())) {
                result.addError("contextProviders", "Duplicate context provider name '" + provider.getName() + "'");
            }
            if (flow.getStep(provider.getName()) != null) {
                result.addError("contextProviders", "Context provider '" + provider.getName()
                        + "' has the same name as a step");
            }
            for (Descriptor output : provider.getOutputDescriptors()) {
                String owner = outputOwners.putIfAbsent(output.getName(), provider.getName());
                if (owner != null && !owner.equals(provider.getName())) {
                    result.addError("contextProviders", "Context providers '" + owner + "' and '"
                            + provider.getName() + "' both provide '" + output.getName() + "'");
                }
            }
        }
    }

    private static void validateDataEdges(Flow flow, ValidationResult result) {
        Set<String> seen = new HashSet<>();
        for (DataEdge edge : flow.getDataEdges()) {
            if (!seen.add(edge.toString())) {
                result.addWarning("dataEdges", "Duplicate data edge " + edge);
            }

            Optional<Descriptor> sourceDescriptor = findSourceDescriptor(flow, edge, result);
            Step destination = flow.getStep(edge.destinationStep());
            Optional<Descriptor> destinationDescriptor = Optional.empty();
            if (destination == null) {
                result.addError("dataEdges", "Data edge " + edge + " leads to unknown step '"
                        + edge.destinationStep() + "'");
            } else {
                destinationDescriptor = destination.getInputDescriptor(edge.destinationInput());
                if (destinationDescriptor.isEmpty()) {
                    result.addError("dataEdges", "Step '" + destination.getName() + "' has no input '"
                            + edge.destinationInput() + "'");
                }
            }

            if (sourceDescriptor.isPresent() && destinationDescriptor.isPresent()) {
                Descriptor from = sourceDescriptor.get();
                Descriptor to = destinationDescriptor.get();
                if (!to.getType().isAssignableFrom(from.getType())) {
                    result.addError("dataEdges", "Data edge " + edge + " connects incompatible types "
                            + from.getType() + " and " + to.getType());
                }
            }
        }
    }

    private static Optional<Descriptor> findSourceDescriptor(Flow flow, DataEdge edge, ValidationResult result) {
        Step sourceStep = flow.getStep(edge.source());
        if (sourceStep != null) {
            Optional<Descriptor> output = sourceStep.getOutputDescriptor(edge.sourceOutput());
            if (output.isEmpty()) {
                result.addError("dataEdges", "Step '" + sourceStep.getName() + "' has no output '"
                        + edge.sourceOutput() + "'");
            }
            return output;
        }
        Optional<ContextProvider> provider = flow.getContextProvider(edge.source());
        if (provider.isPresent()) {
            Optional<Descriptor> output = provider.get().getOutputDescriptors().stream()
                    .filter(d -> d.getName().equals(edge.sourceOutput()))
                    .findFirst();
            if (output.isEmpty()) {
                result.addError("dataEdges", "Context provider '" + edge.source() + "' has no output '"
                        + edge.sourceOutput() + "'");
            }
            return output;
        }
        result.addError("dataEdges", "Data edge " + edge + " starts at unknown step or context provider '"
                + edge.source() + "'");
        return Optional.empty();
    }

    /**
     * Kahn's algorithm over the step-to-step data edges.
     */
    private static void validateDataCycles(Flow flow, ValidationResult result) {
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String stepName : flow.getSteps().keySet()) {
            dependents.put(stepName, new HashSet<>());
            inDegree.put(stepName, 0);
        }
        for (DataEdge edge : flow.getDataEdges()) {
            if (dependents.containsKey(edge.source()) && dependents.containsKey(edge.destinationStep())
                    && dependents.get(edge.source()).add(edge.destinationStep())) {
                inDegree.merge(edge.destinationStep(), 1, Integer::sum);
            }
        }

        Queue<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }
        int visited = 0;
        while (!queue.isEmpty()) {
            String current = queue.poll();
            visited++;
            for (String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (visited != inDegree.size()) {
            Set<String> remaining = new TreeSet<>();
            for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
                if (entry.getValue() > 0) {
                    remaining.add(entry.getKey());
                }
            }
            result.addError("dataEdges", "Data edges form a cycle among steps " + remaining);
        }
    }

    private static void validateInputResolution(Flow flow, ValidationResult result) {
        Set<String> externalInputs = new HashSet<>();
        for (Descriptor input : flow.getInputDescriptors()) {
            externalInputs.add(input.getName());
        }
        for (Step step : flow.getSteps().values()) {
            for (Descriptor input : step.getInputDescriptors()) {
                if (input.hasDefault()
                        || flow.isFedByEdge(step.getName(), input.getName())
                        || externalInputs.contains(input.getName())
                        || flow.findProviderOf(input.getName()).isPresent()) {
                    continue;
                }
                result.addError("steps." + step.getName(), "Required input '" + input.getName()
                        + "' of step '" + step.getName() + "' is never resolvable");
            }
        }
    }

    private static void validateVariables(Flow flow, ValidationResult result) {
        Set<String> names = new HashSet<>();
        for (Variable variable : flow.getVariables()) {
            if (!names.add(variable.getName())) {
                result.addError("variables", "Duplicate variable name '" + variable.getName() + "'");
            }
        }
        for (Step step : flow.getSteps().values()) {
            if (step instanceof VariableStep variableStep) {
                Variable variable = variableStep.getVariable();
                Optional<Variable> declared = flow.getVariable(variable.getName());
                if (declared.isEmpty()) {
                    result.addError("steps." + step.getName(), "Step '" + step.getName()
                            + "' uses undeclared variable '" + variable.getName() + "'");
                } else if (!declared.get().getType().equals(variable.getType())) {
                    result.addError("steps." + step.getName(), "Step '" + step.getName()
                            + "' uses variable '" + variable.getName() + "' as " + variable.getType()
                            + " but it is declared as " + declared.get().getType());
                }
            }
            if (step instanceof MapStep mapStep) {
                for (String sharedName : mapStep.getSharedVariables()) {
                    if (!names.contains(sharedName)) {
                        result.addError("steps." + step.getName(), "Step '" + step.getName()
                                + "' shares undeclared variable '" + sharedName + "'");
                    }
                }
            }
        }
    }
}
