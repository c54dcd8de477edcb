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

import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.step.StartStep;
import dev.mars.stepwise.core.step.Step;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Control-flow analysis over a flow graph.
 */
final class FlowOutputAnalyzer {

    private FlowOutputAnalyzer() {
    }

    /**
     * Names of the steps reachable from the begin step through control edges.
     */
    static Set<String> reachableSteps(Flow flow) {
        Set<String> reachable = new LinkedHashSet<>();
        if (flow.getBeginStep() == null || flow.getStep(flow.getBeginStep()) == null) {
            return reachable;
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(flow.getBeginStep());
        reachable.add(flow.getBeginStep());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (ControlEdge edge : flow.getControlEdges()) {
                String destination = edge.destinationStep();
                if (edge.sourceStep().equals(current) && destination != null
                        && flow.getStep(destination) != null && reachable.add(destination)) {
                    queue.add(destination);
                }
            }
        }
        return reachable;
    }

    /**
     * Outputs produced on every path from the begin step to a terminal control
     * edge. Loops are handled by iterating a must-analysis to its fixpoint:
     * OUT(s) = IN(s) + produced(s), IN(s) = intersection of OUT over predecessors.
     */
    static List<Descriptor> guaranteedOutputs(Flow flow) {
        Set<String> reachable = reachableSteps(flow);
        if (reachable.isEmpty()) {
            return List.of();
        }

        Set<String> universe = new HashSet<>();
        Map<String, List<String>> predecessors = new HashMap<>();
        for (String stepName : reachable) {
            for (Descriptor output : flow.getStep(stepName).getOutputDescriptors()) {
                universe.add(output.getName());
            }
        }
        for (ControlEdge edge : flow.getControlEdges()) {
            if (!edge.isTerminal() && reachable.contains(edge.sourceStep())
                    && reachable.contains(edge.destinationStep())) {
                predecessors.computeIfAbsent(edge.destinationStep(), k -> new ArrayList<>()).add(edge.sourceStep());
            }
        }

        Map<String, Set<String>> out = new HashMap<>();
        for (String stepName : reachable) {
            out.put(stepName, new HashSet<>(universe));
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (String stepName : reachable) {
                Set<String> in;
                if (stepName.equals(flow.getBeginStep())) {
                    in = new HashSet<>();
                } else {
                    in = null;
                    for (String predecessor : predecessors.getOrDefault(stepName, List.of())) {
                        if (in == null) {
                            in = new HashSet<>(out.get(predecessor));
                        } else {
                            in.retainAll(out.get(predecessor));
                        }
                    }
                    if (in == null) {
                        in = new HashSet<>();
                    }
                }
                for (Descriptor output : flow.getStep(stepName).getOutputDescriptors()) {
                    in.add(output.getName());
                }
                if (!in.equals(out.get(stepName))) {
                    out.put(stepName, in);
                    changed = true;
                }
            }
        }

        Set<String> guaranteed = null;
        for (ControlEdge edge : flow.getControlEdges()) {
            if (edge.isTerminal() && reachable.contains(edge.sourceStep())) {
                if (guaranteed == null) {
                    guaranteed = new HashSet<>(out.get(edge.sourceStep()));
                } else {
                    guaranteed.retainAll(out.get(edge.sourceStep()));
                }
            }
        }
        if (guaranteed == null) {
            return List.of();
        }

        // descriptor of the first non-start producer, in step declaration order
        Map<String, Descriptor> result = new LinkedHashMap<>();
        for (String stepName : reachable) {
            Step step = flow.getStep(stepName);
            if (step instanceof StartStep) {
                continue;
            }
            for (Descriptor output : step.getOutputDescriptors()) {
                if (guaranteed.contains(output.getName())) {
                    result.putIfAbsent(output.getName(), output);
                }
            }
        }
        return new ArrayList<>(result.values());
    }
}
