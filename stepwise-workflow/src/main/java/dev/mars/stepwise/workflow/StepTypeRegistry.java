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

package dev.mars.stepwise.workflow;

import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.WritePolicy;
import dev.mars.stepwise.core.step.BranchingStep;
import dev.mars.stepwise.core.step.CatchExceptionStep;
import dev.mars.stepwise.core.step.FlowExecutionStep;
import dev.mars.stepwise.core.step.InputMessageStep;
import dev.mars.stepwise.core.step.MapStep;
import dev.mars.stepwise.core.step.OutputMessageStep;
import dev.mars.stepwise.core.step.RetryStep;
import dev.mars.stepwise.core.step.StartStep;
import dev.mars.stepwise.core.step.Step;
import dev.mars.stepwise.core.step.ToolExecutionStep;
import dev.mars.stepwise.core.step.VariableReadStep;
import dev.mars.stepwise.core.step.VariableWriteStep;
import dev.mars.stepwise.core.tool.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps step type names to factories, and holds the tools and flows that step
 * definitions refer to by name.
 *
 * <p>The built-in types are registered on construction. Applications add their own
 * steps with {@link #registerStepType(String, StepFactory)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class StepTypeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StepTypeRegistry.class);

    public static final String START = "start";
    public static final String OUTPUT = "output";
    public static final String INPUT = "input";
    public static final String TOOL = "tool";
    public static final String BRANCHING = "branching";
    public static final String VARIABLE_READ = "variable-read";
    public static final String VARIABLE_WRITE = "variable-write";
    public static final String FLOW = "flow";
    public static final String MAP = "map";
    public static final String RETRY = "retry";
    public static final String CATCH = "catch";

    private final Map<String, StepFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final Map<String, Flow> flows = new ConcurrentHashMap<>();

    public StepTypeRegistry() {
        registerBuiltInTypes();
    }

    // Step types

    public StepTypeRegistry registerStepType(String type, StepFactory factory) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Step type cannot be empty");
        }
        Objects.requireNonNull(factory, "Step factory cannot be null");
        if (factories.put(type, factory) != null) {
            logger.info("Replaced factory for step type '{}'", type);
        }
        return this;
    }

    public Optional<StepFactory> getStepFactory(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(factories.get(type));
    }

    public boolean hasStepType(String type) {
        return type != null && factories.containsKey(type);
    }

    public Set<String> getStepTypes() {
        return new TreeSet<>(factories.keySet());
    }

    // Tools

    public StepTypeRegistry registerTool(Tool tool) {
        Objects.requireNonNull(tool, "Tool cannot be null");
        tools.put(tool.getName(), tool);
        logger.debug("Registered tool '{}'", tool.getName());
        return this;
    }

    public Optional<Tool> getTool(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    // Flows

    /**
     * Makes a flow available to composite steps under its id.
     */
    public StepTypeRegistry registerFlow(Flow flow) {
        Objects.requireNonNull(flow, "Flow cannot be null");
        flows.put(flow.getId(), flow);
        logger.debug("Registered flow '{}'", flow.getId());
        return this;
    }

    public Optional<Flow> getFlow(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(flows.get(id));
    }

    public Set<String> getFlowIds() {
        return new TreeSet<>(flows.keySet());
    }

    private void registerBuiltInTypes() {
        factories.put(START, (definition, registry) ->
                new StartStep(definition.getName(), definition.getDescriptors("inputs")));
        factories.put(OUTPUT, (definition, registry) ->
                new OutputMessageStep(definition.getName(), definition.getString("message", ""),
                        definition.getString("outputName", OutputMessageStep.DEFAULT_OUTPUT)));
        factories.put(INPUT, (definition, registry) ->
                new InputMessageStep(definition.getName(), definition.getString("prompt", ""),
                        definition.getString("outputName", InputMessageStep.DEFAULT_OUTPUT)));
        factories.put(TOOL, (definition, registry) ->
                new ToolExecutionStep(definition.getName(), definition.requireTool("tool", registry)));
        factories.put(BRANCHING, (definition, registry) ->
                new BranchingStep(definition.getName(), definition.getStringMap("mapping"),
                        definition.getString("input", BranchingStep.DEFAULT_INPUT)));
        factories.put(VARIABLE_READ, (definition, registry) ->
                new VariableReadStep(definition.getName(), definition.requireVariable("variable"),
                        definition.getString("outputName", VariableReadStep.DEFAULT_OUTPUT)));
        factories.put(VARIABLE_WRITE, StepTypeRegistry::createVariableWrite);
        factories.put(FLOW, (definition, registry) ->
                new FlowExecutionStep(definition.getName(), definition.requireFlow("flow", registry)));
        factories.put(MAP, StepTypeRegistry::createMap);
        factories.put(RETRY, (definition, registry) ->
                new RetryStep(definition.getName(), definition.requireFlow("flow", registry),
                        definition.requireString("successCondition"),
                        definition.getInt("maxNumTrials", RetryStep.DEFAULT_MAX_NUM_TRIALS)));
        factories.put(CATCH, (definition, registry) ->
                new CatchExceptionStep(definition.getName(), definition.requireFlow("flow", registry),
                        definition.getStringMap("exceptOn"), definition.getBoolean("catchAll", false)));
    }

    private static Step createVariableWrite(StepDefinition definition, StepTypeRegistry registry)
            throws FlowParseException {
        String policyName = definition.getString("policy", WritePolicy.OVERWRITE.name());
        WritePolicy policy;
        try {
            policy = WritePolicy.valueOf(policyName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw definition.error("policy", "Unknown write policy '" + policyName + "'");
        }
        return new VariableWriteStep(definition.getName(), definition.requireVariable("variable"), policy,
                definition.getString("input", VariableWriteStep.DEFAULT_INPUT));
    }

    private static Step createMap(StepDefinition definition, StepTypeRegistry registry) throws FlowParseException {
        MapStep.Builder builder = MapStep.builder(definition.getName(), definition.requireFlow("flow", registry))
                .parallelExecution(definition.getBoolean("parallel", false));
        if (definition.has("iteratedInput")) {
            builder.iteratedInput(definition.getString("iteratedInput"));
        }
        for (Map.Entry<String, String> entry : definition.getStringMap("unpack").entrySet()) {
            builder.unpack(entry.getKey(), entry.getValue());
        }
        for (String output : definition.getStringList("outputs")) {
            builder.output(output);
        }
        for (String variable : definition.getStringList("sharedVariables")) {
            builder.sharedVariable(variable);
        }
        return builder.build();
    }
}
