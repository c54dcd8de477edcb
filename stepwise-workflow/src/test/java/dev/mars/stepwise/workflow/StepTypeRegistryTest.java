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

import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.Variable;
import dev.mars.stepwise.core.graph.WritePolicy;
import dev.mars.stepwise.core.step.BranchingStep;
import dev.mars.stepwise.core.step.CatchExceptionStep;
import dev.mars.stepwise.core.step.FunctionStep;
import dev.mars.stepwise.core.step.MapStep;
import dev.mars.stepwise.core.step.OutputMessageStep;
import dev.mars.stepwise.core.step.RetryStep;
import dev.mars.stepwise.core.step.Step;
import dev.mars.stepwise.core.step.VariableWriteStep;
import dev.mars.stepwise.core.tool.ClientTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StepTypeRegistryTest {

    private StepTypeRegistry registry;
    private Map<String, Variable> variables;

    @BeforeEach
    void setUp() {
        registry = new StepTypeRegistry();
        variables = Map.of("total", new Variable("total", DescriptorType.integer(), 0));
    }

    private StepDefinition definition(Map<String, Object> fields) {
        return new StepDefinition("test-flow", "spec.steps[0]", fields, variables);
    }

    private Step create(Map<String, Object> fields) throws FlowParseException {
        StepDefinition definition = definition(fields);
        return registry.getStepFactory(definition.getType()).orElseThrow().create(definition, registry);
    }

    private static Flow checker() throws Exception {
        FunctionStep check = FunctionStep.builder("check")
                .output("ok", DescriptorType.bool())
                .compute(inputs -> Map.of("ok", true))
                .build();
        return Flow.builder("checker").addStep(check).endEdge(check).build();
    }

    // ========== Registration ==========

    @Test
    void testBuiltInTypes() {
        assertThat(registry.getStepTypes()).containsExactly(
                "branching", "catch", "flow", "input", "map", "output", "retry", "start", "tool",
                "variable-read", "variable-write");
        assertTrue(registry.hasStepType(StepTypeRegistry.MAP));
        assertFalse(registry.hasStepType("teleport"));
        assertFalse(registry.hasStepType(null));
    }

    @Test
    void testRegisterAndReplaceStepType() throws Exception {
        StepFactory first = (definition, reg) -> new OutputMessageStep(definition.getName(), "first");
        StepFactory second = (definition, reg) -> new OutputMessageStep(definition.getName(), "second");

        registry.registerStepType("greeting", first).registerStepType("greeting", second);

        Step step = create(Map.of("name", "hi", "type", "greeting"));
        assertEquals("second", ((OutputMessageStep) step).getTemplate());
    }

    @Test
    void testRegisterStepTypeRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> registry.registerStepType(" ", (d, r) -> null));
        assertThrows(NullPointerException.class, () -> registry.registerStepType("x", null));
    }

    @Test
    void testToolsAndFlows() throws Exception {
        ClientTool weather = ClientTool.builder("weather").build();
        Flow flow = checker();

        registry.registerTool(weather).registerFlow(flow);

        assertSame(weather, registry.getTool("weather").orElseThrow());
        assertSame(flow, registry.getFlow("checker").orElseThrow());
        assertTrue(registry.getTool("unknown").isEmpty());
        assertTrue(registry.getFlow(null).isEmpty());
        assertEquals(List.of("checker"), List.copyOf(registry.getFlowIds()));
    }

    // ========== Built-in factories ==========

    @Test
    void testOutputStepDefaults() throws Exception {
        Step step = create(Map.of("name", "say", "type", "output"));

        assertEquals("", ((OutputMessageStep) step).getTemplate());
        assertEquals(OutputMessageStep.DEFAULT_OUTPUT, step.getOutputDescriptors().get(0).getName());
    }

    @Test
    void testBranchingStep() throws Exception {
        Map<Object, Object> mapping = new LinkedHashMap<>();
        mapping.put("yes", "accept");
        mapping.put(1, "one");
        Step step = create(Map.of("name", "route", "type", "branching", "mapping", mapping, "input", "choice"));

        assertEquals(Map.of("yes", "accept", "1", "one"), ((BranchingStep) step).getBranchMapping());
        assertEquals(List.of("accept", "one", BranchingStep.DEFAULT_BRANCH), step.getBranches());
        assertTrue(step.getInputDescriptor("choice").isPresent());
    }

    @Test
    void testVariableWritePolicy() throws Exception {
        Step step = create(Map.of("name", "store", "type", "variable-write", "variable", "total", "policy", "Merge"));

        assertEquals(WritePolicy.MERGE, ((VariableWriteStep) step).getWritePolicy());
    }

    @Test
    void testUnknownWritePolicy() {
        FlowParseException exception = assertThrows(FlowParseException.class, () -> create(
                Map.of("name", "store", "type", "variable-write", "variable", "total", "policy", "append")));

        assertEquals("spec.steps[0].policy", exception.getFieldPath());
    }

    @Test
    void testUnknownReferences() {
        FlowParseException variable = assertThrows(FlowParseException.class, () -> create(
                Map.of("name", "read", "type", "variable-read", "variable", "missing")));
        FlowParseException tool = assertThrows(FlowParseException.class, () -> create(
                Map.of("name", "call", "type", "tool", "tool", "missing")));
        FlowParseException flow = assertThrows(FlowParseException.class, () -> create(
                Map.of("name", "run", "type", "flow")));

        assertEquals("Unknown variable 'missing'", variable.getRawMessage());
        assertEquals("Unknown tool 'missing'", tool.getRawMessage());
        assertEquals("spec.steps[0].flow", flow.getFieldPath());
        assertEquals("test-flow", flow.getFlowName());
    }

    @Test
    void testRetryStep() throws Exception {
        registry.registerFlow(checker());

        Step step = create(Map.of("name", "again", "type", "retry", "flow", "checker",
                "successCondition", "ok", "maxNumTrials", "3"));

        assertEquals(3, ((RetryStep) step).getMaxNumTrials());
    }

    @Test
    void testMapStep() throws Exception {
        registry.registerFlow(checker());

        Step step = create(Map.of("name", "each", "type", "map", "flow", "checker", "parallel", true));

        assertTrue(((MapStep) step).isParallelExecution());
        assertEquals(DescriptorType.listOf(DescriptorType.bool()), step.getOutputDescriptors().get(0).getType());
        assertTrue(step.getInputDescriptor(MapStep.ITERATED_INPUT).isPresent());
    }

    @Test
    void testCatchStep() throws Exception {
        registry.registerFlow(checker());

        Step step = create(Map.of("name", "guard", "type", "catch", "flow", "checker",
                "exceptOn", Map.of("ValueError", "recover"), "catchAll", true));

        CatchExceptionStep catchStep = (CatchExceptionStep) step;
        assertEquals(Map.of("ValueError", "recover"), catchStep.getExceptOn());
        assertTrue(catchStep.isCatchAllExceptions());
        assertThat(step.getBranches()).contains("recover", CatchExceptionStep.DEFAULT_EXCEPTION_BRANCH);
    }

    @Test
    void testRetryStepRejectsBadTrials() throws Exception {
        registry.registerFlow(checker());

        FlowParseException exception = assertThrows(FlowParseException.class, () -> create(
                Map.of("name", "again", "type", "retry", "flow", "checker",
                        "successCondition", "ok", "maxNumTrials", "many")));

        assertEquals("spec.steps[0].maxNumTrials", exception.getFieldPath());
    }

    @Test
    void testStartStepInputs() throws Exception {
        Step step = create(Map.of("name", "start", "type", "start",
                "inputs", List.of("anything", Map.of("name", "count", "type", "int", "default", 1))));

        assertEquals(2, step.getOutputDescriptors().size());
        assertEquals(DescriptorType.any(), step.getOutputDescriptors().get(0).getType());
        assertEquals(DescriptorType.integer(), step.getOutputDescriptors().get(1).getType());
    }

    @Test
    void testStartStepRejectsBadDefault() {
        FlowParseException exception = assertThrows(FlowParseException.class, () -> create(Map.of(
                "name", "start", "type", "start",
                "inputs", List.of(Map.of("name", "count", "type", "int", "default", "many")))));

        assertThat(exception.getFieldPath()).startsWith("spec.steps[0].inputs");
    }

    // ========== Step definitions ==========

    @Test
    void testStepDefinitionAccessors() throws Exception {
        StepDefinition definition = definition(Map.of("name", "s", "type", "custom", "flag", "TRUE",
                "count", 4, "items", List.of("a", 2)));

        assertEquals("s", definition.getName());
        assertEquals("custom", definition.getType());
        assertTrue(definition.getBoolean("flag", false));
        assertFalse(definition.getBoolean("absent", false));
        assertEquals(4, definition.getInt("count", 0));
        assertEquals(7, definition.getInt("absent", 7));
        assertEquals(List.of("a", "2"), definition.getStringList("items"));
        assertTrue(definition.getStringMap("absent").isEmpty());
        assertEquals("fallback", definition.getString("absent", "fallback"));
        assertThrows(FlowParseException.class, () -> definition.getStringMap("items"));
        assertThrows(FlowParseException.class, () -> definition.getStringList("count"));
        assertThrows(FlowParseException.class, () -> definition.requireString("absent"));
    }
}
