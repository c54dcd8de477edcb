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

import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.conversation.Conversation;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.ConversationFailedException;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.Variable;
import dev.mars.stepwise.core.graph.WritePolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableStepsTest {

    private SimpleFlowEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SimpleFlowEngine(StepwiseConfiguration.defaults());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private Flow writeThenRead(Variable variable, WritePolicy policy, DescriptorType inputType) throws GraphException {
        StartStep start = new StartStep(List.of(Descriptor.of("item", inputType)));
        VariableWriteStep write = new VariableWriteStep("write", variable, policy);
        VariableReadStep read = new VariableReadStep("read", variable, "current");
        return Flow.builder("variables")
                .beginStep(start)
                .controlEdge(start, write)
                .controlEdge(write, read)
                .endEdge(read)
                .dataEdge(start, "item", write, VariableWriteStep.DEFAULT_INPUT)
                .variable(variable)
                .build();
    }

    @Test
    void testOverwrite() throws Exception {
        Variable counter = new Variable("counter", DescriptorType.integer(), 0);
        Conversation conversation = engine.startConversation(
                writeThenRead(counter, WritePolicy.OVERWRITE, DescriptorType.integer()), Map.of("item", 7));

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals(7, finished.output("current"));
        assertEquals(7, conversation.getState().getVariables().get("counter"));
    }

    @Test
    void testInsertAppendsToList() throws Exception {
        Variable history = new Variable("history", DescriptorType.listOf(DescriptorType.string()), List.of("a"));
        Conversation conversation = engine.startConversation(
                writeThenRead(history, WritePolicy.INSERT, DescriptorType.string()), Map.of("item", "b"));

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals(List.of("a", "b"), finished.output("current"));
    }

    @Test
    void testMergeMap() throws Exception {
        DescriptorType type = DescriptorType.mapOf(DescriptorType.integer());
        Variable scores = new Variable("scores", type, Map.of("alice", 1, "bob", 2));
        Conversation conversation = engine.startConversation(
                writeThenRead(scores, WritePolicy.MERGE, type), Map.of("item", Map.of("bob", 5, "carol", 3)));

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals(Map.of("alice", 1, "bob", 5, "carol", 3), finished.output("current"));
    }

    @Test
    void testMergeList() throws Exception {
        DescriptorType type = DescriptorType.listOf(DescriptorType.integer());
        Variable numbers = new Variable("numbers", type, List.of(1));
        Conversation conversation = engine.startConversation(
                writeThenRead(numbers, WritePolicy.MERGE, type), Map.of("item", List.of(2, 3)));

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals(List.of(1, 2, 3), finished.output("current"));
    }

    @Test
    void testVariablesStartWithDefaults() throws Exception {
        Variable greeting = new Variable("greeting", DescriptorType.string(), "hello");
        VariableReadStep read = new VariableReadStep("read", greeting);
        Flow flow = Flow.builder("defaults").addStep(read).endEdge(read).variable(greeting).build();

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) engine.startConversation(flow, Map.of()).execute();

        assertEquals("hello", finished.output(VariableReadStep.DEFAULT_OUTPUT));
    }

    @Test
    void testIllTypedValueFailsConversation() throws Exception {
        Variable counter = new Variable("counter", DescriptorType.integer(), 0);
        VariableWriteStep write = new VariableWriteStep("write", counter);
        FunctionStep produce = FunctionStep.builder("produce")
                .output("anything", DescriptorType.any())
                .compute(inputs -> Map.of("anything", "not a number"))
                .build();
        Flow flow = Flow.builder("ill-typed")
                .controlEdge(produce, write)
                .endEdge(write)
                .dataEdge(produce, "anything", write, VariableWriteStep.DEFAULT_INPUT)
                .variable(counter)
                .build();

        ConversationFailedException exception = assertThrows(ConversationFailedException.class,
                () -> engine.startConversation(flow, Map.of()).execute());

        assertEquals("ValidationFailure", exception.getFailureKind());
        assertEquals("write", exception.getStepName());
    }

    @Test
    void testPolicyMustFitVariableType() {
        Variable counter = new Variable("counter", DescriptorType.integer(), 0);

        assertThrows(IllegalArgumentException.class, () -> new VariableWriteStep("w", counter, WritePolicy.INSERT));
        assertThrows(IllegalArgumentException.class, () -> new VariableWriteStep("w", counter, WritePolicy.MERGE));
    }
}
