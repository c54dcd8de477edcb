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

package dev.mars.stepwise.core.persistence;

import dev.mars.stepwise.core.TestFlows;
import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.conversation.Conversation;
import dev.mars.stepwise.core.conversation.ConversationState;
import dev.mars.stepwise.core.conversation.ConversationStatus;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.conversation.ToolRequest;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.StateSerializationException;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.step.FunctionStep;
import dev.mars.stepwise.core.step.InputMessageStep;
import dev.mars.stepwise.core.step.MapStep;
import dev.mars.stepwise.core.step.OutputMessageStep;
import dev.mars.stepwise.core.step.RetryStep;
import dev.mars.stepwise.core.step.StartStep;
import dev.mars.stepwise.core.step.ToolExecutionStep;
import dev.mars.stepwise.core.tool.ClientTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ConversationStateSerializerTest {

    private SimpleFlowEngine engine;
    private ConversationStateSerializer serializer;

    @BeforeEach
    void setUp() {
        engine = new SimpleFlowEngine(StepwiseConfiguration.defaults());
        serializer = new ConversationStateSerializer();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static Flow greeting() throws Exception {
        InputMessageStep ask = new InputMessageStep("ask", "What is your name?", "name");
        OutputMessageStep greet = new OutputMessageStep("greet", "Hello {{name}}");
        return Flow.builder("greeting")
                .beginStep(ask)
                .controlEdge(ask, greet)
                .endEdge(greet)
                .dataEdge(ask, "name", greet, "name")
                .build();
    }

    // ========== Round trips ==========

    @Test
    void testRoundTripReproducesDocument() throws Exception {
        Flow flow = TestFlows.sumAndBranch();
        Conversation conversation = engine.startConversation(flow, Map.of("a", 2, "b", 3), "c1");
        conversation.execute();

        String json = serializer.serialize(conversation.getState(), flow);
        ConversationState restored = serializer.deserialize(json, flow);

        assertEquals(json, serializer.serialize(restored, flow));
        assertEquals(ConversationStatus.FINISHED, restored.getStatus());
        assertEquals("pos", restored.getFinalOutputs().get("output"));
    }

    @Test
    void testEnvelopeFields() throws Exception {
        Flow flow = TestFlows.timesTen();
        Conversation conversation = engine.startConversation(flow, Map.of("x", 1), "c2");

        String json = serializer.serialize(conversation.getState(), flow);

        assertThat(json).contains("\"format\":\"stepwise-conversation\"")
                .contains("\"version\":1")
                .contains("\"flowId\":\"times-ten\"")
                .contains("\"flowFingerprint\":\"" + ConversationStateSerializer.fingerprint(flow) + "\"");
    }

    @Test
    void testRestoredConversationBehavesLikeOriginal() throws Exception {
        Flow flow = greeting();
        Conversation original = engine.startConversation(flow, Map.of(), "c3");
        original.execute();

        Conversation restored = engine.restoreConversation(engine.serialize(original), flow);
        original.supplyUserMessage("Ada");
        restored.supplyUserMessage("Ada");
        ExecutionStatus originalStatus = original.execute();
        ExecutionStatus restoredStatus = restored.execute();

        assertEquals(originalStatus, restoredStatus);
        assertEquals("Hello Ada", ((ExecutionStatus.Finished) restoredStatus).output("output_message"));
        assertEquals(engine.serialize(original), engine.serialize(restored));
    }

    @Test
    void testNullValuesSurviveRoundTrip() throws Exception {
        FunctionStep produce = FunctionStep.builder("produce")
                .output("v", DescriptorType.any())
                .compute(inputs -> {
                    Map<String, Object> outputs = new HashMap<>();
                    outputs.put("v", null);
                    return outputs;
                })
                .build();
        InputMessageStep ask = new InputMessageStep("ask", "Continue?");
        FunctionStep use = FunctionStep.builder("use")
                .input("v", DescriptorType.any())
                .output("out", DescriptorType.string())
                .compute(inputs -> Map.of("out", "v=" + inputs.get("v")))
                .build();
        Flow flow = Flow.builder("null-output")
                .beginStep(produce)
                .controlEdge(produce, ask)
                .controlEdge(ask, use)
                .endEdge(use)
                .dataEdge(produce, "v", use, "v")
                .build();
        Conversation original = engine.startConversation(flow, Map.of(), "c5");
        assertInstanceOf(ExecutionStatus.NeedsExternalInput.class, original.execute());

        String json = engine.serialize(original);
        assertThat(json).contains("\"produce\":{\"v\":null}");

        Conversation restored = engine.restoreConversation(json, flow);
        assertTrue(restored.getState().getProducedOutputs().get("produce").containsKey("v"));
        original.supplyUserMessage("yes");
        restored.supplyUserMessage("yes");
        ExecutionStatus originalStatus = original.execute();
        ExecutionStatus restoredStatus = restored.execute();

        assertEquals(originalStatus, restoredStatus);
        assertEquals("v=null", ((ExecutionStatus.Finished) restoredStatus).output("out"));
    }

    // ========== Nested conversations ==========

    @Test
    void testParallelMapSuspendedOnClientToolsResumesAfterRestore() throws Exception {
        ClientTool lookup = ClientTool.builder("lookup")
                .input("x", DescriptorType.integer())
                .output("y", DescriptorType.integer())
                .build();
        ToolExecutionStep call = new ToolExecutionStep("call", lookup);
        Flow nested = Flow.builder("lookup-one").addStep(call).endEdge(call).build();
        MapStep map = MapStep.builder("each", nested)
                .unpack("x", MapStep.ITEM)
                .parallelExecution(true)
                .build();
        StartStep start = new StartStep(List.of(Descriptor.of("numbers", DescriptorType.listOf(DescriptorType.integer()))));
        Flow flow = Flow.builder("lookup-all")
                .beginStep(start)
                .controlEdge(start, map)
                .endEdge(map)
                .dataEdge(start, "numbers", map, MapStep.ITERATED_INPUT)
                .build();

        Conversation original = engine.startConversation(flow, Map.of("numbers", List.of(3, 1, 2)), "c6");
        ExecutionStatus.NeedsToolResult status = (ExecutionStatus.NeedsToolResult) original.execute();
        assertEquals(3, status.toolRequests().size());

        Conversation restored = engine.restoreConversation(engine.serialize(original), flow);
        for (ToolRequest request : status.toolRequests()) {
            Object result = (Integer) request.arguments().get("x") * 10;
            original.supplyToolResult(request.requestId(), result);
            restored.supplyToolResult(request.requestId(), result);
        }
        ExecutionStatus originalStatus = original.execute();
        ExecutionStatus restoredStatus = restored.execute();

        assertEquals(originalStatus, restoredStatus);
        assertEquals(List.of(30, 10, 20), ((ExecutionStatus.Finished) restoredStatus).output("y"));
    }

    @Test
    void testRetryAttemptSuspendedMidwayResumesAfterRestore() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        FunctionStep count = FunctionStep.builder("count")
                .output("n", DescriptorType.integer())
                .compute(inputs -> Map.of("n", attempts.incrementAndGet()))
                .build();
        InputMessageStep ask = new InputMessageStep("ask", "Try again?");
        FunctionStep decide = FunctionStep.builder("decide")
                .input(InputMessageStep.DEFAULT_OUTPUT, DescriptorType.string())
                .output("ok", DescriptorType.bool())
                .compute(inputs -> Map.of("ok", "yes".equals(inputs.get(InputMessageStep.DEFAULT_OUTPUT))))
                .build();
        Flow asking = Flow.builder("asking")
                .controlEdge(count, ask)
                .controlEdge(ask, decide)
                .endEdge(decide)
                .dataEdge(ask, InputMessageStep.DEFAULT_OUTPUT, decide, InputMessageStep.DEFAULT_OUTPUT)
                .build();
        RetryStep retry = new RetryStep("retry", asking, "ok", 3);
        OutputMessageStep won = new OutputMessageStep("won", "success", "result");
        OutputMessageStep lost = new OutputMessageStep("lost", "failure", "result");
        Flow flow = Flow.builder("retrying")
                .beginStep(retry)
                .controlEdge(retry, RetryStep.SUCCESS_BRANCH, won)
                .controlEdge(retry, RetryStep.FAILURE_BRANCH, lost)
                .endEdge(won)
                .endEdge(lost)
                .build();

        Conversation original = engine.startConversation(flow, Map.of(), "c7");
        assertInstanceOf(ExecutionStatus.NeedsExternalInput.class, original.execute());
        original.supplyUserMessage("no");
        assertInstanceOf(ExecutionStatus.NeedsExternalInput.class, original.execute());
        assertEquals(2, attempts.get());

        Conversation restored = engine.restoreConversation(engine.serialize(original), flow);
        original.supplyUserMessage("yes");
        restored.supplyUserMessage("yes");
        ExecutionStatus originalStatus = original.execute();
        ExecutionStatus restoredStatus = restored.execute();

        assertEquals(originalStatus, restoredStatus);
        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) restoredStatus;
        assertEquals("success", finished.output("result"));
        assertEquals(2, finished.output(RetryStep.ATTEMPTS_OUTPUT));
        assertEquals(2, attempts.get());
    }

    @Test
    void testPrettyPrintedDocumentIsReadable() throws Exception {
        Flow flow = TestFlows.timesTen();
        Properties properties = new Properties();
        properties.setProperty(StepwiseConfiguration.STATE_PRETTY_PRINT, "true");
        ConversationStateSerializer pretty = new ConversationStateSerializer(new StepwiseConfiguration(properties));
        ConversationState state = engine.startConversation(flow, Map.of("x", 7), "c4").getState();

        String json = pretty.serialize(state, flow);

        assertTrue(json.contains("\n"));
        assertEquals(Map.of("x", 7), serializer.deserialize(json, flow).getFlowInputs());
    }

    // ========== Rejections ==========

    @Test
    void testEmptyDocumentIsRejected() {
        assertThrows(StateSerializationException.class, () -> serializer.deserialize("  ", TestFlows.timesTen()));
    }

    @Test
    void testMalformedDocumentIsRejected() {
        assertThrows(StateSerializationException.class, () -> serializer.deserialize("{not json", TestFlows.timesTen()));
        assertThrows(StateSerializationException.class, () -> serializer.deserialize("[1, 2]", TestFlows.timesTen()));
    }

    @Test
    void testUnknownFormatIsRejected() {
        StateSerializationException exception = assertThrows(StateSerializationException.class,
                () -> serializer.deserialize("{\"format\":\"other\",\"version\":1}", TestFlows.timesTen()));

        assertTrue(exception.getMessage().contains("other"));
    }

    @Test
    void testNewerVersionIsRejected() {
        assertThrows(StateSerializationException.class, () -> serializer.deserialize(
                "{\"format\":\"stepwise-conversation\",\"version\":2,\"flowId\":\"times-ten\"}", TestFlows.timesTen()));
    }

    @Test
    void testDocumentOfOtherFlowIsRejected() throws Exception {
        Flow flow = TestFlows.timesTen();
        String json = serializer.serialize(engine.startConversation(flow, Map.of("x", 1)).getState(), flow);

        StateSerializationException exception = assertThrows(StateSerializationException.class,
                () -> serializer.deserialize(json, TestFlows.sumAndBranch()));

        assertTrue(exception.getMessage().contains("Document belongs to flow 'times-ten'"));
    }

    @Test
    void testChangedFlowIsRejected() throws Exception {
        Flow flow = TestFlows.timesTen();
        String json = serializer.serialize(engine.startConversation(flow, Map.of("x", 1)).getState(), flow);
        FunctionStep multiply = FunctionStep.builder("multiply")
                .input("x", DescriptorType.integer())
                .output("z", DescriptorType.integer())
                .compute(inputs -> Map.of("z", 0))
                .build();
        Flow changed = Flow.builder("times-ten").addStep(multiply).endEdge(multiply).build();

        StateSerializationException exception = assertThrows(StateSerializationException.class,
                () -> serializer.deserialize(json, changed));

        assertTrue(exception.getMessage().contains("has changed since the conversation was saved"));
    }

    @Test
    void testMissingStateIsRejected() throws Exception {
        Flow flow = TestFlows.timesTen();
        String json = "{\"format\":\"stepwise-conversation\",\"version\":1,\"flowId\":\"times-ten\","
                + "\"flowFingerprint\":\"" + ConversationStateSerializer.fingerprint(flow) + "\"}";

        assertThrows(StateSerializationException.class, () -> serializer.deserialize(json, flow));
    }

    // ========== Fingerprints ==========

    @Test
    void testFingerprintIsStableAcrossBuilds() throws Exception {
        assertEquals(ConversationStateSerializer.fingerprint(TestFlows.sumAndBranch()),
                ConversationStateSerializer.fingerprint(TestFlows.sumAndBranch()));
        assertNotEquals(ConversationStateSerializer.fingerprint(TestFlows.sumAndBranch()),
                ConversationStateSerializer.fingerprint(TestFlows.timesTen()));
        assertEquals(64, ConversationStateSerializer.fingerprint(TestFlows.timesTen()).length());
    }
}
