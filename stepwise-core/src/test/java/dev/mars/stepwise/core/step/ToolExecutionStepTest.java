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

import dev.mars.stepwise.core.TestFlows;
import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.conversation.Conversation;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.Message;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.conversation.ToolRequest;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.ConversationFailedException;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.tool.ClientTool;
import dev.mars.stepwise.core.tool.ServerTool;
import dev.mars.stepwise.core.tool.Tool;
import dev.mars.stepwise.core.tool.ToolFunction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolExecutionStepTest {

    private SimpleFlowEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SimpleFlowEngine(StepwiseConfiguration.defaults());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static Flow toolFlow(Tool tool) throws GraphException {
        StartStep start = new StartStep(List.of(Descriptor.string("city")));
        ToolExecutionStep call = new ToolExecutionStep("call", tool);
        return Flow.builder("tool-flow")
                .beginStep(start)
                .controlEdge(start, call)
                .endEdge(call)
                .dataEdge(start, "city", call, "city")
                .build();
    }

    private static ClientTool.Builder weather() {
        return ClientTool.builder("weather")
                .description("Looks up the weather")
                .input("city", DescriptorType.string())
                .output("forecast", DescriptorType.string());
    }

    // ========== Server tools ==========

    @Test
    void testServerToolRunsInProcess() throws Exception {
        Conversation conversation = engine.startConversation(TestFlows.sumAndBranch(), Map.of("a", 2, "b", 3));

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals(5, finished.output("sum"));
        assertTrue(conversation.getMessages().stream().anyMatch(m -> m.role() == Message.Role.TOOL_RESULT
                && m.content().equals("5")));
    }

    @Test
    void testServerToolCheckedExceptionBecomesToolFailure() throws Exception {
        ToolFunction function = mock(ToolFunction.class);
        when(function.call(anyMap())).thenThrow(new IOException("connection refused"));
        ServerTool tool = ServerTool.builder("weather")
                .input("city", DescriptorType.string())
                .function(function)
                .build();

        ConversationFailedException exception = assertThrows(ConversationFailedException.class,
                () -> engine.startConversation(toolFlow(tool), Map.of("city", "Oslo")).execute());

        assertEquals("ToolFailure", exception.getFailureKind());
        verify(function, times(1)).call(Map.of("city", "Oslo"));
    }

    // ========== Client tools ==========

    @Test
    void testClientToolSuspendsUntilResultIsSupplied() throws Exception {
        Conversation conversation = engine.startConversation(toolFlow(weather().build()), Map.of("city", "Oslo"));

        ExecutionStatus.NeedsToolResult status = (ExecutionStatus.NeedsToolResult) conversation.execute();

        assertEquals(1, status.toolRequests().size());
        ToolRequest request = status.toolRequests().get(0);
        assertEquals("weather", request.toolName());
        assertEquals(Map.of("city", "Oslo"), request.arguments());
        assertFalse(request.requiresConfirmation());

        // executing again without a result stays suspended with the same request
        ExecutionStatus again = conversation.execute();
        assertEquals(request.requestId(), ((ExecutionStatus.NeedsToolResult) again).toolRequests().get(0).requestId());

        conversation.supplyToolResult(request.requestId(), "sunny");
        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals("sunny", finished.output("forecast"));
        assertTrue(conversation.getState().getPendingToolRequests().isEmpty());
    }

    @Test
    void testUnknownRequestIdIsRejected() throws Exception {
        Conversation conversation = engine.startConversation(toolFlow(weather().build()), Map.of("city", "Oslo"));
        conversation.execute();

        assertThrows(IllegalArgumentException.class, () -> conversation.supplyToolResult("tool-999", "sunny"));
    }

    @Test
    void testIllTypedResultFailsStep() throws Exception {
        Conversation conversation = engine.startConversation(toolFlow(weather().build()), Map.of("city", "Oslo"));
        ExecutionStatus.NeedsToolResult status = (ExecutionStatus.NeedsToolResult) conversation.execute();

        conversation.supplyToolResult(status.toolRequests().get(0).requestId(), 42);

        ConversationFailedException exception = assertThrows(ConversationFailedException.class, conversation::execute);
        assertEquals("ValidationFailure", exception.getFailureKind());
    }

    // ========== Confirmation ==========

    @Test
    void testConfirmedToolRuns() throws Exception {
        ToolFunction function = mock(ToolFunction.class);
        when(function.call(anyMap())).thenReturn("deleted");
        ServerTool tool = ServerTool.builder("delete")
                .input("city", DescriptorType.string())
                .requiresConfirmation(true)
                .function(function)
                .build();
        Conversation conversation = engine.startConversation(toolFlow(tool), Map.of("city", "Oslo"));

        ExecutionStatus.NeedsConfirmation status = (ExecutionStatus.NeedsConfirmation) conversation.execute();
        verify(function, never()).call(anyMap());

        conversation.confirmTool(status.toolRequests().get(0).requestId());
        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals("deleted", finished.output("tool_output"));
        verify(function, times(1)).call(anyMap());
    }

    @Test
    void testRejectedToolFailsWithRejection() throws Exception {
        ClientTool tool = weather().requiresConfirmation(true).build();
        Conversation conversation = engine.startConversation(toolFlow(tool), Map.of("city", "Oslo"));

        ExecutionStatus.NeedsConfirmation status = (ExecutionStatus.NeedsConfirmation) conversation.execute();
        String requestId = status.toolRequests().get(0).requestId();
        assertTrue(status.toolRequests().get(0).requiresConfirmation());

        assertThrows(IllegalArgumentException.class, () -> conversation.supplyToolResult("other", "x"));
        conversation.rejectTool(requestId, "not allowed");

        ConversationFailedException exception = assertThrows(ConversationFailedException.class, conversation::execute);
        assertEquals("ToolRejectedFailure", exception.getFailureKind());
        assertTrue(exception.getMessage().contains("not allowed"));
    }

    @Test
    void testConfirmedClientToolThenNeedsResult() throws Exception {
        ClientTool tool = weather().requiresConfirmation(true).build();
        Conversation conversation = engine.startConversation(toolFlow(tool), Map.of("city", "Oslo"));

        String requestId = ((ExecutionStatus.NeedsConfirmation) conversation.execute()).toolRequests().get(0).requestId();
        conversation.confirmTool(requestId);
        ExecutionStatus.NeedsToolResult needsResult = (ExecutionStatus.NeedsToolResult) conversation.execute();

        assertEquals(requestId, needsResult.toolRequests().get(0).requestId());
        conversation.supplyToolResult(requestId, "rain");
        assertEquals("rain", ((ExecutionStatus.Finished) conversation.execute()).output("forecast"));
    }

    @Test
    void testConfirmingUnconfirmableRequestIsRejected() throws Exception {
        Conversation conversation = engine.startConversation(toolFlow(weather().build()), Map.of("city", "Oslo"));
        String requestId = ((ExecutionStatus.NeedsToolResult) conversation.execute()).toolRequests().get(0).requestId();

        assertThrows(IllegalArgumentException.class, () -> conversation.confirmTool(requestId));
    }
}
