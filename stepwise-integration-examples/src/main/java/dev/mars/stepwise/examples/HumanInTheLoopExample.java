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

package dev.mars.stepwise.examples;

import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.conversation.Conversation;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.Message;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.conversation.ToolRequest;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.ConversationFailedException;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.persistence.FileConversationStore;
import dev.mars.stepwise.core.step.InputMessageStep;
import dev.mars.stepwise.core.step.OutputMessageStep;
import dev.mars.stepwise.core.step.ToolExecutionStep;
import dev.mars.stepwise.core.tool.ClientTool;
import dev.mars.stepwise.core.tool.ServerTool;
import dev.mars.stepwise.examples.util.ExampleLogger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Example of a conversation that pauses for people and client-side tools.
 * This example shows how to:
 * 1. Ask the user for input and answer a client tool request
 * 2. Save a suspended conversation to disk and resume it from a fresh engine
 * 3. Approve or reject a tool call that requires confirmation
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class HumanInTheLoopExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(HumanInTheLoopExample.class);

    private final AtomicInteger noticesSent = new AtomicInteger();

    public static void main(String[] args) {
        log.header("Stepwise Human-in-the-Loop Example");

        try {
            Path storeDirectory = Files.createTempDirectory("stepwise-hitl");
            HumanInTheLoopExample example = new HumanInTheLoopExample();
            example.runExample(storeDirectory, "Lisbon", "sunny, 24C");
            example.runRejectedExample(storeDirectory);
            log.completed("Human-in-the-Loop Example");
        } catch (Exception e) {
            log.unexpectedError("Human-in-the-Loop Example", e);
            System.exit(1);
        }
    }

    public int getNoticesSent() {
        return noticesSent.get();
    }

    /**
     * Runs the whole exchange, restarting the engine after the first pause.
     */
    public ExecutionStatus.Finished runExample(Path storeDirectory, String city, String forecast) throws Exception {
        Flow flow = createForecastFlow();
        String conversationId;

        // 1. First engine: ask the question and persist
        log.step(1, "Starting conversation...");
        SimpleFlowEngine firstEngine = createEngine(storeDirectory);
        try {
            Conversation conversation = firstEngine.startConversation(flow, Map.of());
            conversationId = conversation.getId();
            ExecutionStatus.NeedsExternalInput question = (ExecutionStatus.NeedsExternalInput) conversation.execute();
            log.arrow("agent", question.prompt());

            conversation.supplyUserMessage(city);
            log.arrow("user", city);
            firstEngine.saveConversation(conversation);
            log.success("Saved conversation " + conversationId);
        } finally {
            firstEngine.shutdown();
        }

        // 2. Second engine: resume from disk
        log.step(2, "Resuming conversation from " + storeDirectory + "...");
        SimpleFlowEngine secondEngine = createEngine(storeDirectory);
        try {
            Conversation conversation = secondEngine.loadConversation(conversationId, flow)
                    .orElseThrow(() -> new IllegalStateException("Conversation " + conversationId + " was not saved"));

            // 3. Answer the client tool
            log.step(3, "Answering client tool request...");
            ExecutionStatus.NeedsToolResult toolStatus = (ExecutionStatus.NeedsToolResult) conversation.execute();
            ToolRequest request = toolStatus.toolRequests().get(0);
            log.keyValue("Tool", request.toolName() + " " + request.arguments());
            conversation.supplyToolResult(request.requestId(), forecast);

            // 4. Approve the notification
            log.step(4, "Approving notification...");
            ExecutionStatus.NeedsConfirmation confirmation = (ExecutionStatus.NeedsConfirmation) conversation.execute();
            conversation.confirmTool(confirmation.toolRequests().get(0).requestId());

            ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();
            for (Message message : conversation.getMessages()) {
                log.detail(message.role() + ": " + message.content());
            }
            log.success(String.valueOf(finished.output("reply")));
            return finished;
        } finally {
            secondEngine.shutdown();
        }
    }

    /**
     * Rejects the notification; the rejection escapes the flow and fails the conversation.
     */
    public ConversationFailedException runRejectedExample(Path storeDirectory) throws Exception {
        log.section("Rejected notification");
        SimpleFlowEngine engine = createEngine(storeDirectory);
        try {
            Conversation conversation = engine.startConversation(createForecastFlow(), Map.of());
            conversation.execute();
            conversation.supplyUserMessage("Oslo");
            ExecutionStatus.NeedsToolResult toolStatus = (ExecutionStatus.NeedsToolResult) conversation.execute();
            conversation.supplyToolResult(toolStatus.toolRequests().get(0).requestId(), "snow");
            ExecutionStatus.NeedsConfirmation confirmation = (ExecutionStatus.NeedsConfirmation) conversation.execute();
            conversation.rejectTool(confirmation.toolRequests().get(0).requestId(), "Notices are paused");

            try {
                conversation.execute();
            } catch (ConversationFailedException e) {
                log.expectedFailure("Notification rejected", e);
                return e;
            }
            throw new IllegalStateException("Rejected tool call did not fail the conversation");
        } finally {
            engine.shutdown();
        }
    }

    private SimpleFlowEngine createEngine(Path storeDirectory) {
        return new SimpleFlowEngine(StepwiseConfiguration.defaults(), new FileConversationStore(storeDirectory));
    }

    Flow createForecastFlow() throws GraphException {
        ClientTool weather = ClientTool.builder("get_forecast")
                .description("Looks up the forecast on the client")
                .input("city", DescriptorType.string())
                .output("forecast", DescriptorType.string())
                .build();
        ServerTool notify = ServerTool.builder("send_notice")
                .description("Sends the forecast to the subscribers of a city")
                .input("city", DescriptorType.string())
                .input("forecast", DescriptorType.string())
                .output("receipt", DescriptorType.string())
                .requiresConfirmation(true)
                .function(args -> "notice-" + noticesSent.incrementAndGet())
                .build();

        InputMessageStep ask = new InputMessageStep("ask", "Which city do you need a forecast for?", "city");
        ToolExecutionStep lookup = new ToolExecutionStep("lookup", weather);
        ToolExecutionStep send = new ToolExecutionStep("send", notify);
        OutputMessageStep reply = new OutputMessageStep("reply",
                "Forecast for {{city}}: {{forecast}} ({{receipt}})", "reply");

        return Flow.builder("forecast-desk")
                .description("Looks up a forecast and notifies subscribers after approval")
                .controlEdge(ask, lookup)
                .controlEdge(lookup, send)
                .controlEdge(send, reply)
                .endEdge(reply)
                .dataEdge(ask, "city", lookup, "city")
                .dataEdge(ask, "city", send, "city")
                .dataEdge(lookup, "forecast", send, "forecast")
                .dataEdge(ask, "city", reply, "city")
                .dataEdge(lookup, "forecast", reply, "forecast")
                .dataEdge(send, "receipt", reply, "receipt")
                .build();
    }
}
