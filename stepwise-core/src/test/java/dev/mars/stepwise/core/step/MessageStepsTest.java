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
import dev.mars.stepwise.core.conversation.Message;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.graph.Flow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MessageStepsTest {

    private SimpleFlowEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SimpleFlowEngine(StepwiseConfiguration.defaults());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static Flow askAndGreet(String prompt) throws GraphException {
        InputMessageStep ask = new InputMessageStep("ask", prompt, "name");
        OutputMessageStep greet = new OutputMessageStep("greet", "Hello {{name}}");
        return Flow.builder("ask-and-greet")
                .beginStep(ask)
                .controlEdge(ask, greet)
                .endEdge(greet)
                .dataEdge(ask, "name", greet, "name")
                .build();
    }

    // ========== Output messages ==========

    @Test
    void testPlaceholdersBecomeInputs() {
        OutputMessageStep step = new OutputMessageStep("report", "{{count}} items for {{owner}}");

        assertThat(step.getInputDescriptors()).extracting(Descriptor::getName).containsExactly("count", "owner");
        assertTrue(step.getInputDescriptors().stream().allMatch(d -> d.getType().equals(DescriptorType.any())));
        assertEquals("output_message", step.getOutputDescriptors().get(0).getName());
    }

    @Test
    void testOutputMessageIsRenderedAndAppended() throws Exception {
        StartStep start = new StartStep(List.of(Descriptor.integer("count")));
        OutputMessageStep report = new OutputMessageStep("report", "You have {{count}} new messages");
        Flow flow = Flow.builder("report")
                .beginStep(start)
                .controlEdge(start, report)
                .endEdge(report)
                .dataEdge(start, "count", report, "count")
                .build();
        Conversation conversation = engine.startConversation(flow, Map.of("count", 3));

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals("You have 3 new messages", finished.output("output_message"));
        assertEquals(List.of(Message.agent("You have 3 new messages")), conversation.getMessages());
        assertEquals("report", finished.completeStepName());
    }

    // ========== Input messages ==========

    @Test
    void testInputStepWaitsForUserMessage() throws Exception {
        Conversation conversation = engine.startConversation(askAndGreet("What is your name?"), Map.of());

        ExecutionStatus status = conversation.execute();

        assertEquals(new ExecutionStatus.NeedsExternalInput("What is your name?"), status);
        assertEquals(List.of(Message.agent("What is your name?")), conversation.getMessages());
    }

    @Test
    void testPromptIsNotRepeatedWhileWaiting() throws Exception {
        Conversation conversation = engine.startConversation(askAndGreet("What is your name?"), Map.of());

        conversation.execute();
        ExecutionStatus again = conversation.execute();

        assertInstanceOf(ExecutionStatus.NeedsExternalInput.class, again);
        assertEquals(1, conversation.getMessages().size());
    }

    @Test
    void testUserMessageCompletesInputStep() throws Exception {
        Conversation conversation = engine.startConversation(askAndGreet("What is your name?"), Map.of());
        conversation.execute();

        conversation.supplyUserMessage("Ada");
        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals("Ada", finished.output("name"));
        assertEquals("Hello Ada", finished.output("output_message"));
        assertThat(conversation.getMessages()).extracting(Message::role)
                .containsExactly(Message.Role.AGENT, Message.Role.USER, Message.Role.AGENT);
    }

    @Test
    void testMessagesBeforeThePromptAreIgnored() throws Exception {
        Conversation conversation = engine.startConversation(askAndGreet("What is your name?"), Map.of());
        conversation.supplyUserMessage("hello there");

        ExecutionStatus status = conversation.execute();

        assertInstanceOf(ExecutionStatus.NeedsExternalInput.class, status);
        conversation.supplyUserMessage("Grace");
        assertEquals("Hello Grace", ((ExecutionStatus.Finished) conversation.execute()).output("output_message"));
    }

    @Test
    void testEmptyPromptAppendsNothing() throws Exception {
        Conversation conversation = engine.startConversation(askAndGreet(""), Map.of());

        conversation.execute();

        assertTrue(conversation.getMessages().isEmpty());
    }

    @Test
    void testUserMessageRejectedAfterFinish() throws Exception {
        Conversation conversation = engine.startConversation(askAndGreet("Name?"), Map.of());
        conversation.execute();
        conversation.supplyUserMessage("Ada");
        conversation.execute();

        assertThrows(IllegalStateException.class, () -> conversation.supplyUserMessage("again"));
    }
}
