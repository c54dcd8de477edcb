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

import dev.mars.stepwise.core.conversation.Conversation;
import dev.mars.stepwise.core.conversation.ConversationStatus;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.exceptions.ConversationFailedException;
import dev.mars.stepwise.core.exceptions.ToolRejectedFailure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the examples across the core and workflow modules.
 */
class IntegrationTestSuite {

    @TempDir
    Path tempDir;

    @Test
    void testBasicFlowPicksQuoteByTier() throws Exception {
        BasicFlowExample example = new BasicFlowExample();

        ExecutionStatus.Finished bulk = example.runExample(12, 9.5);
        ExecutionStatus.Finished standard = example.runExample(3, 4.0);

        assertEquals("bulk_quote", bulk.completeStepName());
        assertEquals("Bulk order: 114.0 with free delivery", bulk.output("quote"));
        assertEquals("Order total: 12.0", standard.output("quote"));
    }

    @Test
    void testHumanInTheLoopResumesFromDisk() throws Exception {
        HumanInTheLoopExample example = new HumanInTheLoopExample();

        ExecutionStatus.Finished finished = example.runExample(tempDir, "Lisbon", "sunny");

        assertEquals("Forecast for Lisbon: sunny (notice-1)", finished.output("reply"));
        assertEquals(1, example.getNoticesSent());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.filter(f -> f.toString().endsWith(".json")).count());
        }
    }

    @Test
    void testRejectedNotificationFailsConversation() throws Exception {
        HumanInTheLoopExample example = new HumanInTheLoopExample();

        ConversationFailedException failure = example.runRejectedExample(tempDir);

        assertEquals("send", failure.getStepName());
        ToolRejectedFailure rejection = assertInstanceOf(ToolRejectedFailure.class, failure.getCause());
        assertEquals("send_notice", rejection.getToolName());
        assertEquals("Notices are paused", rejection.getReason());
        assertEquals(0, example.getNoticesSent());
    }

    @Test
    void testParallelMapKeepsItemOrder() throws Exception {
        List<String> reviews = List.of(
                "Great service and fast delivery",
                "The parcel was late and the box was broken",
                "Friendly staff, excellent advice, love it",
                "Okay");

        Conversation conversation = new ParallelMapExample().runExample(reviews);

        assertEquals(ConversationStatus.FINISHED, conversation.getStatus());
        assertEquals(List.of("The parcel was late and the box was broken"),
                conversation.getState().getVariables().get("flagged"));
    }

    @Test
    void testReviewScoring() {
        assertEquals(2, ParallelMapExample.score("Great service and fast delivery"));
        assertEquals(-2, ParallelMapExample.score("late and BROKEN"));
        assertEquals(0, ParallelMapExample.score(""));
    }

    @Test
    void testYamlFlowRoutesTickets() throws Exception {
        Map<String, String> tickets = new LinkedHashMap<>();
        tickets.put("Invoice charged twice", "billed two times");
        tickets.put("Site is down", "error on checkout");
        tickets.put("Feature idea", "dark mode");

        Map<String, String> replies = new YamlFlowExample().runExample("Acme Support", tickets);

        assertThat(replies).containsOnlyKeys(tickets.keySet());
        assertEquals("Thanks for contacting Acme Support. Billing will answer 'Invoice charged twice' within 2 days.",
                replies.get("Invoice charged twice"));
        assertEquals("Thanks for contacting Acme Support. An engineer is looking at 'Site is down' now (priority 1).",
                replies.get("Site is down"));
        assertEquals("Thanks for contacting Acme Support. We received 'Feature idea'.", replies.get("Feature idea"));
    }
}
