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
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.graph.Flow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileConversationStoreTest {

    @TempDir
    Path tempDir;

    private FileConversationStore store;

    @BeforeEach
    void setUp() {
        store = new FileConversationStore(tempDir.resolve("conversations"));
    }

    @Test
    void testSaveCreatesDirectoryAndFile() throws Exception {
        store.save("c1", "{\"a\":1}");

        Path file = tempDir.resolve("conversations").resolve("c1.json");
        assertTrue(Files.isRegularFile(file));
        assertEquals("{\"a\":1}", Files.readString(file));
        assertEquals("{\"a\":1}", store.load("c1").orElseThrow());
    }

    @Test
    void testSaveReplacesExistingFile() throws Exception {
        store.save("c1", "first");
        store.save("c1", "second");

        assertEquals("second", store.load("c1").orElseThrow());
        assertEquals(List.of("c1"), store.listConversationIds());
    }

    @Test
    void testMissingConversationLoadsEmpty() throws Exception {
        assertTrue(store.load("missing").isEmpty());
        assertTrue(store.listConversationIds().isEmpty());
        assertFalse(store.delete("missing"));
    }

    @Test
    void testListIgnoresOtherFiles() throws Exception {
        store.save("b", "x");
        store.save("a", "x");
        Files.writeString(store.getDirectory().resolve("notes.txt"), "ignored");

        assertEquals(List.of("a", "b"), store.listConversationIds());
    }

    @Test
    void testDeleteRemovesFile() throws Exception {
        store.save("c1", "x");

        assertTrue(store.delete("c1"));
        assertTrue(store.load("c1").isEmpty());
    }

    @Test
    void testPathLikeIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.save("../escape", "x"));
        assertThrows(IllegalArgumentException.class, () -> store.load("a/b"));
        assertThrows(IllegalArgumentException.class, () -> store.delete(" "));
    }

    @Test
    void testEngineResumesConversationFromDisk() throws Exception {
        Flow flow = TestFlows.sumAndBranch();
        SimpleFlowEngine writer = new SimpleFlowEngine(StepwiseConfiguration.defaults(), store);
        Conversation conversation = writer.startConversation(flow, Map.of("a", 1, "b", -3), "disk");
        writer.saveConversation(conversation);
        writer.shutdown();

        SimpleFlowEngine reader = new SimpleFlowEngine(StepwiseConfiguration.defaults(),
                new FileConversationStore(store.getDirectory()));
        try {
            Conversation restored = reader.loadConversation("disk", flow).orElseThrow();
            assertEquals("neg", ((ExecutionStatus.Finished) restored.execute()).output("output"));
        } finally {
            reader.shutdown();
        }
    }
}
