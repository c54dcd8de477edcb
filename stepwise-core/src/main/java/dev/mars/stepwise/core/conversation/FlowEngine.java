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

package dev.mars.stepwise.core.conversation;

import dev.mars.stepwise.core.exceptions.StateSerializationException;
import dev.mars.stepwise.core.graph.Flow;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for running flows. An engine starts conversations, owns the executor
 * used by parallel map steps and persists conversations between executions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public interface FlowEngine {

    /**
     * Starts a conversation of {@code flow} with a generated id. Nothing runs until
     * {@link Conversation#execute()} is called.
     *
     * @param inputs values of the flow inputs; required inputs must be present
     * @throws IllegalArgumentException if a required input is missing or a value has the wrong type
     */
    Conversation startConversation(Flow flow, Map<String, Object> inputs);

    Conversation startConversation(Flow flow, Map<String, Object> inputs, String conversationId);

    /**
     * Serializes the full state of a conversation.
     */
    String serialize(Conversation conversation) throws StateSerializationException;

    /**
     * Re-creates a conversation from the output of {@link #serialize} for the same flow.
     */
    Conversation restoreConversation(String serializedState, Flow flow) throws StateSerializationException;

    /**
     * Serializes a conversation into the engine's conversation store.
     */
    void saveConversation(Conversation conversation) throws StateSerializationException;

    Optional<Conversation> loadConversation(String conversationId, Flow flow) throws StateSerializationException;

    /**
     * Stops the executor; conversations can no longer be started or restored.
     */
    void shutdown();
}
