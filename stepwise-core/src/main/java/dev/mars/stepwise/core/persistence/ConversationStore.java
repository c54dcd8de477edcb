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

import dev.mars.stepwise.core.exceptions.StateSerializationException;

import java.util.List;
import java.util.Optional;

/**
 * Keeps serialized conversations between executions, keyed by conversation id.
 */
public interface ConversationStore {

    void save(String conversationId, String serializedState) throws StateSerializationException;

    Optional<String> load(String conversationId) throws StateSerializationException;

    /**
     * @return true if a conversation was removed
     */
    boolean delete(String conversationId) throws StateSerializationException;

    List<String> listConversationIds() throws StateSerializationException;
}
