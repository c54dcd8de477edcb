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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryConversationStore implements ConversationStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryConversationStore.class);

    private final Map<String, String> conversations;

    public InMemoryConversationStore() {
        this.conversations = new ConcurrentHashMap<>();
    }

    @Override
    public void save(String conversationId, String serializedState) {
        Objects.requireNonNull(conversationId, "Conversation id cannot be null");
        Objects.requireNonNull(serializedState, "Serialized state cannot be null");
        conversations.put(conversationId, serializedState);
        logger.debug("Saved conversation: {}", conversationId);
    }

    @Override
    public Optional<String> load(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public boolean delete(String conversationId) {
        String removed = conversations.remove(conversationId);
        if (removed != null) {
            logger.debug("Removed conversation: {}", conversationId);
        }
        return removed != null;
    }

    @Override
    public List<String> listConversationIds() {
        List<String> ids = new ArrayList<>(conversations.keySet());
        Collections.sort(ids);
        return ids;
    }

    public int getConversationCount() {
        return conversations.size();
    }

    public void clearAll() {
        int count = conversations.size();
        conversations.clear();
        logger.info("Cleared {} conversations", count);
    }
}
