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

import dev.mars.stepwise.core.exceptions.ConcurrentVariableWriteException;

import java.util.Map;
import java.util.Set;

/**
 * Variables a nested conversation shares with its parent instead of working on
 * an isolated copy. Reads and writes go straight to the parent conversation.
 *
 * <p>When the nested conversations run in parallel they share one {@link WriteGuard};
 * a second nested conversation writing a variable another one already wrote is
 * rejected with {@link ConcurrentVariableWriteException}.</p>
 */
public final class SharedVariableScope {

    private final ConversationContext parent;
    private final Set<String> names;
    private final WriteGuard guard;
    private final int itemIndex;

    public SharedVariableScope(ConversationContext parent, Set<String> names, WriteGuard guard, int itemIndex) {
        this.parent = parent;
        this.names = Set.copyOf(names);
        this.guard = guard;
        this.itemIndex = itemIndex;
    }

    public boolean isShared(String variableName) {
        return names.contains(variableName);
    }

    Object read(String variableName) {
        return parent.getVariable(variableName);
    }

    void write(String variableName, Object value) throws ConcurrentVariableWriteException {
        if (guard != null) {
            guard.claim(variableName, itemIndex);
        }
        parent.setVariable(variableName, value);
    }

    /**
     * Records which nested conversation first wrote each shared variable during one
     * parallel run. The record lives in a map owned by the caller, so a run that
     * suspends and resumes keeps the writers of its earlier invocations.
     */
    public static final class WriteGuard {

        private final Map<String, Object> writers;

        public WriteGuard(Map<String, Object> writers) {
            this.writers = writers;
        }

        synchronized void claim(String variableName, int itemIndex) throws ConcurrentVariableWriteException {
            Object writer = writers.putIfAbsent(variableName, itemIndex);
            if (writer != null && ((Number) writer).intValue() != itemIndex) {
                throw new ConcurrentVariableWriteException(variableName, ((Number) writer).intValue(), itemIndex);
            }
        }
    }
}
