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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one {@code execute()} call of a conversation.
 *
 * <p>Only {@link Finished} is terminal. Every other status leaves the conversation
 * resumable: supply the missing value and call {@code execute()} again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public sealed interface ExecutionStatus {

    default boolean isFinished() {
        return this instanceof Finished;
    }

    /**
     * The flow reached a terminal control edge.
     *
     * @param outputValues     values of the flow outputs
     * @param terminalBranch   branch of the terminal control edge taken
     * @param completeStepName the last step that ran
     */
    record Finished(Map<String, Object> outputValues, String terminalBranch, String completeStepName)
            implements ExecutionStatus {
        public Finished {
            outputValues = Collections.unmodifiableMap(new LinkedHashMap<>(outputValues));
        }

        public Object output(String name) {
            return outputValues.get(name);
        }
    }

    /**
     * A step waits for a user message.
     */
    record NeedsExternalInput(String prompt) implements ExecutionStatus {
    }

    /**
     * Client-side tools must be executed and their results supplied.
     */
    record NeedsToolResult(List<ToolRequest> toolRequests) implements ExecutionStatus {
        public NeedsToolResult {
            toolRequests = List.copyOf(toolRequests);
        }
    }

    /**
     * Tool calls must be confirmed or rejected.
     */
    record NeedsConfirmation(List<ToolRequest> toolRequests) implements ExecutionStatus {
        public NeedsConfirmation {
            toolRequests = List.copyOf(toolRequests);
        }
    }

    /**
     * An execution interrupt stopped the walk. The conversation resumes at the next step.
     */
    record Interrupted(String reason) implements ExecutionStatus {
    }
}
