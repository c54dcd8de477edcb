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

import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.ToolRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one step invocation: completion through a branch, or suspension.
 */
public sealed interface StepResult {

    static Completed completed(Map<String, Object> outputs) {
        return new Completed(outputs, Step.NEXT);
    }

    static Completed completed(Map<String, Object> outputs, String branch) {
        return new Completed(outputs, branch);
    }

    static Suspended awaitingUserMessage(String prompt) {
        return new Suspended(SuspensionKind.NEEDS_USER_MESSAGE, prompt, List.of());
    }

    static Suspended awaitingToolResults(List<ToolRequest> requests) {
        return new Suspended(SuspensionKind.NEEDS_TOOL_RESULT, null, requests);
    }

    static Suspended awaitingConfirmation(List<ToolRequest> requests) {
        return new Suspended(SuspensionKind.NEEDS_TOOL_CONFIRMATION, null, requests);
    }

    /**
     * Maps the non-terminal status of a nested conversation to the suspension of
     * the step that runs it.
     *
     * @throws IllegalArgumentException for finished or interrupted statuses
     */
    static Suspended fromStatus(ExecutionStatus status) {
        if (status instanceof ExecutionStatus.NeedsExternalInput input) {
            return awaitingUserMessage(input.prompt());
        }
        if (status instanceof ExecutionStatus.NeedsToolResult toolResult) {
            return awaitingToolResults(toolResult.toolRequests());
        }
        if (status instanceof ExecutionStatus.NeedsConfirmation confirmation) {
            return awaitingConfirmation(confirmation.toolRequests());
        }
        throw new IllegalArgumentException("Status is not a suspension: " + status);
    }

    record Completed(Map<String, Object> outputs, String branch) implements StepResult {
        public Completed {
            outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs != null ? outputs : Map.of()));
            Objects.requireNonNull(branch, "Branch cannot be null");
        }
    }

    record Suspended(SuspensionKind kind, String prompt, List<ToolRequest> toolRequests) implements StepResult {
        public Suspended {
            Objects.requireNonNull(kind, "Suspension kind cannot be null");
            toolRequests = List.copyOf(toolRequests != null ? toolRequests : List.of());
        }

        /**
         * Maps the suspension to the status returned by {@code execute()}.
         */
        public ExecutionStatus toStatus() {
            switch (kind) {
                case NEEDS_TOOL_RESULT:
                    return new ExecutionStatus.NeedsToolResult(toolRequests);
                case NEEDS_TOOL_CONFIRMATION:
                    return new ExecutionStatus.NeedsConfirmation(toolRequests);
                default:
                    return new ExecutionStatus.NeedsExternalInput(prompt);
            }
        }
    }
}
