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

package dev.mars.stepwise.core.exceptions;

/**
 * A step failure escaped the flow and terminated the conversation. The original
 * failure kind, the failing step and the cause are preserved.
 */
public class ConversationFailedException extends StepwiseException {

    private final String conversationId;
    private final String failureKind;
    private final String stepName;

    public ConversationFailedException(String conversationId, String stepName, Throwable cause) {
        super("Conversation " + conversationId + " failed in step '" + stepName + "' with "
                + StepFailure.kindOf(cause) + ": " + cause.getMessage(), cause);
        this.conversationId = conversationId;
        this.failureKind = StepFailure.kindOf(cause);
        this.stepName = stepName;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getFailureKind() {
        return failureKind;
    }

    public String getStepName() {
        return stepName;
    }
}
