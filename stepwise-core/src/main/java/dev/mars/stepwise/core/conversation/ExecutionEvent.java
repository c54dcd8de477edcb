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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the event history kept in a conversation state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionEvent(
        @JsonProperty("type") Type type,
        @JsonProperty("stepName") String stepName,
        @JsonProperty("detail") String detail,
        @JsonProperty("sequence") long sequence) {

    public enum Type {
        CONVERSATION_STARTED,
        STEP_STARTED,
        STEP_COMPLETED,
        STEP_SUSPENDED,
        STEP_RESUMED,
        STEP_FAILED,
        CONVERSATION_INTERRUPTED,
        CONVERSATION_FINISHED
    }
}
