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
 * The caller's answer to a tool call that required confirmation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolDecision(
        @JsonProperty("approved") boolean approved,
        @JsonProperty("reason") String reason) {

    public static ToolDecision approve() {
        return new ToolDecision(true, null);
    }

    public static ToolDecision reject(String reason) {
        return new ToolDecision(false, reason);
    }
}
