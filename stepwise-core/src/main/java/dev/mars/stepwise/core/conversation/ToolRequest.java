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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A call to a tool that the caller must execute or approve.
 *
 * @param requestId            identifier used to supply the result or decision
 * @param toolName             name of the requested tool
 * @param arguments            arguments of the call
 * @param requiresConfirmation whether the caller must approve the call first
 */
public record ToolRequest(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("toolName") String toolName,
        @JsonProperty("arguments") Map<String, Object> arguments,
        @JsonProperty("requiresConfirmation") boolean requiresConfirmation) {

    public ToolRequest {
        Objects.requireNonNull(requestId, "Request id cannot be null");
        Objects.requireNonNull(toolName, "Tool name cannot be null");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments != null ? arguments : Map.of()));
    }
}
