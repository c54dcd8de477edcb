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

import java.util.Objects;

/**
 * One entry of the message history of a conversation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        @JsonProperty("role") Role role,
        @JsonProperty("content") String content,
        @JsonProperty("toolRequestId") String toolRequestId) {

    public enum Role {
        USER, AGENT, TOOL_REQUEST, TOOL_RESULT, SYSTEM
    }

    public Message {
        Objects.requireNonNull(role, "Message role cannot be null");
        content = content != null ? content : "";
    }

    public static Message user(String content) {
        return new Message(Role.USER, content, null);
    }

    public static Message agent(String content) {
        return new Message(Role.AGENT, content, null);
    }

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content, null);
    }
}
