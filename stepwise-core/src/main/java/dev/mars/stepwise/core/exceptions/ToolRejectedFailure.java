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
 * The caller rejected a tool call that required confirmation.
 */
public class ToolRejectedFailure extends ToolFailure {

    private final String reason;

    public ToolRejectedFailure(String toolName, String reason) {
        super(toolName, "Tool '" + toolName + "' was rejected" + (reason != null ? ": " + reason : ""));
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
