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

package dev.mars.stepwise.workflow;

/**
 * Exception thrown when a flow definition cannot be read, validated or built.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class FlowParseException extends Exception {

    private final String flowName;
    private final int lineNumber;
    private final String fieldPath;

    public FlowParseException(String message) {
        this(null, -1, null, message, null);
    }

    public FlowParseException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public FlowParseException(String flowName, String fieldPath, String message) {
        this(flowName, -1, fieldPath, message, null);
    }

    public FlowParseException(String flowName, String fieldPath, String message, Throwable cause) {
        this(flowName, -1, fieldPath, message, cause);
    }

    public FlowParseException(String flowName, int lineNumber, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.flowName = flowName;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    public String getFlowName() {
        return flowName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * The message without flow, line and field prefixes.
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (flowName != null) {
            sb.append("Flow '").append(flowName).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
