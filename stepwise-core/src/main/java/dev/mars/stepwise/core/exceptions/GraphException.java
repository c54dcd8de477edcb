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

import java.util.List;

/**
 * Raised when a flow graph is structurally invalid. Always thrown before any
 * execution starts and carries every problem found, not just the first.
 */
public class GraphException extends StepwiseException {

    private final String flowName;
    private final List<String> errors;

    public GraphException(String flowName, List<String> errors) {
        super(buildMessage(flowName, errors));
        this.flowName = flowName;
        this.errors = List.copyOf(errors);
    }

    public GraphException(String flowName, String error) {
        this(flowName, List.of(error));
    }

    public String getFlowName() {
        return flowName;
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(String flowName, List<String> errors) {
        StringBuilder sb = new StringBuilder("Invalid flow '").append(flowName).append("'");
        if (errors.size() == 1) {
            sb.append(": ").append(errors.get(0));
        } else {
            sb.append(" (").append(errors.size()).append(" errors)");
            for (String error : errors) {
                sb.append(System.lineSeparator()).append("  - ").append(error);
            }
        }
        return sb.toString();
    }
}
