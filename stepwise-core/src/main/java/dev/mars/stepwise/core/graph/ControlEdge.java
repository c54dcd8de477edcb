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

package dev.mars.stepwise.core.graph;

import java.util.Objects;

/**
 * Decides which step runs after {@code sourceStep} produced {@code sourceBranch}.
 * A {@code null} destination ends the flow through that branch.
 */
public record ControlEdge(String sourceStep, String sourceBranch, String destinationStep) {

    public ControlEdge {
        Objects.requireNonNull(sourceStep, "Source step cannot be null");
        Objects.requireNonNull(sourceBranch, "Source branch cannot be null");
    }

    public boolean isTerminal() {
        return destinationStep == null;
    }

    @Override
    public String toString() {
        return sourceStep + "[" + sourceBranch + "] -> " + (destinationStep != null ? destinationStep : "<end>");
    }
}
