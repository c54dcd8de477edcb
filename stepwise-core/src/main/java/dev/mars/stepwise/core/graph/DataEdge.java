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
 * Propagates output {@code sourceOutput} of a step or context provider into input
 * {@code destinationInput} of another step.
 */
public record DataEdge(String source, String sourceOutput, String destinationStep, String destinationInput) {

    public DataEdge {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(sourceOutput, "Source output cannot be null");
        Objects.requireNonNull(destinationStep, "Destination step cannot be null");
        Objects.requireNonNull(destinationInput, "Destination input cannot be null");
    }

    @Override
    public String toString() {
        return source + "." + sourceOutput + " -> " + destinationStep + "." + destinationInput;
    }
}
