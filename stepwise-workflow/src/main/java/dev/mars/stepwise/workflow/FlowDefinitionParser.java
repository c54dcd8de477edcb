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

import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.validation.ValidationResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads flow definitions into built {@link Flow}s.
 */
public interface FlowDefinitionParser {

    /**
     * Parses a file holding exactly one flow definition.
     */
    Flow parse(Path file) throws FlowParseException;

    Flow parseFromString(String content) throws FlowParseException;

    /**
     * Parses every document of a multi-document source, in order. Later documents
     * may reference flows defined by earlier ones.
     */
    List<Flow> parseAll(String content) throws FlowParseException;

    List<Flow> parseAll(Path file) throws FlowParseException;

    /**
     * Checks the structure of every document without building flows.
     *
     * @param content the definition source
     * @return validation result
     */
    ValidationResult validateSchema(String content);
}
