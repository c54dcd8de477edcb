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

package dev.mars.stepwise.core.tool;

import dev.mars.stepwise.core.descriptor.Descriptor;

import java.util.List;

/**
 * A callable capability exposed to flows. Server tools run in-process; client
 * tools are executed by the caller, who supplies the result to the conversation.
 */
public interface Tool {

    String getName();

    String getDescription();

    List<Descriptor> getInputDescriptors();

    /**
     * Declared results. A tool with one output returns the bare value; a tool with
     * several outputs returns a map keyed by output name.
     */
    List<Descriptor> getOutputDescriptors();

    /**
     * Whether the caller must approve each call before it runs.
     */
    boolean requiresConfirmation();
}
