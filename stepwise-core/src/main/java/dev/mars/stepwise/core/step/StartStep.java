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

package dev.mars.stepwise.core.step;

import dev.mars.stepwise.core.conversation.ConversationContext;
import dev.mars.stepwise.core.descriptor.Descriptor;

import java.util.List;
import java.util.Map;

/**
 * Entry step of a flow. Its inputs are the flow inputs, and it exposes them
 * unchanged as outputs for data edges to pick up.
 */
public class StartStep extends Step {

    public static final String DEFAULT_NAME = "start";

    public StartStep(List<Descriptor> inputs) {
        this(DEFAULT_NAME, inputs);
    }

    public StartStep(String name, List<Descriptor> inputs) {
        super(name, inputs, inputs);
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) {
        return StepResult.completed(inputs);
    }
}
