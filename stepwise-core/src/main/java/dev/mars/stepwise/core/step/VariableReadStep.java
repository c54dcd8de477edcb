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
import dev.mars.stepwise.core.graph.Variable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outputs the current value of a flow variable.
 */
public class VariableReadStep extends Step implements VariableStep {

    public static final String DEFAULT_OUTPUT = "value";

    private final Variable variable;
    private final String outputName;

    public VariableReadStep(String name, Variable variable) {
        this(name, variable, DEFAULT_OUTPUT);
    }

    public VariableReadStep(String name, Variable variable, String outputName) {
        super(name, List.of(), List.of(Descriptor.of(outputName, variable.getType())));
        this.variable = variable;
        this.outputName = outputName;
    }

    @Override
    public Variable getVariable() {
        return variable;
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) {
        Map<String, Object> outputs = new HashMap<>();
        outputs.put(outputName, ConversationContext.deepCopy(context.getVariable(variable.getName())));
        return StepResult.completed(outputs);
    }
}
