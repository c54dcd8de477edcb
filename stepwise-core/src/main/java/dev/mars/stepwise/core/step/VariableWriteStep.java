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
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.exceptions.ValidationFailure;
import dev.mars.stepwise.core.graph.Variable;
import dev.mars.stepwise.core.graph.WritePolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes its input into a flow variable according to a {@link WritePolicy}.
 */
public class VariableWriteStep extends Step implements VariableStep {

    public static final String DEFAULT_INPUT = "value";

    private final Variable variable;
    private final WritePolicy writePolicy;
    private final String inputName;

    public VariableWriteStep(String name, Variable variable) {
        this(name, variable, WritePolicy.OVERWRITE, DEFAULT_INPUT);
    }

    public VariableWriteStep(String name, Variable variable, WritePolicy writePolicy) {
        this(name, variable, writePolicy, DEFAULT_INPUT);
    }

    public VariableWriteStep(String name, Variable variable, WritePolicy writePolicy, String inputName) {
        super(name, List.of(Descriptor.of(inputName, inputType(variable, writePolicy))), List.of());
        this.variable = variable;
        this.writePolicy = writePolicy;
        this.inputName = inputName;
    }

    private static DescriptorType inputType(Variable variable, WritePolicy policy) {
        DescriptorType type = variable.getType();
        switch (policy) {
            case INSERT:
                if (type.getKind() != DescriptorType.Kind.LIST) {
                    throw new IllegalArgumentException("INSERT needs a list variable, '" + variable.getName()
                            + "' is " + type);
                }
                return type.getItemType();
            case MERGE:
                if (type.getKind() != DescriptorType.Kind.LIST && type.getKind() != DescriptorType.Kind.MAP) {
                    throw new IllegalArgumentException("MERGE needs a list or map variable, '" + variable.getName()
                            + "' is " + type);
                }
                return type;
            default:
                return type;
        }
    }

    @Override
    public Variable getVariable() {
        return variable;
    }

    public WritePolicy getWritePolicy() {
        return writePolicy;
    }

    @Override
    @SuppressWarnings("unchecked")
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) throws StepwiseException {
        Object value = ConversationContext.deepCopy(inputs.get(inputName));
        Object current = context.getVariable(variable.getName());
        Object updated;
        switch (writePolicy) {
            case INSERT: {
                List<Object> list = current instanceof List ? new ArrayList<>((List<Object>) current) : new ArrayList<>();
                list.add(value);
                updated = list;
                break;
            }
            case MERGE:
                if (variable.getType().getKind() == DescriptorType.Kind.MAP) {
                    Map<String, Object> map = current instanceof Map
                            ? new LinkedHashMap<>((Map<String, Object>) current) : new LinkedHashMap<>();
                    if (value != null) {
                        map.putAll((Map<String, Object>) value);
                    }
                    updated = map;
                } else {
                    List<Object> list = current instanceof List ? new ArrayList<>((List<Object>) current) : new ArrayList<>();
                    if (value != null) {
                        list.addAll((List<Object>) value);
                    }
                    updated = list;
                }
                break;
            default:
                updated = value;
        }
        if (!variable.getType().accepts(updated)) {
            throw new ValidationFailure(getName(), "Value " + updated + " does not fit variable '"
                    + variable.getName() + "' of type " + variable.getType());
        }
        context.setVariable(variable.getName(), variable.getType().normalize(updated));
        return StepResult.completed(Map.of());
    }
}
