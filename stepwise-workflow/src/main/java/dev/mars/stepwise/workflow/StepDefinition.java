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

import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.Variable;
import dev.mars.stepwise.core.tool.Tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of a flow's {@code steps} list, with typed accessors that report
 * problems against the entry's field path.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public final class StepDefinition {

    private final String flowName;
    private final String fieldPath;
    private final Map<String, Object> fields;
    private final Map<String, Variable> variables;

    StepDefinition(String flowName, String fieldPath, Map<String, Object> fields, Map<String, Variable> variables) {
        this.flowName = flowName;
        this.fieldPath = fieldPath;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.variables = variables;
    }

    public String getName() {
        return YamlValues.getString(fields, "name");
    }

    public String getType() {
        return YamlValues.getString(fields, "type");
    }

    public String getFlowName() {
        return flowName;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    public String getString(String key) {
        return YamlValues.getString(fields, key);
    }

    public String getString(String key, String defaultValue) {
        String value = YamlValues.getString(fields, key);
        return value != null ? value : defaultValue;
    }

    public String requireString(String key) throws FlowParseException {
        String value = getString(key);
        if (value == null || value.isBlank()) {
            throw error(key, "Required field '" + key + "' is missing");
        }
        return value;
    }

    public int getInt(String key, int defaultValue) throws FlowParseException {
        Object value = fields.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw error(key, "Expected an integer but got '" + value + "'");
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) throws FlowParseException {
        Object value = fields.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw error(key, "Expected true or false but got '" + value + "'");
    }

    /**
     * A map of string values, in document order; empty if the field is absent.
     */
    public Map<String, String> getStringMap(String key) throws FlowParseException {
        Object value = fields.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw error(key, "Expected a mapping");
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue() != null ? entry.getValue().toString() : null);
        }
        return result;
    }

    public List<String> getStringList(String key) throws FlowParseException {
        Object value = fields.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw error(key, "Expected a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    public List<Descriptor> getDescriptors(String key) throws FlowParseException {
        return YamlValues.toDescriptors(flowName, fieldPath + "." + key, fields.get(key));
    }

    public Variable requireVariable(String key) throws FlowParseException {
        String variableName = requireString(key);
        Variable variable = variables.get(variableName);
        if (variable == null) {
            throw error(key, "Unknown variable '" + variableName + "'");
        }
        return variable;
    }

    public Tool requireTool(String key, StepTypeRegistry registry) throws FlowParseException {
        String toolName = requireString(key);
        return registry.getTool(toolName)
                .orElseThrow(() -> error(key, "Unknown tool '" + toolName + "'"));
    }

    public Flow requireFlow(String key, StepTypeRegistry registry) throws FlowParseException {
        String referenced = requireString(key);
        return registry.getFlow(referenced)
                .orElseThrow(() -> error(key, "Unknown flow '" + referenced + "'"));
    }

    public FlowParseException error(String key, String message) {
        return new FlowParseException(flowName, fieldPath + "." + key, message);
    }

    @Override
    public String toString() {
        return "StepDefinition{" +
                "name='" + getName() + '\'' +
                ", type='" + getType() + '\'' +
                ", fieldPath='" + fieldPath + '\'' +
                '}';
    }
}
