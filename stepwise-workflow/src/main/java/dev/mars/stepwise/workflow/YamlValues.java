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
import dev.mars.stepwise.core.descriptor.DescriptorType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Safe conversions of SnakeYAML's loosely typed document tree.
 */
final class YamlValues {

    private YamlValues() {
    }

    static String getString(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> getMap(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    static List<?> getList(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof List ? (List<?>) value : null;
    }

    /**
     * Reads {@code [ {name, type, default, description} ]}. A bare string names
     * an input of type {@code any}; a missing type means {@code any}.
     */
    @SuppressWarnings("unchecked")
    static List<Descriptor> toDescriptors(String flowName, String fieldPath, Object value) throws FlowParseException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new FlowParseException(flowName, fieldPath, "Expected a list of descriptors");
        }
        List<Descriptor> descriptors = new ArrayList<>();
        List<?> items = (List<?>) value;
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            String itemPath = fieldPath + "[" + i + "]";
            if (item instanceof String) {
                descriptors.add(Descriptor.any((String) item));
            } else if (item instanceof Map) {
                descriptors.add(toDescriptor(flowName, itemPath, (Map<String, Object>) item));
            } else {
                throw new FlowParseException(flowName, itemPath, "Expected a name or a descriptor mapping");
            }
        }
        return descriptors;
    }

    static Descriptor toDescriptor(String flowName, String fieldPath, Map<String, Object> data) throws FlowParseException {
        String name = getString(data, "name");
        if (name == null || name.isBlank()) {
            throw new FlowParseException(flowName, fieldPath + ".name", "Descriptor name is required");
        }
        DescriptorType type = toType(flowName, fieldPath + ".type", getString(data, "type"));
        String description = getString(data, "description");
        if (!data.containsKey("default")) {
            return Descriptor.of(name, type, description);
        }
        Object defaultValue = data.get("default");
        if (!type.accepts(defaultValue)) {
            throw new FlowParseException(flowName, fieldPath + ".default",
                    "Default value " + defaultValue + " is not a " + type);
        }
        return Descriptor.withDefault(name, type, defaultValue, description);
    }

    static DescriptorType toType(String flowName, String fieldPath, String text) throws FlowParseException {
        if (text == null) {
            return DescriptorType.any();
        }
        try {
            return DescriptorType.parse(text);
        } catch (IllegalArgumentException e) {
            throw new FlowParseException(flowName, fieldPath, e.getMessage(), e);
        }
    }
}
