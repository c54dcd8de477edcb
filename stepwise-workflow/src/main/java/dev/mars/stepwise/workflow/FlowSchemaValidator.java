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

import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.validation.ValidationResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural validator for flow definition documents.
 * Checks the raw document before any step is built, so every problem of a
 * document is reported at once.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class FlowSchemaValidator {

    public static final String KIND = "Flow";

    // Regex patterns for validation
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9]([a-zA-Z0-9\\-_.]*[a-zA-Z0-9])?$");
    private static final Pattern VERSION_PATTERN = Pattern.compile("^[0-9]+\\.[0-9]+\\.[0-9]+(-[a-zA-Z0-9\\-\\.]+)?(\\+[a-zA-Z0-9\\-\\.]+)?$");
    private static final Pattern API_VERSION_PATTERN = Pattern.compile("^v[0-9]+$");

    private static final Set<String> PROVIDER_TYPES = Set.of("constant", "tool", "flow", "messages");

    private final Set<String> knownStepTypes;

    public FlowSchemaValidator(Set<String> knownStepTypes) {
        this.knownStepTypes = Set.copyOf(knownStepTypes);
    }

    /**
     * Validates one document: root fields, metadata and spec.
     */
    public ValidationResult validateFlowSchema(Map<String, Object> data) {
        ValidationResult result = new ValidationResult();
        if (data == null) {
            result.addError("Document is empty");
            return result;
        }

        validateRootStructure(data, result);

        Object metadata = data.get("metadata");
        if (metadata instanceof Map) {
            validateMetadataSchema(asMap(metadata), result);
        } else if (metadata != null) {
            result.addError("metadata", "Field 'metadata' must be a mapping");
        }

        Object spec = data.get("spec");
        if (spec instanceof Map) {
            validateSpecSchema(asMap(spec), result);
        } else if (spec != null) {
            result.addError("spec", "Field 'spec' must be a mapping");
        }
        return result;
    }

    private void validateRootStructure(Map<String, Object> data, ValidationResult result) {
        if (!data.containsKey("metadata")) {
            result.addError("metadata", "Required field 'metadata' is missing");
        }
        if (!data.containsKey("spec")) {
            result.addError("spec", "Required field 'spec' is missing");
        }

        String apiVersion = getStringValue(data, "apiVersion");
        if (apiVersion != null && !API_VERSION_PATTERN.matcher(apiVersion).matches()) {
            result.addError("apiVersion", "API version must follow pattern 'v{number}' (e.g., 'v1')");
        }
        String kind = getStringValue(data, "kind");
        if (kind != null && !KIND.equals(kind)) {
            result.addError("kind", "Kind must be '" + KIND + "' but was '" + kind + "'");
        }
    }

    private void validateMetadataSchema(Map<String, Object> metadata, ValidationResult result) {
        String name = getStringValue(metadata, "name");
        if (name == null || name.isBlank()) {
            result.addError("metadata.name", "Required field 'name' is missing");
        } else if (name.length() > 100) {
            result.addError("metadata.name", "Name must be 100 characters or less");
        } else if (!NAME_PATTERN.matcher(name).matches()) {
            result.addError("metadata.name", "Name must start and end with alphanumeric characters, can contain hyphens, dots and underscores but not spaces");
        }

        Object version = metadata.get("version");
        if (version != null && !VERSION_PATTERN.matcher(version.toString()).matches()) {
            result.addError("metadata.version", "Version must follow semantic versioning format (e.g., '1.0.0', '2.1.0-beta')");
        }

        String description = getStringValue(metadata, "description");
        if (description == null || description.isBlank()) {
            result.addWarning("metadata.description", "Flow has no description");
        } else if (description.length() > 500) {
            result.addError("metadata.description", "Description must be 500 characters or less");
        }
    }

    private void validateSpecSchema(Map<String, Object> spec, ValidationResult result) {
        Set<String> stepNames = validateSteps(spec, result);
        Set<String> providerNames = validateContextProviders(spec, result);
        validateVariables(spec, result);

        String beginStep = getStringValue(spec, "beginStep");
        if (beginStep != null && !stepNames.contains(beginStep)) {
            result.addError("spec.beginStep", "Begin step '" + beginStep + "' is not defined");
        }

        List<Map<String, Object>> controlEdges = getMapList(spec, "controlEdges", result);
        if (controlEdges.isEmpty() && !stepNames.isEmpty()) {
            result.addWarning("spec.controlEdges", "No control edges defined, the flow cannot finish");
        }
        for (int i = 0; i < controlEdges.size(); i++) {
            Map<String, Object> edge = controlEdges.get(i);
            if (edge == null) {
                continue;
            }
            String path = "spec.controlEdges[" + i + "]";
            requireReference(edge, "from", stepNames, path, "step", result);
            if (edge.get("to") != null) {
                requireReference(edge, "to", stepNames, path, "step", result);
            }
        }

        Set<String> sources = new HashSet<>(stepNames);
        sources.addAll(providerNames);
        List<Map<String, Object>> dataEdges = getMapList(spec, "dataEdges", result);
        for (int i = 0; i < dataEdges.size(); i++) {
            Map<String, Object> edge = dataEdges.get(i);
            if (edge == null) {
                continue;
            }
            String path = "spec.dataEdges[" + i + "]";
            requireReference(edge, "from", sources, path, "step or context provider", result);
            requireReference(edge, "to", stepNames, path, "step", result);
            requireField(edge, "output", path, result);
            requireField(edge, "input", path, result);
        }

        Object loopLimits = spec.get("loopLimits");
        if (loopLimits instanceof Map) {
            for (Map.Entry<String, Object> entry : asMap(loopLimits).entrySet()) {
                if (!stepNames.contains(entry.getKey())) {
                    result.addError("spec.loopLimits." + entry.getKey(), "Loop limit for undefined step '" + entry.getKey() + "'");
                }
                if (!(entry.getValue() instanceof Integer) || (Integer) entry.getValue() < 1) {
                    result.addError("spec.loopLimits." + entry.getKey(), "Loop limit must be a positive integer");
                }
            }
        } else if (loopLimits != null) {
            result.addError("spec.loopLimits", "Field 'loopLimits' must be a mapping of step names to limits");
        }
    }

    private Set<String> validateSteps(Map<String, Object> spec, ValidationResult result) {
        Set<String> names = new HashSet<>();
        if (!spec.containsKey("steps")) {
            result.addError("spec.steps", "Required field 'steps' is missing from spec");
            return names;
        }
        List<Map<String, Object>> steps = getMapList(spec, "steps", result);
        if (steps.isEmpty()) {
            result.addError("spec.steps", "Flow must define at least one step");
        }
        for (int i = 0; i < steps.size(); i++) {
            Map<String, Object> step = steps.get(i);
            if (step == null) {
                continue;
            }
            String path = "spec.steps[" + i + "]";
            String name = getStringValue(step, "name");
            if (name == null || name.isBlank()) {
                result.addError(path + ".name", "Step name is required");
            } else if (!names.add(name)) {
                result.addError(path + ".name", "Duplicate step name '" + name + "'");
            }
            String type = getStringValue(step, "type");
            if (type == null || type.isBlank()) {
                result.addError(path + ".type", "Step type is required");
            } else if (!knownStepTypes.contains(type)) {
                result.addError(path + ".type", "Unknown step type '" + type + "'");
            }
        }
        return names;
    }

    private Set<String> validateContextProviders(Map<String, Object> spec, ValidationResult result) {
        Set<String> names = new HashSet<>();
        List<Map<String, Object>> providers = getMapList(spec, "contextProviders", result);
        for (int i = 0; i < providers.size(); i++) {
            Map<String, Object> provider = providers.get(i);
            if (provider == null) {
                continue;
            }
            String path = "spec.contextProviders[" + i + "]";
            String type = getStringValue(provider, "type");
            if (type == null || !PROVIDER_TYPES.contains(type)) {
                result.addError(path + ".type", "Context provider type must be one of " + PROVIDER_TYPES.stream().sorted().toList());
            }
            String name = getStringValue(provider, "name");
            if (name == null && "tool".equals(type)) {
                name = getStringValue(provider, "tool");
            }
            if (name == null || name.isBlank()) {
                result.addError(path + ".name", "Context provider name is required");
            } else if (!names.add(name)) {
                result.addError(path + ".name", "Duplicate context provider name '" + name + "'");
            }
        }
        return names;
    }

    private void validateVariables(Map<String, Object> spec, ValidationResult result) {
        Set<String> names = new HashSet<>();
        List<Map<String, Object>> variables = getMapList(spec, "variables", result);
        for (int i = 0; i < variables.size(); i++) {
            Map<String, Object> variable = variables.get(i);
            if (variable == null) {
                continue;
            }
            String path = "spec.variables[" + i + "]";
            String name = getStringValue(variable, "name");
            if (name == null || name.isBlank()) {
                result.addError(path + ".name", "Variable name is required");
            } else if (!names.add(name)) {
                result.addError(path + ".name", "Duplicate variable name '" + name + "'");
            }
            String type = getStringValue(variable, "type");
            if (type == null) {
                result.addError(path + ".type", "Variable type is required");
            } else {
                try {
                    DescriptorType.parse(type);
                } catch (IllegalArgumentException e) {
                    result.addError(path + ".type", e.getMessage());
                }
            }
        }
    }

    private void requireReference(Map<String, Object> edge, String field, Set<String> known, String path,
                                  String what, ValidationResult result) {
        String value = getStringValue(edge, field);
        if (value == null || value.isBlank()) {
            result.addError(path + "." + field, "Required field '" + field + "' is missing");
        } else if (!known.contains(value)) {
            result.addError(path + "." + field, "Unknown " + what + " '" + value + "'");
        }
    }

    private void requireField(Map<String, Object> data, String field, String path, ValidationResult result) {
        String value = getStringValue(data, field);
        if (value == null || value.isBlank()) {
            result.addError(path + "." + field, "Required field '" + field + "' is missing");
        }
    }

    /**
     * Entries of a list field; entries that are not mappings are reported and
     * returned as {@code null}.
     */
    private List<Map<String, Object>> getMapList(Map<String, Object> data, String key, ValidationResult result) {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            result.addError("spec." + key, "Field '" + key + "' must be a list");
            return List.of();
        }
        List<?> items = (List<?>) value;
        List<Map<String, Object>> maps = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof Map) {
                maps.add(asMap(items.get(i)));
            } else {
                // keeps indices aligned with the document
                maps.add(null);
                result.addError("spec." + key + "[" + i + "]", "Entry must be a mapping");
            }
        }
        return maps;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private String getStringValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }
}
