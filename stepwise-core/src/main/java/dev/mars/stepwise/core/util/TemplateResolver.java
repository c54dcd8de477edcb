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

package dev.mars.stepwise.core.util;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{name}}} placeholders in templates.
 * Context values take precedence over global values.
 */
public class TemplateResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final Map<String, Object> globalVariables;
    private final Map<String, Object> contextVariables;
    private final boolean environmentFallback;

    public TemplateResolver() {
        this(Map.of(), false);
    }

    public TemplateResolver(Map<String, Object> globalVariables) {
        this(globalVariables, false);
    }

    /**
     * @param environmentFallback whether unknown names are looked up in system
     *                            properties and then environment variables
     */
    public TemplateResolver(Map<String, Object> globalVariables, boolean environmentFallback) {
        this.globalVariables = new HashMap<>(globalVariables != null ? globalVariables : Map.of());
        this.contextVariables = new HashMap<>();
        this.environmentFallback = environmentFallback;
    }

    public TemplateResolver withContext(Map<String, Object> contextVariables) {
        TemplateResolver resolver = new TemplateResolver(this.globalVariables, environmentFallback);
        resolver.contextVariables.putAll(this.contextVariables);
        if (contextVariables != null) {
            resolver.contextVariables.putAll(contextVariables);
        }
        return resolver;
    }

    /**
     * Resolves placeholders in a template.
     *
     * @param template the template string containing placeholders
     * @return the resolved string
     * @throws TemplateResolutionException if a placeholder has no value
     */
    public String resolve(String template) {
        if (template == null) {
            return null;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String variableName = matcher.group(1).trim();
            Object value = resolveVariable(variableName);

            if (value == null) {
                throw new TemplateResolutionException("Variable not found: " + variableName);
            }

            matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(value)));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    public boolean hasVariables(String template) {
        return template != null && VARIABLE_PATTERN.matcher(template).find();
    }

    /**
     * Placeholder names of a template, in order of first appearance.
     */
    public static Set<String> getVariableNames(String template) {
        Set<String> variables = new LinkedHashSet<>();
        if (template == null) {
            return variables;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        while (matcher.find()) {
            variables.add(matcher.group(1).trim());
        }
        return variables;
    }

    private Object resolveVariable(String variableName) {
        if (contextVariables.containsKey(variableName)) {
            return contextVariables.get(variableName);
        }
        if (globalVariables.containsKey(variableName)) {
            return globalVariables.get(variableName);
        }
        if (environmentFallback) {
            String systemValue = System.getProperty(variableName);
            if (systemValue != null) {
                return systemValue;
            }
            return System.getenv(variableName);
        }
        return null;
    }

    public static class TemplateResolutionException extends RuntimeException {
        public TemplateResolutionException(String message) {
            super(message);
        }
    }
}
