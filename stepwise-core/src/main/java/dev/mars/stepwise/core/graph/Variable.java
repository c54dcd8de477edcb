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

import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;

import java.util.Objects;

/**
 * Named, typed and mutable slot scoped to one conversation. Instantiated with its
 * default when a conversation starts and changed only by variable write steps.
 */
public final class Variable {

    private final String name;
    private final DescriptorType type;
    private final Object defaultValue;
    private final String description;

    public Variable(String name, DescriptorType type, Object defaultValue, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "Variable type cannot be null");
        if (!type.accepts(defaultValue)) {
            throw new IllegalArgumentException("Default value " + defaultValue + " of variable '" + name
                    + "' is not a " + type);
        }
        this.defaultValue = type.normalize(defaultValue);
        this.description = description;
    }

    public Variable(String name, DescriptorType type, Object defaultValue) {
        this(name, type, defaultValue, null);
    }

    public String getName() {
        return name;
    }

    public DescriptorType getType() {
        return type;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    public Descriptor toDescriptor() {
        return Descriptor.withDefault(name, type, defaultValue, description);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Variable variable = (Variable) o;
        return name.equals(variable.name) &&
               type.equals(variable.type) &&
               Objects.equals(defaultValue, variable.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, defaultValue);
    }

    @Override
    public String toString() {
        return "Variable{" + name + ": " + type + " = " + defaultValue + '}';
    }
}
