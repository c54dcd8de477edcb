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

package dev.mars.stepwise.core.descriptor;

import java.util.Objects;

/**
 * Named, typed and optionally defaulted value contract. Used for step inputs and
 * outputs, flow inputs and outputs and context provider values.
 *
 * <p>A descriptor without a default is required: the engine must resolve a value
 * for it before the owning step runs. Descriptors are immutable.</p>
 */
public final class Descriptor {

    private final String name;
    private final DescriptorType type;
    private final String description;
    private final boolean hasDefault;
    private final Object defaultValue;

    private Descriptor(String name, DescriptorType type, String description,
                       boolean hasDefault, Object defaultValue) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Descriptor name cannot be empty");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "Descriptor type cannot be null");
        this.description = description;
        this.hasDefault = hasDefault;
        if (hasDefault && !type.accepts(defaultValue)) {
            throw new IllegalArgumentException("Default value " + defaultValue + " of '" + name
                    + "' is not a " + type);
        }
        this.defaultValue = hasDefault ? type.normalize(defaultValue) : null;
    }

    public static Descriptor of(String name, DescriptorType type) {
        return new Descriptor(name, type, null, false, null);
    }

    public static Descriptor of(String name, DescriptorType type, String description) {
        return new Descriptor(name, type, description, false, null);
    }

    public static Descriptor withDefault(String name, DescriptorType type, Object defaultValue) {
        return new Descriptor(name, type, null, true, defaultValue);
    }

    public static Descriptor withDefault(String name, DescriptorType type, Object defaultValue, String description) {
        return new Descriptor(name, type, description, true, defaultValue);
    }

    public static Descriptor string(String name) {
        return of(name, DescriptorType.string());
    }

    public static Descriptor integer(String name) {
        return of(name, DescriptorType.integer());
    }

    public static Descriptor bool(String name) {
        return of(name, DescriptorType.bool());
    }

    public static Descriptor any(String name) {
        return of(name, DescriptorType.any());
    }

    public String getName() {
        return name;
    }

    public DescriptorType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return !hasDefault;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Descriptor that = (Descriptor) o;
        return hasDefault == that.hasDefault &&
               name.equals(that.name) &&
               type.equals(that.type) &&
               Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, hasDefault, defaultValue);
    }

    @Override
    public String toString() {
        return name + ": " + type + (hasDefault ? " = " + defaultValue : "");
    }
}
