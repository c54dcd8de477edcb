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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Type of a value flowing through a flow: step inputs and outputs, variables and
 * context provider values all carry one.
 *
 * <p>Types have a textual form used by YAML definitions and error messages:
 * {@code string}, {@code int}, {@code float}, {@code bool}, {@code any},
 * {@code list<T>}, {@code map<T>} (string keys) and {@code union<T1|T2>}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public final class DescriptorType {

    public enum Kind {
        STRING, INTEGER, FLOAT, BOOLEAN, LIST, MAP, UNION, ANY
    }

    private static final DescriptorType STRING = new DescriptorType(Kind.STRING, null, List.of());
    private static final DescriptorType INTEGER = new DescriptorType(Kind.INTEGER, null, List.of());
    private static final DescriptorType FLOAT = new DescriptorType(Kind.FLOAT, null, List.of());
    private static final DescriptorType BOOLEAN = new DescriptorType(Kind.BOOLEAN, null, List.of());
    private static final DescriptorType ANY = new DescriptorType(Kind.ANY, null, List.of());

    private final Kind kind;
    private final DescriptorType itemType;
    private final List<DescriptorType> members;

    private DescriptorType(Kind kind, DescriptorType itemType, List<DescriptorType> members) {
        this.kind = kind;
        this.itemType = itemType;
        this.members = members;
    }

    public static DescriptorType string() {
        return STRING;
    }

    public static DescriptorType integer() {
        return INTEGER;
    }

    public static DescriptorType floating() {
        return FLOAT;
    }

    public static DescriptorType bool() {
        return BOOLEAN;
    }

    public static DescriptorType any() {
        return ANY;
    }

    public static DescriptorType listOf(DescriptorType itemType) {
        return new DescriptorType(Kind.LIST, Objects.requireNonNull(itemType, "Item type cannot be null"), List.of());
    }

    public static DescriptorType mapOf(DescriptorType valueType) {
        return new DescriptorType(Kind.MAP, Objects.requireNonNull(valueType, "Value type cannot be null"), List.of());
    }

    public static DescriptorType unionOf(DescriptorType... members) {
        if (members == null || members.length < 2) {
            throw new IllegalArgumentException("A union needs at least two member types");
        }
        return new DescriptorType(Kind.UNION, null, List.of(members));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Item type of a list or value type of a map, {@code null} for other kinds.
     */
    public DescriptorType getItemType() {
        return itemType;
    }

    public List<DescriptorType> getMembers() {
        return members;
    }

    /**
     * Checks whether a value of type {@code source} may be fed into a slot of this type.
     * {@code any} is compatible in both directions and integers widen to floats.
     */
    public boolean isAssignableFrom(DescriptorType source) {
        Objects.requireNonNull(source, "Source type cannot be null");
        if (kind == Kind.ANY || source.kind == Kind.ANY) {
            return true;
        }
        if (source.kind == Kind.UNION) {
            return source.members.stream().allMatch(this::isAssignableFrom);
        }
        if (kind == Kind.UNION) {
            return members.stream().anyMatch(member -> member.isAssignableFrom(source));
        }
        switch (kind) {
            case LIST:
            case MAP:
                return source.kind == kind && itemType.isAssignableFrom(source.itemType);
            case FLOAT:
                return source.kind == Kind.FLOAT || source.kind == Kind.INTEGER;
            default:
                return source.kind == kind;
        }
    }

    /**
     * Runtime check of a value against this type. {@code null} is always accepted.
     */
    public boolean accepts(Object value) {
        if (value == null || kind == Kind.ANY) {
            return true;
        }
        switch (kind) {
            case STRING:
                return value instanceof String;
            case INTEGER:
                return isIntegral(value);
            case FLOAT:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case LIST:
                return value instanceof List<?> list && list.stream().allMatch(itemType::accepts);
            case MAP:
                if (!(value instanceof Map<?, ?> map)) {
                    return false;
                }
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    if (!(entry.getKey() instanceof String) || !itemType.accepts(entry.getValue())) {
                        return false;
                    }
                }
                return true;
            case UNION:
                return members.stream().anyMatch(member -> member.accepts(value));
            default:
                return false;
        }
    }

    /**
     * Converts an accepted value to the canonical Java representation used in
     * conversation state: integers become {@link Integer} when they fit and
     * {@link Long} otherwise, floats become {@link Double}, lists and maps are
     * copied with their elements normalized.
     */
    public Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        switch (kind) {
            case INTEGER:
                return normalizeIntegral(((Number) value).longValue());
            case FLOAT:
                return ((Number) value).doubleValue();
            case LIST:
                List<Object> items = new ArrayList<>();
                for (Object item : (List<?>) value) {
                    items.add(itemType.normalize(item));
                }
                return items;
            case MAP:
                Map<String, Object> entries = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                    entries.put((String) entry.getKey(), itemType.normalize(entry.getValue()));
                }
                return entries;
            case UNION:
                for (DescriptorType member : members) {
                    if (member.accepts(value)) {
                        return member.normalize(value);
                    }
                }
                return value;
            case ANY:
                return normalizeUntyped(value);
            default:
                return value;
        }
    }

    /**
     * Parses the textual form of a type, e.g. {@code list<map<int>>}.
     *
     * @throws IllegalArgumentException if the text is not a valid type
     */
    public static DescriptorType parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Type cannot be empty");
        }
        String type = text.trim();
        int open = type.indexOf('<');
        if (open < 0) {
            switch (type.toLowerCase()) {
                case "string":
                case "str":
                    return STRING;
                case "int":
                case "integer":
                    return INTEGER;
                case "float":
                case "double":
                case "number":
                    return FLOAT;
                case "bool":
                case "boolean":
                    return BOOLEAN;
                case "any":
                case "object":
                    return ANY;
                default:
                    throw new IllegalArgumentException("Unknown type: " + text);
            }
        }
        if (!type.endsWith(">")) {
            throw new IllegalArgumentException("Unbalanced type parameters: " + text);
        }
        String outer = type.substring(0, open).trim().toLowerCase();
        String inner = type.substring(open + 1, type.length() - 1);
        switch (outer) {
            case "list":
                return listOf(parse(inner));
            case "map":
            case "dict":
                return mapOf(parse(inner));
            case "union":
                List<String> parts = splitTopLevel(inner);
                return unionOf(parts.stream().map(DescriptorType::parse).toArray(DescriptorType[]::new));
            default:
                throw new IllegalArgumentException("Unknown type: " + text);
        }
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == '|' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte;
    }

    private static Object normalizeIntegral(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }

    private static Object normalizeUntyped(Object value) {
        if (isIntegral(value)) {
            return normalizeIntegral(((Number) value).longValue());
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>();
            for (Object item : list) {
                items.add(normalizeUntyped(item));
            }
            return items;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), normalizeUntyped(entry.getValue()));
            }
            return entries;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DescriptorType that = (DescriptorType) o;
        return kind == that.kind &&
               Objects.equals(itemType, that.itemType) &&
               Objects.equals(members, that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, itemType, members);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return "string";
            case INTEGER:
                return "int";
            case FLOAT:
                return "float";
            case BOOLEAN:
                return "bool";
            case LIST:
                return "list<" + itemType + ">";
            case MAP:
                return "map<" + itemType + ">";
            case UNION:
                StringBuilder sb = new StringBuilder("union<");
                for (int i = 0; i < members.size(); i++) {
                    if (i > 0) {
                        sb.append('|');
                    }
                    sb.append(members.get(i));
                }
                return sb.append('>').toString();
            default:
                return "any";
        }
    }
}
