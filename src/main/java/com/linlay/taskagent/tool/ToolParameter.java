package com.linlay.taskagent.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ToolParameter(
        String name,
        Type type,
        boolean required,
        String description,
        List<String> enumValues
) {

    public ToolParameter {
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    }

    public static ToolParameter required(String name, Type type, String description) {
        return new ToolParameter(name, type, true, description, List.of());
    }

    public static ToolParameter optional(String name, Type type, String description) {
        return new ToolParameter(name, type, false, description, List.of());
    }

    public static ToolParameter optionalEnum(String name, String description, List<String> enumValues) {
        return new ToolParameter(name, Type.STRING, false, description, enumValues);
    }

    Map<String, Object> toSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type.jsonType());
        if (description != null && !description.isBlank()) {
            schema.put("description", description);
        }
        if (!enumValues.isEmpty()) {
            schema.put("enum", enumValues);
        }
        return schema;
    }

    public enum Type {
        STRING("string"),
        INTEGER("integer"),
        BOOLEAN("boolean");

        private final String jsonType;

        Type(String jsonType) {
            this.jsonType = jsonType;
        }

        public String jsonType() {
            return jsonType;
        }
    }
}
