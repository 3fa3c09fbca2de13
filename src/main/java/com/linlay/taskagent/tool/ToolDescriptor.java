package com.linlay.taskagent.tool;

import java.util.Map;

/**
 * Catalog entry advertised to the model gateway. {@code parameters} is a JSON schema object.
 */
public record ToolDescriptor(
        String name,
        String description,
        Map<String, Object> parameters
) {
    public ToolDescriptor {
        if (parameters == null || parameters.isEmpty()) {
            parameters = Map.of(
                    "type", "object",
                    "properties", Map.of(),
                    "additionalProperties", false
            );
        } else {
            parameters = Map.copyOf(parameters);
        }
    }
}
