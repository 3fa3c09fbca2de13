package com.linlay.taskagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Outcome of one dispatched call. Failed calls carry an {@code {error, reason}} payload.
 */
public record ToolResult(
        String toolName,
        Map<String, Object> arguments,
        JsonNode payload,
        ToolErrorReason errorReason
) {

    public ToolResult {
        arguments = arguments == null ? Map.of() : arguments;
    }

    public static ToolResult success(String toolName, Map<String, Object> arguments, JsonNode payload) {
        return new ToolResult(toolName, arguments, payload, null);
    }

    public static ToolResult failure(String toolName, Map<String, Object> arguments, ToolException ex) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("error", ex.getMessage());
        payload.put("reason", ex.reason().code());
        return new ToolResult(toolName, arguments, payload, ex.reason());
    }

    public boolean success() {
        return errorReason == null;
    }
}
