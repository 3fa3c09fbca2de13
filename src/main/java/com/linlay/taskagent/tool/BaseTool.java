package com.linlay.taskagent.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public interface BaseTool {

    TaskToolName toolName();

    default String name() {
        return toolName().wireName();
    }

    default String description() {
        return "";
    }

    default List<ToolParameter> parameters() {
        return List.of();
    }

    /**
     * @param userId owner every read and write is scoped to; supplied by the registry, never by the model
     * @param args   arguments already validated against {@link #parameters()}
     */
    JsonNode invoke(String userId, Map<String, Object> args);
}
