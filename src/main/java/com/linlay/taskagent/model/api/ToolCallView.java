package com.linlay.taskagent.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record ToolCallView(
        @JsonProperty("call_id") String callId,
        String tool,
        Map<String, Object> arguments,
        JsonNode result,
        boolean success
) {
}
