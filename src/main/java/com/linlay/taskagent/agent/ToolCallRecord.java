package com.linlay.taskagent.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * One executed tool call of a turn, in execution order.
 */
public record ToolCallRecord(
        int round,
        String callId,
        String tool,
        Map<String, Object> arguments,
        JsonNode result,
        boolean success
) {
}
