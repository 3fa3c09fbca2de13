package com.linlay.taskagent.gateway;

/**
 * One tool invocation requested by the model. {@code rawArguments} is the unparsed JSON text.
 */
public record ToolRequest(String callId, String toolName, String rawArguments) {
}
