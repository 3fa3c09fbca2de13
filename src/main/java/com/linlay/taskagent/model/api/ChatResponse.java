package com.linlay.taskagent.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatResponse(
        @JsonProperty("conversation_id") String conversationId,
        String response,
        @JsonProperty("tool_calls") List<ToolCallView> toolCalls
) {
}
