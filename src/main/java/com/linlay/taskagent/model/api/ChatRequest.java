package com.linlay.taskagent.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ChatRequest(
        @JsonProperty("conversation_id") String conversationId,
        @NotBlank(message = "message is required") String message
) {
}
