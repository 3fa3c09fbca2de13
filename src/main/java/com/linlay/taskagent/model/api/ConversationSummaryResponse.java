package com.linlay.taskagent.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConversationSummaryResponse(
        @JsonProperty("conversation_id") String conversationId,
        String title,
        @JsonProperty("created_at") long createdAt,
        @JsonProperty("updated_at") long updatedAt
) {
}
