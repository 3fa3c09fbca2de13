package com.linlay.taskagent.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ConversationDetailResponse(
        @JsonProperty("conversation_id") String conversationId,
        String title,
        @JsonProperty("created_at") long createdAt,
        @JsonProperty("updated_at") long updatedAt,
        List<MessageView> messages
) {

    public record MessageView(
            String id,
            long seq,
            String role,
            String content,
            @JsonProperty("created_at") long createdAt
    ) {
    }
}
