package com.linlay.taskagent.conversation;

public record Conversation(
        String id,
        String userId,
        String title,
        long createdAt,
        long updatedAt
) {
}
