package com.linlay.taskagent.conversation;

/**
 * One immutable entry of a conversation log. {@code seq} is assigned by the store and is
 * strictly increasing per conversation; {@code createdAt} never decreases along {@code seq}.
 */
public record ConversationMessage(
        String id,
        String conversationId,
        String userId,
        long seq,
        MessageRole role,
        String content,
        long createdAt
) {
}
