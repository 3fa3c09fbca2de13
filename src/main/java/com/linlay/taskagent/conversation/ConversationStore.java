package com.linlay.taskagent.conversation;

import java.util.List;

/**
 * Durable, append-only conversation log.
 * <p>
 * All operations are scoped by user. {@link #getOrCreate} reports a conversation owned by another
 * user as {@link ConversationNotFoundException}; the remaining operations report it as
 * {@link ConversationAccessDeniedException}. Each append is an independent atomic write.
 */
public interface ConversationStore {

    /**
     * Returns the referenced conversation, or creates a new one when {@code conversationId} is blank.
     */
    Conversation getOrCreate(String userId, String conversationId);

    Conversation find(String userId, String conversationId);

    /**
     * Appends a message; sequence number and timestamp are assigned here, never by the caller.
     * The parent conversation's update timestamp moves to the message timestamp.
     */
    ConversationMessage appendMessage(String userId, String conversationId, MessageRole role, String content);

    /**
     * Messages of the conversation in ascending sequence order.
     */
    List<ConversationMessage> history(String userId, String conversationId);

    /**
     * Conversations of the user, most recently updated first.
     */
    List<Conversation> listConversations(String userId);
}
