package com.linlay.taskagent.conversation;

import com.linlay.taskagent.service.ChatErrorCode;
import com.linlay.taskagent.service.ChatTurnException;

public class ConversationAccessDeniedException extends ChatTurnException {

    public ConversationAccessDeniedException(String conversationId) {
        super(ChatErrorCode.FORBIDDEN, "conversation is owned by another user: " + conversationId);
    }
}
