package com.linlay.taskagent.conversation;

import com.linlay.taskagent.service.ChatErrorCode;
import com.linlay.taskagent.service.ChatTurnException;

public class ConversationNotFoundException extends ChatTurnException {

    public ConversationNotFoundException(String conversationId) {
        super(ChatErrorCode.NOT_FOUND, "conversation not found: " + conversationId);
    }
}
