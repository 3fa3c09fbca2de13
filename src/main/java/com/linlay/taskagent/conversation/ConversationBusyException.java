package com.linlay.taskagent.conversation;

import com.linlay.taskagent.service.ChatErrorCode;
import com.linlay.taskagent.service.ChatTurnException;

public class ConversationBusyException extends ChatTurnException {

    public ConversationBusyException(String conversationId, long waitedMs) {
        super(
                ChatErrorCode.BUSY,
                "another turn is in progress for conversation " + conversationId + " (waited " + waitedMs + " ms)"
        );
    }
}
