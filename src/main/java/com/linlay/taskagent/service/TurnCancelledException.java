package com.linlay.taskagent.service;

public class TurnCancelledException extends ChatTurnException {

    public TurnCancelledException(String conversationId, int completedRounds) {
        super(
                ChatErrorCode.CANCELLED,
                "turn cancelled for conversation " + conversationId + " after " + completedRounds + " round(s)"
        );
    }
}
