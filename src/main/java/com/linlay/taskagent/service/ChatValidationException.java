package com.linlay.taskagent.service;

public class ChatValidationException extends ChatTurnException {

    public ChatValidationException(String message) {
        super(ChatErrorCode.VALIDATION_ERROR, message);
    }
}
