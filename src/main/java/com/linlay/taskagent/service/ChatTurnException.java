package com.linlay.taskagent.service;

public class ChatTurnException extends RuntimeException {

    private final ChatErrorCode errorCode;

    public ChatTurnException(ChatErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ChatTurnException(ChatErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ChatErrorCode errorCode() {
        return errorCode;
    }
}
