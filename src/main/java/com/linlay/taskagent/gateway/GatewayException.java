package com.linlay.taskagent.gateway;

import com.linlay.taskagent.service.ChatErrorCode;
import com.linlay.taskagent.service.ChatTurnException;

public class GatewayException extends ChatTurnException {

    public GatewayException(String message) {
        super(ChatErrorCode.GATEWAY_ERROR, message);
    }

    public GatewayException(String message, Throwable cause) {
        super(ChatErrorCode.GATEWAY_ERROR, message, cause);
    }
}
