package com.linlay.taskagent.service;

import org.springframework.http.HttpStatus;

/**
 * Stable, client-visible failure codes of a chat turn.
 */
public enum ChatErrorCode {

    VALIDATION_ERROR("validation_error", HttpStatus.BAD_REQUEST),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    FORBIDDEN("forbidden", HttpStatus.FORBIDDEN),
    GATEWAY_ERROR("gateway_error", HttpStatus.BAD_GATEWAY),
    LOOP_BOUND_EXCEEDED("loop_bound_exceeded", HttpStatus.INTERNAL_SERVER_ERROR),
    BUSY("busy", HttpStatus.CONFLICT),
    CANCELLED("cancelled", HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final HttpStatus status;

    ChatErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
