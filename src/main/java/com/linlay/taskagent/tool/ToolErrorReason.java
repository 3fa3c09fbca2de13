package com.linlay.taskagent.tool;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolErrorReason {

    UNKNOWN_TOOL("unknown_tool"),
    MALFORMED_ARGUMENTS("malformed_arguments"),
    MISSING_ARGUMENT("missing_argument"),
    INVALID_ARGUMENT_TYPE("invalid_argument_type"),
    INVALID_ENUM_VALUE("invalid_enum_value"),
    TASK_NOT_FOUND("task_not_found"),
    EXECUTION_FAILED("execution_failed");

    private final String code;

    ToolErrorReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
