package com.linlay.taskagent.tool;

/**
 * A tool call that cannot be carried out. Never escapes the orchestrator: it is turned into a
 * tool result the model can read and correct.
 */
public class ToolException extends RuntimeException {

    private final ToolErrorReason reason;

    public ToolException(ToolErrorReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ToolErrorReason reason() {
        return reason;
    }
}
