package com.linlay.taskagent.agent;

public enum TurnState {
    START,
    AWAITING_MODEL,
    EXECUTING_TOOLS,
    DONE,
    FAILED
}
