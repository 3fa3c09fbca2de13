package com.linlay.taskagent.agent;

import com.linlay.taskagent.service.ChatErrorCode;
import com.linlay.taskagent.service.ChatTurnException;

public class LoopBoundExceededException extends ChatTurnException {

    private final int maxRounds;

    public LoopBoundExceededException(int maxRounds) {
        super(ChatErrorCode.LOOP_BOUND_EXCEEDED, "model still requested tools after " + maxRounds + " round(s)");
        this.maxRounds = maxRounds;
    }

    public int maxRounds() {
        return maxRounds;
    }
}
