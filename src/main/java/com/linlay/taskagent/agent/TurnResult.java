package com.linlay.taskagent.agent;

import java.util.List;

public record TurnResult(String reply, List<ToolCallRecord> toolCalls, int rounds) {

    public TurnResult {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }
}
