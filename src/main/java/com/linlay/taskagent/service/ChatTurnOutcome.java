package com.linlay.taskagent.service;

import com.linlay.taskagent.agent.ToolCallRecord;

import java.util.List;

public record ChatTurnOutcome(String conversationId, String reply, List<ToolCallRecord> toolCalls) {

    public ChatTurnOutcome {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }
}
