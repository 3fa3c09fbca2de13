package com.linlay.taskagent.gateway;

import java.util.List;

/**
 * One message of a turn's transcript. Assistant entries may carry the tool calls they requested;
 * tool entries carry the call id and tool name of the request they answer.
 */
public record TranscriptEntry(
        Role role,
        String content,
        List<ToolRequest> toolCalls,
        String callId,
        String toolName
) {

    public TranscriptEntry {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static TranscriptEntry system(String content) {
        return new TranscriptEntry(Role.SYSTEM, content, List.of(), null, null);
    }

    public static TranscriptEntry user(String content) {
        return new TranscriptEntry(Role.USER, content, List.of(), null, null);
    }

    public static TranscriptEntry assistant(String content) {
        return new TranscriptEntry(Role.ASSISTANT, content, List.of(), null, null);
    }

    public static TranscriptEntry toolCalls(List<ToolRequest> requests) {
        return new TranscriptEntry(Role.ASSISTANT, "", requests, null, null);
    }

    public static TranscriptEntry toolResult(String callId, String toolName, String content) {
        return new TranscriptEntry(Role.TOOL, content, List.of(), callId, toolName);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT,
        TOOL
    }
}
