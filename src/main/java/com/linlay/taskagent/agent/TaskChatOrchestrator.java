package com.linlay.taskagent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskagent.config.TaskChatProperties;
import com.linlay.taskagent.conversation.ConversationMessage;
import com.linlay.taskagent.gateway.GatewayException;
import com.linlay.taskagent.gateway.ModelGateway;
import com.linlay.taskagent.gateway.ModelOutcome;
import com.linlay.taskagent.gateway.ToolRequest;
import com.linlay.taskagent.gateway.Transcript;
import com.linlay.taskagent.gateway.TranscriptEntry;
import com.linlay.taskagent.service.TurnCancelledException;
import com.linlay.taskagent.tool.ToolDescriptor;
import com.linlay.taskagent.tool.ToolRegistry;
import com.linlay.taskagent.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one chat turn: alternates model rounds and tool rounds until the model answers in plain
 * text or the round budget is spent.
 * <p>
 * The orchestrator reads and writes tasks only through {@link ToolRegistry} and persists nothing;
 * recording the user and assistant messages is the caller's job.
 */
@Component
public class TaskChatOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskChatOrchestrator.class);

    private final ModelGateway modelGateway;
    private final ToolRegistry toolRegistry;
    private final TaskChatProperties properties;
    private final ObjectMapper objectMapper;

    public TaskChatOrchestrator(
            ModelGateway modelGateway,
            ToolRegistry toolRegistry,
            TaskChatProperties properties,
            ObjectMapper objectMapper
    ) {
        this.modelGateway = modelGateway;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @param history     messages persisted before this turn, oldest first
     * @param userMessage the new user message, already persisted by the caller
     * @throws GatewayException            when the model call fails or the reply is blank
     * @throws LoopBoundExceededException  when the model still asks for tools after the last round
     * @throws TurnCancelledException      when {@code cancellation} fires between rounds
     */
    public TurnResult runTurn(
            String userId,
            String conversationId,
            List<ConversationMessage> history,
            String userMessage,
            TurnCancellation cancellation
    ) {
        int maxRounds = properties.getMaxRounds();
        List<ToolDescriptor> catalog = toolRegistry.describe();
        List<ToolCallRecord> toolCallLog = new ArrayList<>();
        Transcript transcript = initialTranscript(history, userMessage);
        TurnState state = transition(conversationId, TurnState.START, TurnState.AWAITING_MODEL);

        try {
            for (int round = 1; round <= maxRounds; round++) {
                if (cancellation != null && cancellation.isCancelled()) {
                    log.info("Turn cancelled conversation={} before round {} reason={}",
                            conversationId, round, cancellation.reason());
                    throw new TurnCancelledException(conversationId, round - 1);
                }

                ModelOutcome outcome = modelGateway.complete(transcript, catalog);
                if (outcome instanceof ModelOutcome.FinalReply finalReply) {
                    if (!StringUtils.hasText(finalReply.text())) {
                        throw new GatewayException("Model returned a blank reply");
                    }
                    transition(conversationId, state, TurnState.DONE);
                    return new TurnResult(finalReply.text().trim(), toolCallLog, round);
                }

                List<ToolRequest> requests = normalizeCallIds(((ModelOutcome.ToolRequests) outcome).requests(), round);
                if (requests.isEmpty()) {
                    throw new GatewayException("Model returned neither a reply nor tool calls");
                }
                state = transition(conversationId, state, TurnState.EXECUTING_TOOLS);
                transcript = executeToolRound(userId, round, requests, transcript, toolCallLog);
                state = transition(conversationId, state, TurnState.AWAITING_MODEL);
            }
            log.warn("Turn exceeded {} round(s) conversation={} toolCalls={}",
                    maxRounds, conversationId, toolCallLog.size());
            throw new LoopBoundExceededException(maxRounds);
        } catch (RuntimeException ex) {
            transition(conversationId, state, TurnState.FAILED);
            throw ex;
        }
    }

    private Transcript initialTranscript(List<ConversationMessage> history, String userMessage) {
        List<TranscriptEntry> entries = new ArrayList<>();
        entries.add(TranscriptEntry.system(systemPrompt()));
        if (history != null) {
            for (ConversationMessage message : history) {
                switch (message.role()) {
                    case USER -> entries.add(TranscriptEntry.user(message.content()));
                    case ASSISTANT -> entries.add(TranscriptEntry.assistant(message.content()));
                    // tool exchanges are not replayed across turns
                    case TOOL -> {
                    }
                }
            }
        }
        entries.add(TranscriptEntry.user(userMessage));
        return Transcript.of(entries);
    }

    private Transcript executeToolRound(
            String userId,
            int round,
            List<ToolRequest> requests,
            Transcript transcript,
            List<ToolCallRecord> toolCallLog
    ) {
        Map<String, ToolResult> resultsByCallId = new HashMap<>();
        for (ToolRequest request : requests) {
            ToolResult result = toolRegistry.dispatch(request.toolName(), request.rawArguments(), userId);
            resultsByCallId.put(request.callId(), result);
            toolCallLog.add(new ToolCallRecord(
                    round,
                    request.callId(),
                    request.toolName(),
                    result.arguments(),
                    result.payload(),
                    result.success()
            ));
            log.debug("Round {} tool={} callId={} success={}", round, request.toolName(), request.callId(), result.success());
        }

        List<TranscriptEntry> entries = new ArrayList<>(requests.size() + 1);
        entries.add(TranscriptEntry.toolCalls(requests));
        for (ToolRequest request : requests) {
            ToolResult result = resultsByCallId.get(request.callId());
            entries.add(TranscriptEntry.toolResult(request.callId(), request.toolName(), serialize(result)));
        }
        return transcript.appendAll(entries);
    }

    private List<ToolRequest> normalizeCallIds(List<ToolRequest> requests, int round) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<ToolRequest> normalized = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ToolRequest request = requests.get(i);
            String callId = request.callId();
            if (!StringUtils.hasText(callId) || !seen.add(callId)) {
                callId = "call_r" + round + "_" + i;
                seen.add(callId);
            }
            normalized.add(new ToolRequest(callId, request.toolName(), request.rawArguments()));
        }
        return normalized;
    }

    private String serialize(ToolResult result) {
        try {
            return objectMapper.writeValueAsString(result.payload());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize result of tool " + result.toolName(), ex);
        }
    }

    private String systemPrompt() {
        return StringUtils.hasText(properties.getSystemPrompt())
                ? properties.getSystemPrompt()
                : TaskAgentPrompts.DEFAULT_SYSTEM_PROMPT;
    }

    private TurnState transition(String conversationId, TurnState from, TurnState to) {
        log.debug("Turn state conversation={} {} -> {}", conversationId, from, to);
        return to;
    }
}
