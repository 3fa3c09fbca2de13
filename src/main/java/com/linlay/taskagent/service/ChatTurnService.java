package com.linlay.taskagent.service;

import com.linlay.taskagent.agent.TaskChatOrchestrator;
import com.linlay.taskagent.agent.TurnCancellation;
import com.linlay.taskagent.agent.TurnResult;
import com.linlay.taskagent.config.TaskChatProperties;
import com.linlay.taskagent.conversation.Conversation;
import com.linlay.taskagent.conversation.ConversationMessage;
import com.linlay.taskagent.conversation.ConversationStore;
import com.linlay.taskagent.conversation.ConversationTurnGate;
import com.linlay.taskagent.conversation.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.UUID;

/**
 * Handles one chat request end to end while holding the conversation's turn gate.
 * <p>
 * The user message is persisted before the model is consulted and stays persisted if the turn
 * fails; the assistant reply is persisted only when the whole turn succeeded and was not cancelled
 * while its last round was in flight.
 */
@Service
public class ChatTurnService {

    private static final Logger log = LoggerFactory.getLogger(ChatTurnService.class);

    private final ConversationStore conversationStore;
    private final ConversationTurnGate turnGate;
    private final TaskChatOrchestrator orchestrator;
    private final TaskChatProperties properties;

    public ChatTurnService(
            ConversationStore conversationStore,
            ConversationTurnGate turnGate,
            TaskChatOrchestrator orchestrator,
            TaskChatProperties properties
    ) {
        this.conversationStore = conversationStore;
        this.turnGate = turnGate;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    public ChatTurnOutcome handle(String userId, String conversationId, String message, TurnCancellation cancellation) {
        validate(userId, conversationId, message);
        TurnCancellation effectiveCancellation = cancellation == null ? TurnCancellation.none() : cancellation;

        Conversation conversation = conversationStore.getOrCreate(userId, conversationId);
        long startedAt = System.currentTimeMillis();
        try (ConversationTurnGate.TurnPermit ignored = turnGate.acquire(conversation.id())) {
            List<ConversationMessage> history = conversationStore.history(userId, conversation.id());
            conversationStore.appendMessage(userId, conversation.id(), MessageRole.USER, message);

            TurnResult result;
            try {
                result = orchestrator.runTurn(userId, conversation.id(), history, message, effectiveCancellation);
            } catch (ChatTurnException ex) {
                log.warn("Chat turn failed user={} conversation={} code={} message={}",
                        userId, conversation.id(), ex.errorCode().code(), ex.getMessage());
                throw ex;
            }
            if (effectiveCancellation.isCancelled()) {
                log.info("Dropping reply of cancelled turn user={} conversation={} reason={}",
                        userId, conversation.id(), effectiveCancellation.reason());
                throw new TurnCancelledException(conversation.id(), result.rounds());
            }

            conversationStore.appendMessage(userId, conversation.id(), MessageRole.ASSISTANT, result.reply());
            log.info("Chat turn done user={} conversation={} rounds={} toolCalls={} costMs={}",
                    userId, conversation.id(), result.rounds(), result.toolCalls().size(),
                    System.currentTimeMillis() - startedAt);
            return new ChatTurnOutcome(conversation.id(), result.reply(), result.toolCalls());
        }
    }

    private void validate(String userId, String conversationId, String message) {
        if (!StringUtils.hasText(userId)) {
            throw new ChatValidationException("userId is required");
        }
        if (!StringUtils.hasText(message)) {
            throw new ChatValidationException("message is required");
        }
        int maxLength = properties.getMaxMessageLength();
        if (maxLength > 0 && message.codePointCount(0, message.length()) > maxLength) {
            throw new ChatValidationException("message exceeds " + maxLength + " characters");
        }
        if (StringUtils.hasText(conversationId)) {
            try {
                UUID.fromString(conversationId.trim());
            } catch (IllegalArgumentException ex) {
                throw new ChatValidationException("conversation_id is not a valid id: " + conversationId);
            }
        }
    }
}
