package com.linlay.taskagent.controller;

import com.linlay.taskagent.agent.ToolCallRecord;
import com.linlay.taskagent.agent.TurnCancellation;
import com.linlay.taskagent.config.TaskChatProperties;
import com.linlay.taskagent.conversation.Conversation;
import com.linlay.taskagent.conversation.ConversationMessage;
import com.linlay.taskagent.conversation.ConversationStore;
import com.linlay.taskagent.model.api.ApiResponse;
import com.linlay.taskagent.model.api.ChatRequest;
import com.linlay.taskagent.model.api.ChatResponse;
import com.linlay.taskagent.model.api.ConversationDetailResponse;
import com.linlay.taskagent.model.api.ConversationSummaryResponse;
import com.linlay.taskagent.model.api.ToolCallView;
import com.linlay.taskagent.service.ChatErrorCode;
import com.linlay.taskagent.service.ChatTurnException;
import com.linlay.taskagent.service.ChatTurnOutcome;
import com.linlay.taskagent.service.ChatTurnService;
import com.linlay.taskagent.tool.ToolDescriptor;
import com.linlay.taskagent.tool.ToolRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api/{userId}")
public class TaskChatController {

    private static final Logger log = LoggerFactory.getLogger(TaskChatController.class);

    private final ChatTurnService chatTurnService;
    private final ConversationStore conversationStore;
    private final ToolRegistry toolRegistry;
    private final TaskChatProperties properties;

    public TaskChatController(
            ChatTurnService chatTurnService,
            ConversationStore conversationStore,
            ToolRegistry toolRegistry,
            TaskChatProperties properties
    ) {
        this.chatTurnService = chatTurnService;
        this.conversationStore = conversationStore;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    @PostMapping("/chat")
    public Mono<ApiResponse<ChatResponse>> chat(
            @PathVariable String userId,
            @Valid @RequestBody ChatRequest request
    ) {
        TurnCancellation cancellation = new TurnCancellation();
        long turnTimeoutMs = properties.getTurnTimeoutMs();
        Mono<ChatTurnOutcome> turn = Mono.fromCallable(() -> chatTurnService.handle(
                        userId,
                        request.conversationId(),
                        request.message(),
                        cancellation
                ))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(() -> cancellation.cancel("request cancelled"));
        if (turnTimeoutMs > 0) {
            turn = turn.timeout(Duration.ofMillis(turnTimeoutMs))
                    .onErrorMap(TimeoutException.class, ex -> {
                        cancellation.cancel("turn timed out");
                        log.warn("Chat turn timed out user={} after {} ms", userId, turnTimeoutMs);
                        return new ChatTurnException(
                                ChatErrorCode.CANCELLED,
                                "turn timed out after " + turnTimeoutMs + " ms"
                        );
                    });
        }
        return turn.map(outcome -> ApiResponse.success(toChatResponse(outcome)));
    }

    @GetMapping("/conversations")
    public ApiResponse<List<ConversationSummaryResponse>> conversations(@PathVariable String userId) {
        List<ConversationSummaryResponse> items = conversationStore.listConversations(userId).stream()
                .map(this::toSummary)
                .toList();
        return ApiResponse.success(items);
    }

    @GetMapping("/conversations/{conversationId}")
    public ApiResponse<ConversationDetailResponse> conversation(
            @PathVariable String userId,
            @PathVariable String conversationId
    ) {
        Conversation conversation = conversationStore.find(userId, conversationId);
        List<ConversationDetailResponse.MessageView> messages = conversationStore.history(userId, conversationId).stream()
                .map(this::toMessageView)
                .toList();
        return ApiResponse.success(new ConversationDetailResponse(
                conversation.id(),
                conversation.title(),
                conversation.createdAt(),
                conversation.updatedAt(),
                messages
        ));
    }

    @GetMapping("/tools")
    public ApiResponse<List<ToolDescriptor>> tools(@PathVariable String userId) {
        return ApiResponse.success(toolRegistry.describe());
    }

    private ChatResponse toChatResponse(ChatTurnOutcome outcome) {
        List<ToolCallView> toolCalls = outcome.toolCalls().stream()
                .map(this::toToolCallView)
                .toList();
        return new ChatResponse(outcome.conversationId(), outcome.reply(), toolCalls);
    }

    private ToolCallView toToolCallView(ToolCallRecord record) {
        return new ToolCallView(record.callId(), record.tool(), record.arguments(), record.result(), record.success());
    }

    private ConversationSummaryResponse toSummary(Conversation conversation) {
        return new ConversationSummaryResponse(
                conversation.id(),
                conversation.title(),
                conversation.createdAt(),
                conversation.updatedAt()
        );
    }

    private ConversationDetailResponse.MessageView toMessageView(ConversationMessage message) {
        return new ConversationDetailResponse.MessageView(
                message.id(),
                message.seq(),
                message.role().value(),
                message.content(),
                message.createdAt()
        );
    }
}
