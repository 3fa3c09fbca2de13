package com.linlay.taskagent.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskagent.agent.TaskChatOrchestrator;
import com.linlay.taskagent.config.TaskChatProperties;
import com.linlay.taskagent.conversation.ConversationMessage;
import com.linlay.taskagent.conversation.ConversationStoreProperties;
import com.linlay.taskagent.conversation.ConversationTurnGate;
import com.linlay.taskagent.conversation.FileConversationStore;
import com.linlay.taskagent.conversation.MessageRole;
import com.linlay.taskagent.gateway.GatewayException;
import com.linlay.taskagent.gateway.ModelOutcome;
import com.linlay.taskagent.gateway.ScriptedModelGateway;
import com.linlay.taskagent.gateway.Transcript;
import com.linlay.taskagent.model.api.ApiResponse;
import com.linlay.taskagent.model.api.ChatRequest;
import com.linlay.taskagent.service.ChatErrorCode;
import com.linlay.taskagent.service.ChatTurnException;
import com.linlay.taskagent.service.ChatTurnService;
import com.linlay.taskagent.task.InMemoryTaskStore;
import com.linlay.taskagent.tool.AddTaskTool;
import com.linlay.taskagent.tool.ListTasksTool;
import com.linlay.taskagent.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class TaskChatControllerCancellationTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CountDownLatch modelEntered = new CountDownLatch(1);
    private final CountDownLatch releaseModel = new CountDownLatch(1);

    private FileConversationStore conversationStore;
    private ScriptedModelGateway gateway;
    private TaskChatProperties properties;
    private TaskChatController controller;

    @BeforeEach
    void setUp() {
        ConversationStoreProperties storeProperties = new ConversationStoreProperties();
        storeProperties.setDir(tempDir.toString());
        conversationStore = new FileConversationStore(objectMapper, storeProperties);
        InMemoryTaskStore taskStore = new InMemoryTaskStore();
        ToolRegistry registry = new ToolRegistry(List.of(new AddTaskTool(taskStore), new ListTasksTool(taskStore)), objectMapper);
        gateway = new ScriptedModelGateway();
        properties = new TaskChatProperties();
        TaskChatOrchestrator orchestrator = new TaskChatOrchestrator(gateway, registry, properties, objectMapper);
        ChatTurnService service = new ChatTurnService(
                conversationStore,
                new ConversationTurnGate(5_000L),
                orchestrator,
                properties
        );
        controller = new TaskChatController(service, conversationStore, registry, properties);
    }

    @Test
    void timedOutTurnShouldFailAsCancelledAndReleaseConversation() throws Exception {
        properties.setTurnTimeoutMs(200L);
        gateway.then(blockingModelCall()).reply("second reply");

        StepVerifier.create(controller.chat("alice", new ChatRequest(null, "first message")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ChatTurnException.class);
                    assertThat(((ChatTurnException) error).errorCode()).isEqualTo(ChatErrorCode.CANCELLED);

                    ResponseEntity<ApiResponse<Map<String, Object>>> response =
                            new ApiExceptionHandler().handleChatTurn((ChatTurnException) error);
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(response.getBody().data()).containsEntry("error", "cancelled");
                })
                .verify(Duration.ofSeconds(5));

        assertThat(modelEntered.await(5, TimeUnit.SECONDS)).isTrue();
        releaseModel.countDown();

        assertFollowUpTurnSucceedsWithoutEarlierReply();
    }

    @Test
    void cancelledRequestShouldNotPersistLateReply() throws Exception {
        properties.setTurnTimeoutMs(0L);
        gateway.then(blockingModelCall()).reply("second reply");

        StepVerifier.create(controller.chat("alice", new ChatRequest(null, "first message")))
                .then(() -> awaitQuietly(modelEntered))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        releaseModel.countDown();

        assertFollowUpTurnSucceedsWithoutEarlierReply();
    }

    private void assertFollowUpTurnSucceedsWithoutEarlierReply() {
        String conversationId = conversationStore.listConversations("alice").get(0).id();

        StepVerifier.create(controller.chat("alice", new ChatRequest(conversationId, "second message")))
                .assertNext(response -> {
                    assertThat(response.code()).isZero();
                    assertThat(response.data().response()).isEqualTo("second reply");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(10));

        List<ConversationMessage> history = conversationStore.history("alice", conversationId);
        assertThat(history).extracting(ConversationMessage::role)
                .containsExactly(MessageRole.USER, MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(history).extracting(ConversationMessage::content)
                .containsExactly("first message", "second message", "second reply");
        assertThat(gateway.calls()).isEqualTo(2);
    }

    private Function<Transcript, ModelOutcome> blockingModelCall() {
        return transcript -> {
            modelEntered.countDown();
            try {
                releaseModel.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new GatewayException("model call interrupted", ex);
            }
            return new ModelOutcome.FinalReply("late reply");
        };
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
