package com.linlay.taskagent.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskagent.agent.LoopBoundExceededException;
import com.linlay.taskagent.agent.TaskChatOrchestrator;
import com.linlay.taskagent.agent.ToolCallRecord;
import com.linlay.taskagent.config.TaskChatProperties;
import com.linlay.taskagent.conversation.ConversationMessage;
import com.linlay.taskagent.conversation.ConversationNotFoundException;
import com.linlay.taskagent.conversation.ConversationStoreProperties;
import com.linlay.taskagent.conversation.ConversationTurnGate;
import com.linlay.taskagent.conversation.FileConversationStore;
import com.linlay.taskagent.conversation.MessageRole;
import com.linlay.taskagent.gateway.GatewayException;
import com.linlay.taskagent.gateway.ModelOutcome;
import com.linlay.taskagent.gateway.ScriptedModelGateway;
import com.linlay.taskagent.gateway.TranscriptEntry;
import com.linlay.taskagent.task.InMemoryTaskStore;
import com.linlay.taskagent.task.TaskStatusFilter;
import com.linlay.taskagent.tool.AddTaskTool;
import com.linlay.taskagent.tool.CompleteTaskTool;
import com.linlay.taskagent.tool.DeleteTaskTool;
import com.linlay.taskagent.tool.ListTasksTool;
import com.linlay.taskagent.tool.ToolRegistry;
import com.linlay.taskagent.tool.UpdateTaskTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.linlay.taskagent.gateway.ScriptedModelGateway.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatTurnServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryTaskStore taskStore;
    private FileConversationStore conversationStore;
    private ScriptedModelGateway gateway;
    private TaskChatProperties properties;
    private ChatTurnService service;

    @BeforeEach
    void setUp() {
        ConversationStoreProperties storeProperties = new ConversationStoreProperties();
        storeProperties.setDir(tempDir.toString());
        conversationStore = new FileConversationStore(objectMapper, storeProperties);
        taskStore = new InMemoryTaskStore();
        gateway = new ScriptedModelGateway();
        properties = new TaskChatProperties();
        properties.setMaxRounds(4);
        properties.setMaxMessageLength(200);
        ToolRegistry registry = new ToolRegistry(List.of(
                new AddTaskTool(taskStore),
                new ListTasksTool(taskStore),
                new CompleteTaskTool(taskStore),
                new DeleteTaskTool(taskStore),
                new UpdateTaskTool(taskStore)
        ), objectMapper);
        TaskChatOrchestrator orchestrator = new TaskChatOrchestrator(gateway, registry, properties, objectMapper);
        service = new ChatTurnService(conversationStore, new ConversationTurnGate(2_000L), orchestrator, properties);
    }

    @Test
    void addTaskRequestShouldCreateTaskAndPersistUserAndAssistantMessages() {
        gateway.requestTools(call("call_1", "add_task", "{\"title\":\"Buy milk\"}"))
                .reply("I've added \"Buy milk\" to your list.");

        ChatTurnOutcome outcome = service.handle("alice", null, "Add a task to buy milk", null);

        assertThat(outcome.reply()).isEqualTo("I've added \"Buy milk\" to your list.");
        assertThat(outcome.toolCalls()).hasSize(1);
        ToolCallRecord record = outcome.toolCalls().get(0);
        assertThat(record.tool()).isEqualTo("add_task");
        assertThat(record.result().path("status").asText()).isEqualTo("created");
        assertThat(taskStore.list("alice", TaskStatusFilter.ALL)).extracting(task -> task.title())
                .containsExactly("Buy milk");

        List<ConversationMessage> history = conversationStore.history("alice", outcome.conversationId());
        assertThat(history).extracting(ConversationMessage::role)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(history).extracting(ConversationMessage::seq).containsExactly(1L, 2L);
        assertThat(conversationStore.find("alice", outcome.conversationId()).title())
                .isEqualTo("Add a task to buy milk");
    }

    @Test
    void secondTurnShouldSeeFirstTurnInTranscript() {
        gateway.reply("first answer").reply("second answer");

        ChatTurnOutcome first = service.handle("alice", null, "first question", null);
        ChatTurnOutcome second = service.handle("alice", first.conversationId(), "second question", null);

        assertThat(second.conversationId()).isEqualTo(first.conversationId());
        assertThat(gateway.transcripts().get(1).entries()).extracting(TranscriptEntry::content)
                .endsWith("first question", "first answer", "second question");
        assertThat(conversationStore.history("alice", first.conversationId())).hasSize(4);
    }

    @Test
    void failedTurnShouldKeepOnlyUserMessage() {
        gateway.otherwise(transcript -> new ModelOutcome.ToolRequests(List.of(call("x", "list_tasks", "{}"))));

        assertThatThrownBy(() -> service.handle("alice", null, "loop forever", null))
                .isInstanceOf(LoopBoundExceededException.class);

        String conversationId = conversationStore.listConversations("alice").get(0).id();
        assertThat(conversationStore.history("alice", conversationId))
                .extracting(ConversationMessage::role)
                .containsExactly(MessageRole.USER);
        assertThat(gateway.calls()).isEqualTo(4);
    }

    @Test
    void gatewayFailureShouldSurfaceAsGatewayError() {
        gateway.then(transcript -> {
            throw new GatewayException("upstream 429");
        });

        assertThatThrownBy(() -> service.handle("alice", null, "hello", null))
                .isInstanceOf(GatewayException.class)
                .extracting(ex -> ((ChatTurnException) ex).errorCode())
                .isEqualTo(ChatErrorCode.GATEWAY_ERROR);
    }

    @Test
    void invalidInputShouldBeRejectedBeforeAnythingIsPersisted() {
        assertThatThrownBy(() -> service.handle("alice", null, "   ", null))
                .isInstanceOf(ChatValidationException.class);
        assertThatThrownBy(() -> service.handle(" ", null, "hello", null))
                .isInstanceOf(ChatValidationException.class);
        assertThatThrownBy(() -> service.handle("alice", null, "x".repeat(201), null))
                .isInstanceOf(ChatValidationException.class);
        assertThatThrownBy(() -> service.handle("alice", "not-a-conversation-id", "hello", null))
                .isInstanceOf(ChatValidationException.class);

        assertThat(conversationStore.listConversations("alice")).isEmpty();
        assertThat(gateway.calls()).isZero();
    }

    @Test
    void unknownConversationShouldBeNotFound() {
        assertThatThrownBy(() -> service.handle("alice", UUID.randomUUID().toString(), "hello", null))
                .isInstanceOf(ConversationNotFoundException.class);
    }

    @Test
    void concurrentTurnsOnSameConversationShouldBeSerialized() throws Exception {
        gateway.reply("setup");
        String conversationId = service.handle("alice", null, "setup", null).conversationId();

        CountDownLatch firstInModel = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        gateway.then(transcript -> {
                    firstInModel.countDown();
                    try {
                        releaseFirst.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return new ModelOutcome.FinalReply("reply one");
                })
                .reply("reply two");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ChatTurnOutcome> first = executor.submit(() ->
                    service.handle("alice", conversationId, "message one", null));
            assertThat(firstInModel.await(5, TimeUnit.SECONDS)).isTrue();
            Future<ChatTurnOutcome> second = executor.submit(() ->
                    service.handle("alice", conversationId, "message two", null));
            Thread.sleep(100L);
            releaseFirst.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS).reply()).isEqualTo("reply one");
            assertThat(second.get(5, TimeUnit.SECONDS).reply()).isEqualTo("reply two");
        } finally {
            executor.shutdownNow();
        }

        assertThat(gateway.transcripts().get(2).entries()).extracting(TranscriptEntry::content)
                .contains("message one", "reply one")
                .endsWith("message two");
        assertThat(conversationStore.history("alice", conversationId))
                .extracting(ConversationMessage::content)
                .containsExactly("setup", "setup", "message one", "reply one", "message two", "reply two");
    }
}
