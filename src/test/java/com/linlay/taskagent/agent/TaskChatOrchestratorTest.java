package com.linlay.taskagent.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskagent.config.TaskChatProperties;
import com.linlay.taskagent.conversation.ConversationMessage;
import com.linlay.taskagent.conversation.MessageRole;
import com.linlay.taskagent.gateway.GatewayException;
import com.linlay.taskagent.gateway.ModelOutcome;
import com.linlay.taskagent.gateway.ScriptedModelGateway;
import com.linlay.taskagent.gateway.ToolRequest;
import com.linlay.taskagent.gateway.Transcript;
import com.linlay.taskagent.gateway.TranscriptEntry;
import com.linlay.taskagent.service.TurnCancelledException;
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

import java.util.List;

import static com.linlay.taskagent.gateway.ScriptedModelGateway.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TaskChatOrchestratorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryTaskStore taskStore;
    private ScriptedModelGateway gateway;
    private TaskChatProperties properties;
    private TaskChatOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        taskStore = new InMemoryTaskStore();
        gateway = new ScriptedModelGateway();
        properties = new TaskChatProperties();
        properties.setMaxRounds(3);
        ToolRegistry registry = new ToolRegistry(List.of(
                new AddTaskTool(taskStore),
                new ListTasksTool(taskStore),
                new CompleteTaskTool(taskStore),
                new DeleteTaskTool(taskStore),
                new UpdateTaskTool(taskStore)
        ), objectMapper);
        orchestrator = new TaskChatOrchestrator(gateway, registry, properties, objectMapper);
    }

    @Test
    void finalReplyOnFirstRoundShouldEndTurnWithoutToolCalls() {
        gateway.reply("Hello! How can I help?");

        TurnResult result = orchestrator.runTurn("alice", "c-1", List.of(), "hi", TurnCancellation.none());

        assertThat(result.reply()).isEqualTo("Hello! How can I help?");
        assertThat(result.toolCalls()).isEmpty();
        assertThat(result.rounds()).isEqualTo(1);
        Transcript sent = gateway.transcripts().get(0);
        assertThat(sent.entries()).extracting(TranscriptEntry::role)
                .containsExactly(TranscriptEntry.Role.SYSTEM, TranscriptEntry.Role.USER);
        assertThat(sent.entries().get(0).content()).contains("add_task");
    }

    @Test
    void historyShouldPrecedeNewUserMessage() {
        gateway.reply("ok");
        List<ConversationMessage> history = List.of(
                new ConversationMessage("m1", "c-1", "alice", 1L, MessageRole.USER, "earlier question", 1L),
                new ConversationMessage("m2", "c-1", "alice", 2L, MessageRole.ASSISTANT, "earlier answer", 2L)
        );

        orchestrator.runTurn("alice", "c-1", history, "follow up", null);

        assertThat(gateway.transcripts().get(0).entries()).extracting(TranscriptEntry::content)
                .endsWith("earlier question", "earlier answer", "follow up");
    }

    @Test
    void toolRoundShouldFeedResultsBackByCallId() {
        gateway.requestTools(
                        call("call_a", "add_task", "{\"title\":\"Buy milk\"}"),
                        call("call_b", "add_task", "{\"title\":\"Walk dog\"}"))
                .reply("Added both tasks.");

        TurnResult result = orchestrator.runTurn("alice", "c-1", List.of(), "add two", TurnCancellation.none());

        assertThat(result.reply()).isEqualTo("Added both tasks.");
        assertThat(result.rounds()).isEqualTo(2);
        assertThat(result.toolCalls()).extracting(ToolCallRecord::callId).containsExactly("call_a", "call_b");
        assertThat(result.toolCalls()).allMatch(ToolCallRecord::success);
        assertThat(taskStore.list("alice", TaskStatusFilter.ALL)).hasSize(2);

        List<TranscriptEntry> second = gateway.transcripts().get(1).entries();
        assertThat(second).hasSize(5);
        TranscriptEntry assistantCalls = second.get(2);
        assertThat(assistantCalls.role()).isEqualTo(TranscriptEntry.Role.ASSISTANT);
        assertThat(assistantCalls.toolCalls()).extracting(ToolRequest::callId).containsExactly("call_a", "call_b");
        assertThat(second.get(3).callId()).isEqualTo("call_a");
        assertThat(second.get(3).content()).contains("Buy milk");
        assertThat(second.get(4).callId()).isEqualTo("call_b");
        assertThat(second.get(4).content()).contains("Walk dog");
        assertThat(gateway.transcripts().get(0).size()).isEqualTo(2);
    }

    @Test
    void failingToolShouldNotAbortSiblingsOrTurn() {
        gateway.requestTools(
                        call("call_1", "complete_task", "{\"task_id\":999}"),
                        call("call_2", "add_task", "{\"title\":\"Still added\"}"))
                .reply("Task 999 does not exist, but I added the other one.");

        TurnResult result = orchestrator.runTurn("alice", "c-1", List.of(), "do things", TurnCancellation.none());

        assertThat(result.toolCalls()).extracting(ToolCallRecord::success).containsExactly(false, true);
        assertThat(result.toolCalls().get(0).result().path("reason").asText()).isEqualTo("task_not_found");
        assertThat(gateway.transcripts().get(1).entries().get(3).content()).contains("task_not_found");
        assertThat(taskStore.list("alice", TaskStatusFilter.ALL)).hasSize(1);
    }

    @Test
    void modelThatKeepsRequestingToolsShouldHitLoopBoundAfterExactlyMaxRounds() {
        gateway.otherwise(transcript -> new ModelOutcome.ToolRequests(List.of(
                call("loop", "list_tasks", "{}")
        )));

        LoopBoundExceededException ex = catchThrowableOfType(
                () -> orchestrator.runTurn("alice", "c-1", List.of(), "loop", TurnCancellation.none()),
                LoopBoundExceededException.class
        );

        assertThat(ex).isNotNull();
        assertThat(ex.maxRounds()).isEqualTo(3);
        assertThat(gateway.calls()).isEqualTo(3);
    }

    @Test
    void missingOrDuplicateCallIdsShouldBeMadeUnique() {
        gateway.requestTools(
                        call(null, "list_tasks", "{}"),
                        call("dup", "list_tasks", "{}"),
                        call("dup", "list_tasks", "{}"))
                .reply("done");

        TurnResult result = orchestrator.runTurn("alice", "c-1", List.of(), "list", TurnCancellation.none());

        assertThat(result.toolCalls()).extracting(ToolCallRecord::callId).doesNotHaveDuplicates();
        assertThat(result.toolCalls()).extracting(ToolCallRecord::callId).doesNotContainNull();
    }

    @Test
    void blankFinalReplyShouldBeGatewayError() {
        gateway.reply("   ");

        assertThatThrownBy(() -> orchestrator.runTurn("alice", "c-1", List.of(), "hi", TurnCancellation.none()))
                .isInstanceOf(GatewayException.class);
    }

    @Test
    void cancellationShouldStopBeforeNextRound() {
        TurnCancellation cancellation = new TurnCancellation();
        gateway.then(transcript -> {
                    cancellation.cancel("client went away");
                    return new ModelOutcome.ToolRequests(List.of(call("c1", "add_task", "{\"title\":\"Settles\"}")));
                })
                .reply("never reached");

        assertThatThrownBy(() -> orchestrator.runTurn("alice", "c-1", List.of(), "add", cancellation))
                .isInstanceOf(TurnCancelledException.class);
        assertThat(gateway.calls()).isEqualTo(1);
        assertThat(taskStore.list("alice", TaskStatusFilter.ALL)).hasSize(1);
    }

    @Test
    void configuredSystemPromptShouldReplaceDefault() {
        properties.setSystemPrompt("Only speak French.");
        gateway.reply("Bonjour");

        orchestrator.runTurn("alice", "c-1", List.of(), "hi", TurnCancellation.none());

        assertThat(gateway.transcripts().get(0).entries().get(0).content()).isEqualTo("Only speak French.");
    }
}
