package com.linlay.taskagent.gateway;

import com.linlay.taskagent.config.ChatClientRegistry;
import com.linlay.taskagent.config.LlmInteractionLogProperties;
import com.linlay.taskagent.config.TaskChatProperties;
import com.linlay.taskagent.tool.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ModelGateway} backed by a Spring AI OpenAI-compatible {@link ChatClient}.
 * <p>
 * Tool execution inside Spring AI is disabled: requested calls are returned to the caller as
 * {@link ModelOutcome.ToolRequests} and executed by the orchestrator.
 */
@Component
public class SpringAiModelGateway implements ModelGateway {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelGateway.class);
    private static final String FUNCTION_TYPE = "function";

    private final ChatClientRegistry chatClientRegistry;
    private final TaskChatProperties chatProperties;
    private final LlmCallLogger callLogger;

    public SpringAiModelGateway(
            ChatClientRegistry chatClientRegistry,
            TaskChatProperties chatProperties,
            LlmInteractionLogProperties logProperties
    ) {
        this.chatClientRegistry = chatClientRegistry;
        this.chatProperties = chatProperties;
        this.callLogger = new LlmCallLogger(logProperties);
    }

    @Override
    public ModelOutcome complete(Transcript transcript, List<ToolDescriptor> toolCatalog) {
        String providerKey = chatProperties.getProviderKey();
        ChatClient chatClient = chatClientRegistry.find(providerKey)
                .orElseThrow(() -> new GatewayException("No model provider registered for key: " + providerKey));
        String model = StringUtils.hasText(chatProperties.getModel())
                ? chatProperties.getModel()
                : chatClientRegistry.defaultModel(providerKey).orElse(null);

        String traceId = callLogger.generateTraceId();
        long startNanos = System.nanoTime();
        callLogger.info(log, "[{}] LLM call start provider={}, model={}, messages={}, tools={}",
                traceId, providerKey, model, transcript.size(), toolCatalog == null ? 0 : toolCatalog.size());
        callLogger.logTranscript(log, traceId, transcript);

        ChatResponse response;
        try {
            response = chatClient.prompt()
                    .options(buildOptions(model, toolCatalog))
                    .messages(toMessages(transcript))
                    .call()
                    .chatResponse();
        } catch (RuntimeException ex) {
            log.error("[{}] LLM call failed provider={}, model={}", traceId, providerKey, model, ex);
            throw new GatewayException("Model call failed: " + ex.getMessage(), ex);
        }

        ModelOutcome outcome = toOutcome(response);
        callLogger.info(log, "[{}] LLM call finished in {} ms outcome={}",
                traceId, callLogger.elapsedMs(startNanos), describe(outcome));
        return outcome;
    }

    OpenAiChatOptions buildOptions(String model, List<ToolDescriptor> toolCatalog) {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(model)
                .temperature(chatProperties.getTemperature())
                .internalToolExecutionEnabled(false);
        if (toolCatalog != null && !toolCatalog.isEmpty()) {
            builder.tools(toolCatalog.stream().map(this::toFunctionTool).toList());
            builder.toolChoice("auto");
            builder.parallelToolCalls(false);
        }
        return builder.build();
    }

    List<Message> toMessages(Transcript transcript) {
        List<Message> messages = new ArrayList<>(transcript.size());
        for (TranscriptEntry entry : transcript.entries()) {
            switch (entry.role()) {
                case SYSTEM -> messages.add(new SystemMessage(entry.content()));
                case USER -> messages.add(new UserMessage(entry.content()));
                case ASSISTANT -> messages.add(toAssistantMessage(entry));
                case TOOL -> messages.add(new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse(
                        entry.callId(),
                        entry.toolName(),
                        entry.content()
                ))));
            }
        }
        return messages;
    }

    ModelOutcome toOutcome(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new GatewayException("Model returned an empty response");
        }
        AssistantMessage output = response.getResult().getOutput();
        List<AssistantMessage.ToolCall> toolCalls = output.getToolCalls();
        if (toolCalls != null && !toolCalls.isEmpty()) {
            List<ToolRequest> requests = new ArrayList<>(toolCalls.size());
            for (int i = 0; i < toolCalls.size(); i++) {
                AssistantMessage.ToolCall call = toolCalls.get(i);
                String callId = StringUtils.hasText(call.id()) ? call.id() : "call_" + i;
                requests.add(new ToolRequest(callId, call.name(), call.arguments()));
            }
            return new ModelOutcome.ToolRequests(requests);
        }
        return new ModelOutcome.FinalReply(output.getText());
    }

    private AssistantMessage toAssistantMessage(TranscriptEntry entry) {
        if (!entry.hasToolCalls()) {
            return new AssistantMessage(entry.content());
        }
        List<AssistantMessage.ToolCall> calls = entry.toolCalls().stream()
                .map(request -> new AssistantMessage.ToolCall(
                        request.callId(),
                        FUNCTION_TYPE,
                        request.toolName(),
                        StringUtils.hasText(request.rawArguments()) ? request.rawArguments() : "{}"
                ))
                .toList();
        return new AssistantMessage(entry.content(), Map.of(), calls);
    }

    private OpenAiApi.FunctionTool toFunctionTool(ToolDescriptor descriptor) {
        return new OpenAiApi.FunctionTool(new OpenAiApi.FunctionTool.Function(
                descriptor.description(),
                descriptor.name(),
                descriptor.parameters(),
                null
        ));
    }

    private String describe(ModelOutcome outcome) {
        if (outcome instanceof ModelOutcome.ToolRequests toolRequests) {
            return "tool_requests(" + toolRequests.requests().size() + ")";
        }
        return "final_reply";
    }
}
