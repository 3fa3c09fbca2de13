package com.linlay.taskagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog and dispatcher for the task tools.
 * <p>
 * {@link #dispatch(String, String, String)} never throws for anything the model got wrong: unknown
 * names, malformed or invalid arguments and missing tasks all come back as a failed
 * {@link ToolResult} so the orchestrator can feed them back into the transcript.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<TaskToolName, BaseTool> toolsByName;
    private final ToolArgumentValidator argumentValidator;

    public ToolRegistry(List<BaseTool> tools) {
        this(tools, new ObjectMapper());
    }

    @Autowired
    public ToolRegistry(List<BaseTool> tools, ObjectMapper objectMapper) {
        this.toolsByName = buildToolsByName(tools);
        this.argumentValidator = new ToolArgumentValidator(objectMapper);
    }

    public List<ToolDescriptor> describe() {
        List<ToolDescriptor> descriptors = new ArrayList<>();
        toolsByName.values().stream()
                .sorted(Comparator.comparing(BaseTool::toolName))
                .forEach(tool -> descriptors.add(new ToolDescriptor(
                        tool.name(),
                        tool.description(),
                        parametersSchema(tool.parameters())
                )));
        return List.copyOf(descriptors);
    }

    public ToolResult dispatch(String toolName, String rawArguments, String userId) {
        if (Objects.isNull(userId) || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        BaseTool tool = TaskToolName.fromWireName(toolName).map(toolsByName::get).orElse(null);
        if (tool == null) {
            ToolException ex = new ToolException(ToolErrorReason.UNKNOWN_TOOL, "Unknown tool: " + toolName);
            log.warn("Tool call rejected tool={} reason={}", toolName, ex.reason().code());
            return ToolResult.failure(toolName, Map.of(), ex);
        }

        ObjectNode rawNode;
        try {
            rawNode = argumentValidator.parse(rawArguments);
        } catch (ToolException ex) {
            log.warn("Tool call rejected tool={} reason={}", tool.name(), ex.reason().code());
            return ToolResult.failure(tool.name(), Map.of(), ex);
        }

        Map<String, Object> arguments = argumentValidator.asLoggedArguments(rawNode);
        try {
            Map<String, Object> validated = argumentValidator.validate(tool.parameters(), rawNode);
            arguments = validated;
            log.debug("Dispatch tool={} args={}", tool.name(), validated);
            JsonNode payload = tool.invoke(userId, validated);
            return ToolResult.success(tool.name(), validated, payload);
        } catch (ToolException ex) {
            log.warn("Tool call failed tool={} reason={} message={}", tool.name(), ex.reason().code(), ex.getMessage());
            return ToolResult.failure(tool.name(), arguments, ex);
        } catch (RuntimeException ex) {
            log.warn("Tool call failed tool={} reason={}", tool.name(), ToolErrorReason.EXECUTION_FAILED.code(), ex);
            return ToolResult.failure(
                    tool.name(),
                    arguments,
                    new ToolException(ToolErrorReason.EXECUTION_FAILED, "Tool execution failed")
            );
        }
    }

    private Map<String, Object> parametersSchema(List<ToolParameter> parameters) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ToolParameter parameter : parameters) {
            properties.put(parameter.name(), parameter.toSchema());
            if (parameter.required()) {
                required.add(parameter.name());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        schema.put("additionalProperties", false);
        return schema;
    }

    private Map<TaskToolName, BaseTool> buildToolsByName(List<BaseTool> tools) {
        Map<TaskToolName, BaseTool> byName = new EnumMap<>(TaskToolName.class);
        for (BaseTool tool : tools) {
            BaseTool previous = byName.putIfAbsent(tool.toolName(), tool);
            if (previous != null) {
                log.warn("Duplicate tool '{}' ignored: {}", tool.name(), tool.getClass().getName());
            }
        }
        return byName;
    }
}
