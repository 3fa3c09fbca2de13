package com.linlay.taskagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.util.StringUtils;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses raw model-supplied arguments and checks them against a tool's declared parameters.
 * <p>
 * Undeclared keys are dropped, so an argument such as {@code user_id} can never reach a handler.
 * Integer parameters also accept integral numeric strings since models routinely quote ids.
 */
public final class ToolArgumentValidator {

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d{1,18}");
    private static final Set<String> BOOLEAN_TEXT = Set.of("true", "false");

    private final ObjectMapper objectMapper;

    public ToolArgumentValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode parse(String rawArguments) {
        if (!StringUtils.hasText(rawArguments)) {
            return objectMapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(rawArguments);
        } catch (Exception ex) {
            throw new ToolException(ToolErrorReason.MALFORMED_ARGUMENTS, "Arguments are not valid JSON");
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            return objectMapper.createObjectNode();
        }
        if (!node.isObject()) {
            throw new ToolException(ToolErrorReason.MALFORMED_ARGUMENTS, "Arguments must be a JSON object");
        }
        return (ObjectNode) node;
    }

    /**
     * Best-effort plain view of the raw arguments, used for the tool-call log when validation fails.
     */
    public Map<String, Object> asLoggedArguments(ObjectNode node) {
        Map<String, Object> logged = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            logged.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
        }
        return logged;
    }

    public Map<String, Object> validate(List<ToolParameter> parameters, ObjectNode arguments) {
        Map<String, Object> validated = new LinkedHashMap<>();
        for (ToolParameter parameter : parameters) {
            JsonNode value = arguments.get(parameter.name());
            boolean absent = value == null || value.isNull()
                    || (value.isTextual() && !StringUtils.hasText(value.asText()));
            if (absent) {
                if (parameter.required()) {
                    throw new ToolException(
                            ToolErrorReason.MISSING_ARGUMENT,
                            "Missing required argument: " + parameter.name()
                    );
                }
                continue;
            }
            Object converted = convert(parameter, value);
            if (!parameter.enumValues().isEmpty()) {
                String normalized = String.valueOf(converted).trim().toLowerCase(Locale.ROOT);
                if (!parameter.enumValues().contains(normalized)) {
                    throw new ToolException(
                            ToolErrorReason.INVALID_ENUM_VALUE,
                            "Argument " + parameter.name() + " must be one of " + parameter.enumValues()
                    );
                }
                converted = normalized;
            }
            validated.put(parameter.name(), converted);
        }
        return validated;
    }

    private Object convert(ToolParameter parameter, JsonNode value) {
        switch (parameter.type()) {
            case INTEGER:
                if (value.isIntegralNumber() && value.canConvertToLong()) {
                    return value.asLong();
                }
                if (value.isNumber() && value.decimalValue().stripTrailingZeros().scale() <= 0
                        && value.canConvertToLong()) {
                    return value.asLong();
                }
                if (value.isTextual() && INTEGER_TEXT.matcher(value.asText().trim()).matches()) {
                    return Long.parseLong(value.asText().trim());
                }
                throw typeMismatch(parameter);
            case BOOLEAN:
                if (value.isBoolean()) {
                    return value.asBoolean();
                }
                if (value.isTextual() && BOOLEAN_TEXT.contains(value.asText().trim().toLowerCase(Locale.ROOT))) {
                    return Boolean.parseBoolean(value.asText().trim());
                }
                throw typeMismatch(parameter);
            case STRING:
            default:
                if (value.isTextual()) {
                    return value.asText();
                }
                throw typeMismatch(parameter);
        }
    }

    private ToolException typeMismatch(ToolParameter parameter) {
        return new ToolException(
                ToolErrorReason.INVALID_ARGUMENT_TYPE,
                "Argument " + parameter.name() + " must be of type " + parameter.type().jsonType()
        );
    }
}
