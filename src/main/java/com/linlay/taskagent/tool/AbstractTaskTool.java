package com.linlay.taskagent.tool;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.taskagent.task.TaskStore;

import java.util.Map;

/**
 * Base for the task tools: binds validated arguments to a typed record and hands it to
 * {@link #execute(String, Object)}.
 *
 * @param <A> argument record of the tool
 */
public abstract class AbstractTaskTool<A> implements BaseTool {

    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    protected final TaskStore taskStore;
    private final Class<A> argumentType;

    protected AbstractTaskTool(TaskStore taskStore, Class<A> argumentType) {
        this.taskStore = taskStore;
        this.argumentType = argumentType;
    }

    @Override
    public final JsonNode invoke(String userId, Map<String, Object> args) {
        A arguments = OBJECT_MAPPER.convertValue(args, argumentType);
        return execute(userId, arguments);
    }

    protected abstract JsonNode execute(String userId, A arguments);

    protected ObjectNode taskStatus(long taskId, String status, String title) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("task_id", taskId);
        root.put("status", status);
        root.put("title", title);
        return root;
    }

    protected ToolException taskNotFound() {
        return new ToolException(ToolErrorReason.TASK_NOT_FOUND, "Task not found");
    }
}
