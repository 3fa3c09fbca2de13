package com.linlay.taskagent.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.taskagent.task.Task;
import com.linlay.taskagent.task.TaskStore;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class UpdateTaskTool extends AbstractTaskTool<UpdateTaskTool.Arguments> {

    public UpdateTaskTool(TaskStore taskStore) {
        super(taskStore, Arguments.class);
    }

    @Override
    public TaskToolName toolName() {
        return TaskToolName.UPDATE_TASK;
    }

    @Override
    public String description() {
        return "Modify task title or description";
    }

    @Override
    public List<ToolParameter> parameters() {
        return List.of(
                ToolParameter.required("task_id", ToolParameter.Type.INTEGER, "Task ID to update"),
                ToolParameter.optional("title", ToolParameter.Type.STRING, "New task title (optional)"),
                ToolParameter.optional("description", ToolParameter.Type.STRING, "New task description (optional)")
        );
    }

    @Override
    protected JsonNode execute(String userId, Arguments arguments) {
        Task task = taskStore.update(userId, arguments.taskId(), arguments.title(), arguments.description())
                .orElseThrow(this::taskNotFound);
        return taskStatus(task.id(), "updated", task.title());
    }

    public record Arguments(
            @JsonProperty("task_id") long taskId,
            String title,
            String description
    ) {
    }
}
