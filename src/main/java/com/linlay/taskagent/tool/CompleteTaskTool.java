package com.linlay.taskagent.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.taskagent.task.Task;
import com.linlay.taskagent.task.TaskStore;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CompleteTaskTool extends AbstractTaskTool<CompleteTaskTool.Arguments> {

    public CompleteTaskTool(TaskStore taskStore) {
        super(taskStore, Arguments.class);
    }

    @Override
    public TaskToolName toolName() {
        return TaskToolName.COMPLETE_TASK;
    }

    @Override
    public String description() {
        return "Mark a task as complete";
    }

    @Override
    public List<ToolParameter> parameters() {
        return List.of(ToolParameter.required("task_id", ToolParameter.Type.INTEGER, "Task ID to complete"));
    }

    @Override
    protected JsonNode execute(String userId, Arguments arguments) {
        Task task = taskStore.setCompleted(userId, arguments.taskId(), true)
                .orElseThrow(this::taskNotFound);
        return taskStatus(task.id(), "completed", task.title());
    }

    public record Arguments(@JsonProperty("task_id") long taskId) {
    }
}
