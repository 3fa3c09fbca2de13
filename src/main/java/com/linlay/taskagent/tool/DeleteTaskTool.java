package com.linlay.taskagent.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.taskagent.task.Task;
import com.linlay.taskagent.task.TaskStore;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DeleteTaskTool extends AbstractTaskTool<DeleteTaskTool.Arguments> {

    public DeleteTaskTool(TaskStore taskStore) {
        super(taskStore, Arguments.class);
    }

    @Override
    public TaskToolName toolName() {
        return TaskToolName.DELETE_TASK;
    }

    @Override
    public String description() {
        return "Remove a task from the list";
    }

    @Override
    public List<ToolParameter> parameters() {
        return List.of(ToolParameter.required("task_id", ToolParameter.Type.INTEGER, "Task ID to delete"));
    }

    @Override
    protected JsonNode execute(String userId, Arguments arguments) {
        Task task = taskStore.find(userId, arguments.taskId()).orElseThrow(this::taskNotFound);
        // lost a race with another delete
        if (!taskStore.delete(userId, task.id())) {
            throw taskNotFound();
        }
        return taskStatus(task.id(), "deleted", task.title());
    }

    public record Arguments(@JsonProperty("task_id") long taskId) {
    }
}
