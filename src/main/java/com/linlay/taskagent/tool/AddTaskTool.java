package com.linlay.taskagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.taskagent.task.Task;
import com.linlay.taskagent.task.TaskStore;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AddTaskTool extends AbstractTaskTool<AddTaskTool.Arguments> {

    public AddTaskTool(TaskStore taskStore) {
        super(taskStore, Arguments.class);
    }

    @Override
    public TaskToolName toolName() {
        return TaskToolName.ADD_TASK;
    }

    @Override
    public String description() {
        return "Create a new task for the user";
    }

    @Override
    public List<ToolParameter> parameters() {
        return List.of(
                ToolParameter.required("title", ToolParameter.Type.STRING, "Task title"),
                ToolParameter.optional("description", ToolParameter.Type.STRING, "Task description (optional)")
        );
    }

    @Override
    protected JsonNode execute(String userId, Arguments arguments) {
        Task task = taskStore.create(userId, arguments.title(), arguments.description());
        return taskStatus(task.id(), "created", task.title());
    }

    public record Arguments(String title, String description) {
    }
}
