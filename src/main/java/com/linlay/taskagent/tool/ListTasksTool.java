package com.linlay.taskagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.taskagent.task.Task;
import com.linlay.taskagent.task.TaskStatusFilter;
import com.linlay.taskagent.task.TaskStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

@Component
public class ListTasksTool extends AbstractTaskTool<ListTasksTool.Arguments> {

    private static final List<String> STATUS_VALUES = Arrays.stream(TaskStatusFilter.values())
            .map(TaskStatusFilter::value)
            .toList();

    public ListTasksTool(TaskStore taskStore) {
        super(taskStore, Arguments.class);
    }

    @Override
    public TaskToolName toolName() {
        return TaskToolName.LIST_TASKS;
    }

    @Override
    public String description() {
        return "Retrieve tasks from the list";
    }

    @Override
    public List<ToolParameter> parameters() {
        return List.of(ToolParameter.optionalEnum("status", "Filter by task status", STATUS_VALUES));
    }

    @Override
    protected JsonNode execute(String userId, Arguments arguments) {
        TaskStatusFilter filter = TaskStatusFilter.fromValue(arguments.status());
        List<Task> tasks = taskStore.list(userId, filter);

        ArrayNode items = OBJECT_MAPPER.createArrayNode();
        for (Task task : tasks) {
            ObjectNode item = OBJECT_MAPPER.createObjectNode();
            item.put("id", task.id());
            item.put("title", task.title());
            item.put("description", task.description());
            item.put("completed", task.completed());
            item.put("created_at", Instant.ofEpochMilli(task.createdAt()).toString());
            items.add(item);
        }

        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("status", filter.value());
        root.put("total", tasks.size());
        root.set("tasks", items);
        return root;
    }

    public record Arguments(String status) {
    }
}
