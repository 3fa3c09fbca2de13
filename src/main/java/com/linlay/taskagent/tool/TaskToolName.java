package com.linlay.taskagent.tool;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of operations the model may request. Declaration order is catalog order.
 */
public enum TaskToolName {

    ADD_TASK("add_task"),
    LIST_TASKS("list_tasks"),
    COMPLETE_TASK("complete_task"),
    DELETE_TASK("delete_task"),
    UPDATE_TASK("update_task");

    private final String wireName;

    TaskToolName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TaskToolName> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TaskToolName name : values()) {
            if (name.wireName.equals(normalized)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
