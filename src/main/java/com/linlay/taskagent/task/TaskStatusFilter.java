package com.linlay.taskagent.task;

import java.util.Locale;

public enum TaskStatusFilter {

    ALL("all"),
    PENDING("pending"),
    COMPLETED("completed");

    private final String value;

    TaskStatusFilter(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean matches(Task task) {
        return switch (this) {
            case ALL -> true;
            case PENDING -> !task.completed();
            case COMPLETED -> task.completed();
        };
    }

    public static TaskStatusFilter fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TaskStatusFilter filter : values()) {
            if (filter.value.equals(normalized)) {
                return filter;
            }
        }
        throw new IllegalArgumentException("Unknown task status filter: " + raw);
    }
}
