package com.linlay.taskagent.task;

public record Task(
        long id,
        String userId,
        String title,
        String description,
        boolean completed,
        long createdAt,
        long updatedAt
) {
}
