package com.linlay.taskagent.task;

import java.util.List;
import java.util.Optional;

/**
 * Single-owner task persistence used by the chat tools.
 * <p>
 * Every operation is scoped to {@code userId}; a task owned by another user is reported exactly
 * like a missing one.
 */
public interface TaskStore {

    Task create(String userId, String title, String description);

    List<Task> list(String userId, TaskStatusFilter statusFilter);

    Optional<Task> find(String userId, long taskId);

    Optional<Task> setCompleted(String userId, long taskId, boolean completed);

    Optional<Task> update(String userId, long taskId, String title, String description);

    boolean delete(String userId, long taskId);
}
