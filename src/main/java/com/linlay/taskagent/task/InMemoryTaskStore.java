package com.linlay.taskagent.task;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

@Component
public class InMemoryTaskStore implements TaskStore {

    private final Map<Long, Task> tasksById = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();
    private final Clock clock;

    public InMemoryTaskStore() {
        this(Clock.systemUTC());
    }

    InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Task create(String userId, String title, String description) {
        requireUser(userId);
        long now = clock.millis();
        long id = idSequence.incrementAndGet();
        Task task = new Task(id, userId, title.trim(), description == null ? "" : description, false, now, now);
        tasksById.put(id, task);
        return task;
    }

    @Override
    public List<Task> list(String userId, TaskStatusFilter statusFilter) {
        requireUser(userId);
        TaskStatusFilter filter = statusFilter == null ? TaskStatusFilter.ALL : statusFilter;
        return tasksById.values().stream()
                .filter(task -> userId.equals(task.userId()))
                .filter(filter::matches)
                .sorted(Comparator.comparingLong(Task::id))
                .toList();
    }

    @Override
    public Optional<Task> find(String userId, long taskId) {
        requireUser(userId);
        return Optional.ofNullable(tasksById.get(taskId))
                .filter(task -> userId.equals(task.userId()));
    }

    @Override
    public Optional<Task> setCompleted(String userId, long taskId, boolean completed) {
        return modify(userId, taskId, existing -> new Task(
                existing.id(),
                existing.userId(),
                existing.title(),
                existing.description(),
                completed,
                existing.createdAt(),
                clock.millis()
        ));
    }

    @Override
    public Optional<Task> update(String userId, long taskId, String title, String description) {
        return modify(userId, taskId, existing -> new Task(
                existing.id(),
                existing.userId(),
                title == null ? existing.title() : title.trim(),
                description == null ? existing.description() : description,
                existing.completed(),
                existing.createdAt(),
                clock.millis()
        ));
    }

    @Override
    public boolean delete(String userId, long taskId) {
        requireUser(userId);
        Task existing = tasksById.get(taskId);
        if (existing == null || !userId.equals(existing.userId())) {
            return false;
        }
        return tasksById.remove(taskId, existing);
    }

    private Optional<Task> modify(String userId, long taskId, UnaryOperator<Task> change) {
        requireUser(userId);
        Task updated = tasksById.computeIfPresent(taskId, (id, existing) ->
                userId.equals(existing.userId()) ? change.apply(existing) : existing);
        if (updated == null || !userId.equals(updated.userId())) {
            return Optional.empty();
        }
        return Optional.of(updated);
    }

    private void requireUser(String userId) {
        if (Objects.isNull(userId) || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }
}
