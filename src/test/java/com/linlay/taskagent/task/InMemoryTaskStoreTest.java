package com.linlay.taskagent.task;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTaskStoreTest {

    private final InMemoryTaskStore store = new InMemoryTaskStore(
            Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC)
    );

    @Test
    void shouldListOnlyOwnTasksFilteredByStatus() {
        Task milk = store.create("alice", " Buy milk ", null);
        Task report = store.create("alice", "Write report", "quarterly");
        store.create("bob", "Bob's task", "");
        store.setCompleted("alice", report.id(), true);

        assertThat(milk.title()).isEqualTo("Buy milk");
        assertThat(milk.description()).isEmpty();
        assertThat(store.list("alice", TaskStatusFilter.ALL)).extracting(Task::id)
                .containsExactly(milk.id(), report.id());
        assertThat(store.list("alice", TaskStatusFilter.PENDING)).extracting(Task::title)
                .containsExactly("Buy milk");
        assertThat(store.list("alice", TaskStatusFilter.COMPLETED)).extracting(Task::title)
                .containsExactly("Write report");
        assertThat(store.list("bob", null)).hasSize(1);
    }

    @Test
    void shouldTreatForeignTasksAsMissing() {
        Task task = store.create("alice", "Private", null);

        assertThat(store.find("bob", task.id())).isEmpty();
        assertThat(store.setCompleted("bob", task.id(), true)).isEmpty();
        assertThat(store.update("bob", task.id(), "Hijacked", null)).isEmpty();
        assertThat(store.delete("bob", task.id())).isFalse();

        Task unchanged = store.find("alice", task.id()).orElseThrow();
        assertThat(unchanged.title()).isEqualTo("Private");
        assertThat(unchanged.completed()).isFalse();
    }

    @Test
    void shouldUpdateOnlyProvidedFields() {
        Task task = store.create("alice", "Call mom", "evening");

        Task renamed = store.update("alice", task.id(), "Call dad", null).orElseThrow();
        assertThat(renamed.title()).isEqualTo("Call dad");
        assertThat(renamed.description()).isEqualTo("evening");

        Task described = store.update("alice", task.id(), null, "morning").orElseThrow();
        assertThat(described.title()).isEqualTo("Call dad");
        assertThat(described.description()).isEqualTo("morning");
    }

    @Test
    void shouldDeleteOnce() {
        Task task = store.create("alice", "Temporary", null);

        assertThat(store.delete("alice", task.id())).isTrue();
        assertThat(store.delete("alice", task.id())).isFalse();
        assertThat(store.list("alice", TaskStatusFilter.ALL)).isEmpty();
    }

    @Test
    void shouldRejectBlankUser() {
        assertThatThrownBy(() -> store.create(" ", "x", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusFilterShouldParseLenientlyAndRejectUnknownValues() {
        assertThat(TaskStatusFilter.fromValue(null)).isEqualTo(TaskStatusFilter.ALL);
        assertThat(TaskStatusFilter.fromValue(" Pending ")).isEqualTo(TaskStatusFilter.PENDING);
        assertThatThrownBy(() -> TaskStatusFilter.fromValue("archived"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
