package com.linlay.taskagent.gateway;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable, ordered message sequence sent to the model. Every append returns a new instance.
 */
public final class Transcript {

    private static final Transcript EMPTY = new Transcript(List.of());

    private final List<TranscriptEntry> entries;

    private Transcript(List<TranscriptEntry> entries) {
        this.entries = entries;
    }

    static Transcript empty() {
        return EMPTY;
    }

    public static Transcript of(Collection<TranscriptEntry> entries) {
        return new Transcript(entries == null ? List.of() : List.copyOf(entries));
    }

    Transcript append(TranscriptEntry entry) {
        List<TranscriptEntry> next = new ArrayList<>(entries.size() + 1);
        next.addAll(entries);
        next.add(entry);
        return new Transcript(List.copyOf(next));
    }

    public Transcript appendAll(Collection<TranscriptEntry> more) {
        if (more == null || more.isEmpty()) {
            return this;
        }
        List<TranscriptEntry> next = new ArrayList<>(entries.size() + more.size());
        next.addAll(entries);
        next.addAll(more);
        return new Transcript(List.copyOf(next));
    }

    public List<TranscriptEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Transcript{entries=" + entries.size() + "}";
    }
}
