package com.wavegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The session's knowledge base: structured task outputs keyed by task name.
 * <p>
 * Immutable and versioned. Every {@link #with} call yields a new instance whose version is one
 * higher, so executors can hold a snapshot while the scheduler keeps merging results.
 */
public final class SharedContext {

    private final long version;
    private final Map<String, Map<String, Object>> entries;

    @JsonCreator
    public SharedContext(@JsonProperty("version") long version,
                         @JsonProperty("entries") Map<String, Map<String, Object>> entries) {
        this.version = version;
        this.entries = ReadOnly.map(entries);
    }

    public static SharedContext empty() {
        return new SharedContext(0, Map.of());
    }

    public long getVersion() {
        return version;
    }

    public Map<String, Map<String, Object>> getEntries() {
        return entries;
    }

    public Optional<Map<String, Object>> get(String taskName) {
        return Optional.ofNullable(entries.get(taskName));
    }

    public boolean contains(String taskName) {
        return entries.containsKey(taskName);
    }

    /**
     * Returns a copy with {@code taskName} set to {@code output}. A regenerated task replaces its
     * previous entry.
     */
    public SharedContext with(String taskName, Map<String, Object> output) {
        var copy = new LinkedHashMap<>(entries);
        copy.put(taskName, output == null ? Map.of() : output);
        return new SharedContext(version + 1, copy);
    }

    /**
     * View restricted to the given task names, in insertion order. Entries are deeply
     * unmodifiable, so one snapshot can be handed to every task of a wave.
     */
    public Map<String, Map<String, Object>> snapshot(Collection<String> visibleTasks) {
        Set<String> visible = Set.copyOf(visibleTasks);
        var view = new LinkedHashMap<String, Map<String, Object>>();
        entries.forEach((name, output) -> {
            if (visible.contains(name)) {
                view.put(name, output);
            }
        });
        return Collections.unmodifiableMap(view);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SharedContext other)) return false;
        return version == other.version && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(version) * 31 + entries.hashCode();
    }

    @Override
    public String toString() {
        return "SharedContext[version=" + version + ", tasks=" + entries.keySet() + "]";
    }
}
