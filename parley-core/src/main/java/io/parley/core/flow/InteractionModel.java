package io.parley.core.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of legal dialogue-act transitions, keyed by act label.
 * Immutable and thread-safe once built.
 */
public final class InteractionModel {

    private final Map<String, Set<String>> successors;
    private final int edgeCount;

    private InteractionModel(Map<String, Set<String>> successors) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        int edges = 0;
        for (Map.Entry<String, Set<String>> entry : successors.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
            edges += entry.getValue().size();
        }
        this.successors = Collections.unmodifiableMap(copy);
        this.edgeCount = edges;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Legal next acts after {@code label}; empty for labels that are not part of the model.
     */
    public Set<String> successors(String label) {
        return successors.getOrDefault(label, Set.of());
    }

    public boolean isLegal(String from, String to) {
        if (!contains(to)) {
            return false;
        }
        return successors(from).contains(to);
    }

    public boolean contains(String label) {
        return label != null && successors.containsKey(label);
    }

    public Set<String> nodes() {
        return successors.keySet();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public static final class Builder {
        private final Map<String, Set<String>> successors = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder node(String label) {
            successors.computeIfAbsent(requireLabel(label), k -> new LinkedHashSet<>());
            return this;
        }

        public Builder edge(String from, String to) {
            node(to);
            successors.computeIfAbsent(requireLabel(from), k -> new LinkedHashSet<>()).add(to.trim());
            return this;
        }

        public InteractionModel build() {
            return new InteractionModel(successors);
        }

        private static String requireLabel(String label) {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("act label must not be blank");
            }
            return label.trim();
        }
    }
}
