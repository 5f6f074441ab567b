package io.parley.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only transcript of one conversation: ordered turns plus generation metadata.
 */
public record Dialogue(String id, List<Turn> turns, GenerationError error, Map<String, Object> metadata) {

    public Dialogue {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("dialogue id must not be blank");
        }
        turns = turns == null ? List.of() : List.copyOf(turns);
        for (int i = 0; i < turns.size(); i++) {
            if (turns.get(i).index() != i) {
                throw new IllegalArgumentException(
                    "dialogue " + id + ": turn at position " + i + " has index " + turns.get(i).index());
            }
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Dialogue(String id, List<Turn> turns) {
        this(id, turns, null, Map.of());
    }

    public Dialogue(String id, List<Turn> turns, GenerationError error) {
        this(id, turns, error, Map.of());
    }

    public Optional<GenerationError> generationError() {
        return Optional.ofNullable(error);
    }

    public int size() {
        return turns.size();
    }

    public Turn turn(int index) {
        return turns.get(index);
    }

    public List<Turn> turnsBy(SpeakerRole speaker) {
        Objects.requireNonNull(speaker, "speaker must not be null");
        return turns.stream().filter(turn -> turn.speaker() == speaker).toList();
    }

    /**
     * Intent path of the transcript up to and including {@code lastTurn}, e.g. {@code [U_request, A_recommend]}.
     */
    public List<String> intentPath(int lastTurn) {
        int end = Math.min(lastTurn, turns.size() - 1);
        List<String> path = new ArrayList<>();
        for (int i = 0; i <= end; i++) {
            path.addAll(turns.get(i).intentPathEntries());
        }
        return List.copyOf(path);
    }
}
