package io.parley.core.detect;

import io.parley.core.model.Dialogue;
import io.parley.core.model.GenerationError;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags dialogues whose generation stopped on a system error.
 *
 * <p>Error types listed as excluded are left to other detectors; by default {@code RecursionError},
 * which marks an agent stuck in a loop rather than a crash.
 */
public final class SystemFailureDetector implements DialogueDetector {
    public static final String ID = "system_failure";
    public static final Set<String> DEFAULT_EXCLUDED_ERROR_TYPES = Set.of("RecursionError");

    private final Set<String> excludedErrorTypes;

    public SystemFailureDetector() {
        this(DEFAULT_EXCLUDED_ERROR_TYPES);
    }

    public SystemFailureDetector(Set<String> excludedErrorTypes) {
        this.excludedErrorTypes = excludedErrorTypes == null
            ? Set.of()
            : excludedErrorTypes.stream().map(SystemFailureDetector::key).collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "System failure: generation of the dialogue ended on an error";
    }

    @Override
    public List<Finding> detect(Dialogue dialogue) {
        GenerationError error = dialogue.generationError().orElse(null);
        if (error == null || excludedErrorTypes.contains(key(error.errorType()))) {
            return List.of();
        }
        int truncatedAt = truncationPoint(dialogue);
        String type = error.errorType().isBlank() ? "unspecified error" : error.errorType();
        String explanation = error.message().isBlank()
            ? "Generation failed with " + type + " at turn " + truncatedAt
            : "Generation failed with " + type + " at turn " + truncatedAt + ": " + error.message();
        return List.of(Finding.atTurn(
            BreakdownType.SYSTEM_FAILURE,
            dialogue.id(),
            ID,
            truncatedAt,
            explanation,
            dialogue.intentPath(truncatedAt)
        ));
    }

    /**
     * Turn at which the transcript was cut: the recorded error turn, or the position right after the last turn.
     */
    static int truncationPoint(Dialogue dialogue) {
        return dialogue.generationError()
            .flatMap(GenerationError::turn)
            .orElse(dialogue.size());
    }

    private static String key(String errorType) {
        return errorType == null ? "" : errorType.trim().toLowerCase(Locale.ROOT);
    }
}
