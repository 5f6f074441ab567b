package io.parley.core.detect;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;

/**
 * A single breakdown observed in one dialogue.
 *
 * <p>{@code fromTurn}..{@code toTurn} is the turn range the breakdown spans; the finding is
 * anchored at {@code toTurn}. {@code intentPath} holds the speaker-prefixed intents leading to it.
 */
public record Finding(
    BreakdownType type,
    String dialogueId,
    String detectorId,
    int fromTurn,
    int toTurn,
    String explanation,
    List<String> intentPath
) {

    public Finding {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(dialogueId, "dialogueId must not be null");
        detectorId = detectorId == null ? "" : detectorId;
        if (fromTurn < 0 || toTurn < fromTurn) {
            throw new IllegalArgumentException("invalid turn range " + fromTurn + ".." + toTurn);
        }
        explanation = explanation == null ? "" : explanation;
        intentPath = intentPath == null ? List.of() : List.copyOf(intentPath);
    }

    public static Finding atTurn(
        BreakdownType type,
        String dialogueId,
        String detectorId,
        int turn,
        String explanation,
        List<String> intentPath
    ) {
        return new Finding(type, dialogueId, detectorId, turn, turn, explanation, intentPath);
    }

    public static Finding detectorError(String dialogueId, String detectorId, String message) {
        return new Finding(
            BreakdownType.DETECTOR_ERROR,
            dialogueId,
            detectorId,
            0,
            0,
            "Detector '" + detectorId + "' failed: " + message,
            List.of()
        );
    }

    @JsonIgnore
    public int turnIndex() {
        return toTurn;
    }

    @JsonIgnore
    public boolean isRange() {
        return fromTurn != toTurn;
    }

    @JsonIgnore
    public String location() {
        return isRange() ? fromTurn + "->" + toTurn : String.valueOf(toTurn);
    }
}
