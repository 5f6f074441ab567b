package io.parley.core.model;

import java.util.Optional;

/**
 * Error recorded while the agent or the simulator produced a dialogue.
 */
public record GenerationError(String errorType, String message, Integer turnIndex) {

    public GenerationError {
        errorType = errorType == null ? "" : errorType.trim();
        message = message == null ? "" : message;
        if (turnIndex != null && turnIndex < 0) {
            throw new IllegalArgumentException("error turn index must not be negative: " + turnIndex);
        }
    }

    public static GenerationError of(String errorType, String message) {
        return new GenerationError(errorType, message, null);
    }

    public static GenerationError atTurn(String errorType, int turnIndex) {
        return new GenerationError(errorType, "", turnIndex);
    }

    public Optional<Integer> turn() {
        return Optional.ofNullable(turnIndex);
    }
}
