package io.parley.core.flow;

public class InteractionModelException extends IllegalArgumentException {

    public InteractionModelException(String message) {
        super(message);
    }

    public InteractionModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
