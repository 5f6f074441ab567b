package io.parley.core.io;

public class DialogueFormatException extends IllegalArgumentException {

    public DialogueFormatException(String message) {
        super(message);
    }

    public DialogueFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
