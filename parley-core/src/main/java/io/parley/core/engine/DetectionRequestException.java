package io.parley.core.engine;

/**
 * Raised before any detection runs when the request cannot be honoured.
 */
public class DetectionRequestException extends IllegalArgumentException {

    public DetectionRequestException(String message) {
        super(message);
    }
}
