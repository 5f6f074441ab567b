package io.parley.core.detect;

/**
 * A breakdown detection component.
 *
 * <p>Concrete detectors implement one of the two capabilities, {@link DialogueDetector} or
 * {@link ModelDetector}. Implementations keep no state between invocations.
 */
public interface Detector {
    String id();

    String description();
}
