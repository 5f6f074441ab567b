package io.parley.core.detect;

import io.parley.core.model.Dialogue;
import java.util.List;

/**
 * Detector that needs nothing besides the transcript.
 */
public interface DialogueDetector extends Detector {
    List<Finding> detect(Dialogue dialogue);
}
