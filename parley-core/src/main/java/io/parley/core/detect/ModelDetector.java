package io.parley.core.detect;

import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import java.util.List;

/**
 * Detector that checks the transcript against an interaction model.
 */
public interface ModelDetector extends Detector {
    List<Finding> detect(Dialogue dialogue, InteractionModel model);
}
