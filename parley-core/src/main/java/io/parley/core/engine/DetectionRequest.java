package io.parley.core.engine;

import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One batch to analyse. An empty detector list selects every registered detector.
 * Missing dialogues are kept in place so the orchestrator can report their position.
 */
public record DetectionRequest(
    List<Dialogue> dialogues,
    List<String> detectorIds,
    InteractionModel interactionModel
) {

    public DetectionRequest {
        dialogues = dialogues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dialogues));
        detectorIds = detectorIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(detectorIds));
    }

    public static DetectionRequest of(List<Dialogue> dialogues, List<String> detectorIds) {
        return new DetectionRequest(dialogues, detectorIds, null);
    }
}
