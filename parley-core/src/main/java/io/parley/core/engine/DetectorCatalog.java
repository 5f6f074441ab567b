package io.parley.core.engine;

import io.parley.core.config.model.DetectionConfig;
import io.parley.core.detect.ConversationFlowDetector;
import io.parley.core.detect.DetectorRegistry;
import io.parley.core.detect.DialogueOfTheDeafDetector;
import io.parley.core.detect.ReplySignal;
import io.parley.core.detect.SystemFailureDetector;
import io.parley.core.flow.ActLabeling;
import io.parley.core.model.SpeakerRole;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Builds the registry of built-in detectors from configuration.
 */
public final class DetectorCatalog {

    private DetectorCatalog() {
    }

    public static DetectorRegistry defaults() {
        return create(DetectionConfig.defaults());
    }

    public static DetectorRegistry create(DetectionConfig config) {
        Set<SpeakerRole> speakers = EnumSet.noneOf(SpeakerRole.class);
        config.deaf().speakers().forEach(speaker -> speakers.add(SpeakerRole.parse(speaker)));

        return new DetectorRegistry()
            .register(new SystemFailureDetector(new HashSet<>(config.systemFailure().excludedErrorTypes())))
            .register(flowDetector(config))
            .register(new DialogueOfTheDeafDetector(speakers, new HashSet<>(config.deaf().loopErrorTypes())))
            .alias(ConversationFlowDetector.LEGACY_ID, ConversationFlowDetector.ID)
            .alias("deaf", DialogueOfTheDeafDetector.ID);
    }

    private static ConversationFlowDetector flowDetector(DetectionConfig config) {
        ReplySignal replySignal = ReplySignal.named(config.flow().replySignal(), config.flow().lookBack());
        if (DetectionConfig.AUTO_LABELING.equalsIgnoreCase(config.actLabeling().trim())) {
            return new ConversationFlowDetector(replySignal);
        }
        return new ConversationFlowDetector(ActLabeling.parse(config.actLabeling()), replySignal);
    }
}
