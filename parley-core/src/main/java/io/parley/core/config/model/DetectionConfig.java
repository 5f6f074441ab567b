package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DetectionConfig(
    List<String> detectors,
    String actLabeling,
    int patternLength,
    DeafConfig deaf,
    FlowConfig flow,
    SystemFailureConfig systemFailure
) {
    public static final String AUTO_LABELING = "auto";

    public DetectionConfig {
        detectors = detectors == null ? List.of() : List.copyOf(detectors);
        actLabeling = actLabeling == null || actLabeling.isBlank() ? AUTO_LABELING : actLabeling;
        patternLength = Math.max(2, patternLength);
        deaf = deaf == null ? DeafConfig.defaults() : deaf;
        flow = flow == null ? FlowConfig.defaults() : flow;
        systemFailure = systemFailure == null ? SystemFailureConfig.defaults() : systemFailure;
    }

    public static DetectionConfig defaults() {
        return new DetectionConfig(
            List.of("system_failure", "conversation_flow", "dialogue_of_the_deaf"),
            AUTO_LABELING,
            3,
            DeafConfig.defaults(),
            FlowConfig.defaults(),
            SystemFailureConfig.defaults()
        );
    }
}
