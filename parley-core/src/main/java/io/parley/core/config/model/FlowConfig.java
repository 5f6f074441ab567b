package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowConfig(String replySignal, int lookBack) {

    public FlowConfig {
        replySignal = replySignal == null || replySignal.isBlank() ? "auto" : replySignal;
        lookBack = Math.max(2, lookBack);
    }

    public static FlowConfig defaults() {
        return new FlowConfig("auto", 3);
    }
}
