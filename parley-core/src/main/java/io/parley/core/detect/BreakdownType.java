package io.parley.core.detect;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BreakdownType {
    SYSTEM_FAILURE("system_failure"),
    DIALOGUE_OF_THE_DEAF("dialogue_of_the_deaf"),
    UNEXPECTED_TRANSITION("unexpected_transition"),
    DELAYED_REPLY("delayed_reply"),
    DETECTOR_ERROR("detector_error");

    private final String id;

    BreakdownType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
