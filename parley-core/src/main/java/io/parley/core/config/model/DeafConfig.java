package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DeafConfig(List<String> speakers, List<String> loopErrorTypes) {

    public DeafConfig {
        speakers = speakers == null || speakers.isEmpty() ? List.of("agent") : List.copyOf(speakers);
        loopErrorTypes = loopErrorTypes == null ? List.of() : List.copyOf(loopErrorTypes);
    }

    public static DeafConfig defaults() {
        return new DeafConfig(List.of("agent"), List.of("RecursionError"));
    }
}
