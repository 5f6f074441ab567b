package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SystemFailureConfig(List<String> excludedErrorTypes) {

    public SystemFailureConfig {
        excludedErrorTypes = excludedErrorTypes == null ? List.of() : List.copyOf(excludedErrorTypes);
    }

    public static SystemFailureConfig defaults() {
        return new SystemFailureConfig(List.of("RecursionError"));
    }
}
