package io.parley.core.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * An intent sequence that led to breakdowns, with the number of breakdowns it preceded.
 */
public record PatternCount(List<String> intents, int count) {

    public PatternCount {
        intents = intents == null ? List.of() : List.copyOf(intents);
    }

    @JsonIgnore
    public String pattern() {
        return String.join(" ", intents);
    }
}
