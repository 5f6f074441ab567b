package io.parley.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Utterance(String text, SpeakerRole speaker, Map<String, String> slotValues) {

    public Utterance {
        Objects.requireNonNull(speaker, "speaker must not be null");
        text = text == null ? "" : text;
        slotValues = slotValues == null || slotValues.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(slotValues));
    }

    public static Utterance agent(String text) {
        return new Utterance(text, SpeakerRole.AGENT, Map.of());
    }

    public static Utterance user(String text) {
        return new Utterance(text, SpeakerRole.USER, Map.of());
    }
}
