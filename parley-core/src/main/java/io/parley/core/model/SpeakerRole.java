package io.parley.core.model;

import java.util.Locale;

public enum SpeakerRole {
    AGENT("A_"),
    USER("U_");

    private final String intentPrefix;

    SpeakerRole(String intentPrefix) {
        this.intentPrefix = intentPrefix;
    }

    /**
     * Prefix used when an act label is written into an intent path, e.g. {@code A_recommend}.
     */
    public String intentPrefix() {
        return intentPrefix;
    }

    public static SpeakerRole parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "agent", "assistant", "system" -> AGENT;
            case "user", "simulator" -> USER;
            default -> throw new IllegalArgumentException("Unknown speaker role: " + raw);
        };
    }
}
