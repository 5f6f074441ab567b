package io.parley.core.flow;

import io.parley.core.model.DialogueAct;
import io.parley.core.model.SpeakerRole;
import io.parley.core.model.Turn;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Maps the acts of a turn to interaction-model node labels.
 */
public enum ActLabeling {
    /** Act labels are used as they are, e.g. {@code recommend}. */
    PLAIN,
    /** Labels are prefixed with the speaker, e.g. {@code A_recommend}, as in recorded dialogue-flow graphs. */
    SPEAKER_PREFIXED;

    public Set<String> nodeLabels(Turn turn) {
        Set<String> labels = new LinkedHashSet<>();
        for (DialogueAct act : turn.acts()) {
            labels.add(this == PLAIN ? act.label() : turn.speaker().intentPrefix() + act.label());
        }
        return labels;
    }

    /**
     * {@link #SPEAKER_PREFIXED} when every node of the model carries a speaker prefix, otherwise {@link #PLAIN}.
     */
    public static ActLabeling infer(InteractionModel model) {
        if (model.nodes().isEmpty()) {
            return PLAIN;
        }
        for (String node : model.nodes()) {
            if (!hasSpeakerPrefix(node)) {
                return PLAIN;
            }
        }
        return SPEAKER_PREFIXED;
    }

    private static boolean hasSpeakerPrefix(String label) {
        for (SpeakerRole role : SpeakerRole.values()) {
            if (label.startsWith(role.intentPrefix())) {
                return true;
            }
        }
        return false;
    }

    public static ActLabeling parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.isEmpty()) {
            return PLAIN;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown act labeling: " + raw, e);
        }
    }
}
