package io.parley.core.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One utterance and the dialogue acts annotated on it, at a fixed position in the transcript.
 *
 * <p>{@code replyTo} is the optional annotation naming the earlier turn this one answers.
 */
public record Turn(int index, Utterance utterance, List<DialogueAct> acts, Integer replyTo) {

    public Turn {
        Objects.requireNonNull(utterance, "utterance must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("turn index must not be negative: " + index);
        }
        if (acts == null || acts.isEmpty()) {
            throw new IllegalArgumentException("turn " + index + " must carry at least one dialogue act");
        }
        acts = List.copyOf(acts);
        if (replyTo != null && (replyTo < 0 || replyTo >= index)) {
            throw new IllegalArgumentException("turn " + index + " cannot reply to turn " + replyTo);
        }
    }

    public Turn(int index, Utterance utterance, List<DialogueAct> acts) {
        this(index, utterance, acts, null);
    }

    public static Turn agent(int index, String text, String... acts) {
        return new Turn(index, Utterance.agent(text), toActs(acts));
    }

    public static Turn user(int index, String text, String... acts) {
        return new Turn(index, Utterance.user(text), toActs(acts));
    }

    public SpeakerRole speaker() {
        return utterance.speaker();
    }

    public String text() {
        return utterance.text();
    }

    public Optional<Integer> replyToIndex() {
        return Optional.ofNullable(replyTo);
    }

    public Set<String> actLabels() {
        Set<String> labels = new LinkedHashSet<>();
        for (DialogueAct act : acts) {
            labels.add(act.label());
        }
        return labels;
    }

    public List<String> intentPathEntries() {
        return acts.stream()
            .map(act -> speaker().intentPrefix() + act.label())
            .toList();
    }

    private static List<DialogueAct> toActs(String... labels) {
        return Arrays.stream(labels).map(DialogueAct::of).toList();
    }
}
