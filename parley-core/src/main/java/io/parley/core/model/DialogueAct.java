package io.parley.core.model;

public record DialogueAct(String label) {

    public DialogueAct {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("dialogue act label must not be blank");
        }
        label = label.trim();
    }

    public static DialogueAct of(String label) {
        return new DialogueAct(label);
    }

    @Override
    public String toString() {
        return label;
    }
}
