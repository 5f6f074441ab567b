package io.parley.core.detect;

import io.parley.core.model.Dialogue;
import io.parley.core.model.GenerationError;
import io.parley.core.model.SpeakerRole;
import io.parley.core.model.Turn;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects a speaker repeating itself: consecutive turns of the same speaker with the same text
 * and the same set of dialogue acts. Such repetition is a policy pitfall the agent cannot escape.
 *
 * <p>Text is compared after trimming, collapsing whitespace runs to one space and lower-casing.
 * Act sets are compared regardless of order. A run of k identical turns yields k - 1 findings, each
 * anchored at the later turn of its pair.
 */
public final class DialogueOfTheDeafDetector implements DialogueDetector {
    public static final String ID = "dialogue_of_the_deaf";
    public static final Set<String> DEFAULT_LOOP_ERROR_TYPES = Set.of("RecursionError");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Set<SpeakerRole> speakers;
    private final Set<String> loopErrorTypes;

    public DialogueOfTheDeafDetector() {
        this(EnumSet.of(SpeakerRole.AGENT), DEFAULT_LOOP_ERROR_TYPES);
    }

    public DialogueOfTheDeafDetector(Set<SpeakerRole> speakers, Set<String> loopErrorTypes) {
        if (speakers == null || speakers.isEmpty()) {
            throw new IllegalArgumentException("at least one speaker role must be checked");
        }
        this.speakers = Set.copyOf(speakers);
        this.loopErrorTypes = loopErrorTypes == null
            ? Set.of()
            : loopErrorTypes.stream().map(type -> type.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Dialogue of the deaf: the same utterance and acts repeated on consecutive turns";
    }

    @Override
    public List<Finding> detect(Dialogue dialogue) {
        List<Finding> findings = new ArrayList<>();
        for (SpeakerRole speaker : speakers) {
            List<Turn> own = dialogue.turnsBy(speaker);
            for (int i = 1; i < own.size(); i++) {
                Turn previous = own.get(i - 1);
                Turn current = own.get(i);
                if (repeats(previous, current)) {
                    findings.add(new Finding(
                        BreakdownType.DIALOGUE_OF_THE_DEAF,
                        dialogue.id(),
                        ID,
                        previous.index(),
                        current.index(),
                        speaker.name().toLowerCase(Locale.ROOT) + " repeated turn " + previous.index()
                            + " at turn " + current.index() + ": \"" + current.text().trim() + "\" " + current.actLabels(),
                        dialogue.intentPath(current.index())
                    ));
                }
            }
        }
        loopFinding(dialogue).ifPresent(findings::add);
        findings.sort(Comparator.comparingInt(Finding::toTurn));
        return findings;
    }

    private Optional<Finding> loopFinding(Dialogue dialogue) {
        GenerationError error = dialogue.generationError().orElse(null);
        if (error == null || !loopErrorTypes.contains(error.errorType().toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        int truncatedAt = SystemFailureDetector.truncationPoint(dialogue);
        return Optional.of(Finding.atTurn(
            BreakdownType.DIALOGUE_OF_THE_DEAF,
            dialogue.id(),
            ID,
            truncatedAt,
            "Generation aborted in a loop (" + error.errorType() + ") at turn " + truncatedAt,
            dialogue.intentPath(truncatedAt)
        ));
    }

    private boolean repeats(Turn previous, Turn current) {
        return normalize(previous.text()).equals(normalize(current.text()))
            && previous.actLabels().equals(current.actLabels());
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
