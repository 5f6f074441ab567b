package io.parley.core.detect;

import io.parley.core.flow.ActLabeling;
import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import io.parley.core.model.Turn;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Detects flow discontinuation: replies that hurt the naturalness of the conversation.
 *
 * <p>Two kinds are reported for each turn boundary, in this order:
 * <ul>
 *   <li>unexpected transition, when no act of the previous turn may be followed by any act of the
 *   current turn according to the interaction model (one finding per boundary);</li>
 *   <li>delayed reply, when the {@link ReplySignal} says the current turn answers a turn at least
 *   two positions back.</li>
 * </ul>
 * Acts missing from the model have no edges, so transitions through them are always unexpected.
 * Without a fixed {@link ActLabeling} the labeling is inferred from the model's node names.
 */
public final class ConversationFlowDetector implements ModelDetector {
    public static final String ID = "conversation_flow";
    public static final String LEGACY_ID = "flow_discontinuation";

    private final ActLabeling labeling;
    private final ReplySignal replySignal;

    public ConversationFlowDetector() {
        this(ReplySignal.named("auto", TransitionReplySignal.DEFAULT_LOOK_BACK));
    }

    public ConversationFlowDetector(ReplySignal replySignal) {
        this.labeling = null;
        this.replySignal = Objects.requireNonNull(replySignal, "replySignal must not be null");
    }

    public ConversationFlowDetector(ActLabeling labeling, ReplySignal replySignal) {
        this.labeling = Objects.requireNonNull(labeling, "labeling must not be null");
        this.replySignal = Objects.requireNonNull(replySignal, "replySignal must not be null");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Flow discontinuation: unexpected act transitions and delayed replies";
    }

    @Override
    public List<Finding> detect(Dialogue dialogue, InteractionModel model) {
        Objects.requireNonNull(model, "interaction model must not be null");
        ActLabeling labeling = this.labeling == null ? ActLabeling.infer(model) : this.labeling;
        List<Finding> findings = new ArrayList<>();
        for (int i = 1; i < dialogue.size(); i++) {
            Turn previous = dialogue.turn(i - 1);
            Turn current = dialogue.turn(i);
            Set<String> from = labeling.nodeLabels(previous);
            Set<String> to = labeling.nodeLabels(current);

            if (!anyLegal(model, from, to)) {
                findings.add(new Finding(
                    BreakdownType.UNEXPECTED_TRANSITION,
                    dialogue.id(),
                    ID,
                    i - 1,
                    i,
                    "No legal transition " + from + " -> " + to + describeUnknown(model, from, to),
                    dialogue.intentPath(i)
                ));
            }

            OptionalInt answered = replySignal.answeredTurn(dialogue, i, model, labeling);
            if (answered.isPresent() && answered.getAsInt() <= i - 2) {
                int target = answered.getAsInt();
                findings.add(new Finding(
                    BreakdownType.DELAYED_REPLY,
                    dialogue.id(),
                    ID,
                    target,
                    i,
                    "Turn " + i + " " + to + " replies to turn " + target + " " + labeling.nodeLabels(dialogue.turn(target))
                        + " instead of turn " + (i - 1) + " " + from + " (" + replySignal.name() + ")",
                    dialogue.intentPath(i)
                ));
            }
        }
        return findings;
    }

    static boolean anyLegal(InteractionModel model, Set<String> from, Set<String> to) {
        for (String previous : from) {
            for (String next : to) {
                if (model.isLegal(previous, next)) {
                    return true;
                }
            }
        }
        return false;
    }

    private String describeUnknown(InteractionModel model, Set<String> from, Set<String> to) {
        List<String> unknown = new ArrayList<>();
        for (String label : from) {
            if (!model.contains(label)) {
                unknown.add(label);
            }
        }
        for (String label : to) {
            if (!model.contains(label) && !unknown.contains(label)) {
                unknown.add(label);
            }
        }
        return unknown.isEmpty() ? "" : " (acts not in model: " + String.join(", ", unknown) + ")";
    }
}
