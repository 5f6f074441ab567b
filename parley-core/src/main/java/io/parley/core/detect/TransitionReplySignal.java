package io.parley.core.detect;

import io.parley.core.flow.ActLabeling;
import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import io.parley.core.model.Turn;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Infers the answered turn from the interaction model alone.
 *
 * <p>A turn that is a legal successor of its predecessor answers the predecessor. Otherwise the
 * closest earlier turn of the other speaker, at most {@code lookBack} positions back, that the turn
 * legally follows is taken as the answered one.
 */
public final class TransitionReplySignal implements ReplySignal {
    public static final int DEFAULT_LOOK_BACK = 3;

    private final int lookBack;

    public TransitionReplySignal() {
        this(DEFAULT_LOOK_BACK);
    }

    public TransitionReplySignal(int lookBack) {
        this.lookBack = Math.max(2, lookBack);
    }

    @Override
    public OptionalInt answeredTurn(Dialogue dialogue, int turnIndex, InteractionModel model, ActLabeling labeling) {
        if (turnIndex == 0) {
            return OptionalInt.empty();
        }
        Turn current = dialogue.turn(turnIndex);
        Set<String> currentLabels = labeling.nodeLabels(current);
        if (ConversationFlowDetector.anyLegal(model, labeling.nodeLabels(dialogue.turn(turnIndex - 1)), currentLabels)) {
            return OptionalInt.of(turnIndex - 1);
        }
        int earliest = Math.max(0, turnIndex - lookBack);
        for (int j = turnIndex - 2; j >= earliest; j--) {
            Turn candidate = dialogue.turn(j);
            if (candidate.speaker() != current.speaker()
                && ConversationFlowDetector.anyLegal(model, labeling.nodeLabels(candidate), currentLabels)) {
                return OptionalInt.of(j);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String name() {
        return "transition";
    }
}
