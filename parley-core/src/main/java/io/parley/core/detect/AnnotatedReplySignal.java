package io.parley.core.detect;

import io.parley.core.flow.ActLabeling;
import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import java.util.OptionalInt;

/**
 * Reads the explicit {@code reply_to} annotation of a turn.
 */
public final class AnnotatedReplySignal implements ReplySignal {

    @Override
    public OptionalInt answeredTurn(Dialogue dialogue, int turnIndex, InteractionModel model, ActLabeling labeling) {
        return dialogue.turn(turnIndex).replyToIndex()
            .map(OptionalInt::of)
            .orElse(OptionalInt.empty());
    }

    @Override
    public String name() {
        return "annotation";
    }
}
