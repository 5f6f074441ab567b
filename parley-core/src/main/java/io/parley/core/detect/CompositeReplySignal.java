package io.parley.core.detect;

import io.parley.core.flow.ActLabeling;
import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Asks each signal in order; the first one that answers wins.
 */
public final class CompositeReplySignal implements ReplySignal {
    private final List<ReplySignal> signals;

    public CompositeReplySignal(ReplySignal... signals) {
        this.signals = List.of(signals);
    }

    @Override
    public OptionalInt answeredTurn(Dialogue dialogue, int turnIndex, InteractionModel model, ActLabeling labeling) {
        for (ReplySignal signal : signals) {
            OptionalInt answered = signal.answeredTurn(dialogue, turnIndex, model, labeling);
            if (answered.isPresent()) {
                return answered;
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String name() {
        return signals.stream().map(ReplySignal::name).collect(Collectors.joining("+"));
    }
}
