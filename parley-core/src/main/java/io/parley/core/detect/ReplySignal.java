package io.parley.core.detect;

import io.parley.core.flow.ActLabeling;
import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Tells which earlier turn a turn answers. Used to spot delayed replies.
 */
public interface ReplySignal {

    /**
     * Index of the turn that {@code turnIndex} replies to, or empty when the signal cannot tell.
     */
    OptionalInt answeredTurn(Dialogue dialogue, int turnIndex, InteractionModel model, ActLabeling labeling);

    default String name() {
        return getClass().getSimpleName();
    }

    static ReplySignal none() {
        return new ReplySignal() {
            @Override
            public OptionalInt answeredTurn(Dialogue dialogue, int turnIndex, InteractionModel model, ActLabeling labeling) {
                return OptionalInt.empty();
            }

            @Override
            public String name() {
                return "none";
            }
        };
    }

    /**
     * Resolves a configured signal name: {@code auto}, {@code annotation}, {@code transition} or {@code none}.
     */
    static ReplySignal named(String name, int lookBack) {
        String normalized = name == null ? "auto" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", "auto" -> new CompositeReplySignal(new AnnotatedReplySignal(), new TransitionReplySignal(lookBack));
            case "annotation" -> new AnnotatedReplySignal();
            case "transition" -> new TransitionReplySignal(lookBack);
            case "none" -> none();
            default -> throw new IllegalArgumentException("Unknown reply signal: " + name);
        };
    }
}
