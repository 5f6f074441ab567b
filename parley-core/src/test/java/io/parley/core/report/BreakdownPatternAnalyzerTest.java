package io.parley.core.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.parley.core.detect.BreakdownType;
import io.parley.core.detect.Finding;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BreakdownPatternAnalyzerTest {

    @Test
    void shouldCountIntentSequencesEndingAtBreakdowns() {
        List<Finding> findings = List.of(
            transition("d1", List.of("U_request", "A_elicit", "U_inform")),
            transition("d2", List.of("A_greet", "U_request", "A_elicit", "U_inform")),
            transition("d3", List.of("U_chitchat", "A_recommend")),
            Finding.detectorError("d4", "failing", "boom")
        );

        Map<BreakdownType, List<PatternCount>> patterns = new BreakdownPatternAnalyzer().analyze(findings);

        assertThat(patterns).containsOnlyKeys(BreakdownType.UNEXPECTED_TRANSITION);
        assertThat(patterns.get(BreakdownType.UNEXPECTED_TRANSITION))
            .extracting(PatternCount::pattern, PatternCount::count)
            .containsExactly(
                tuple("A_elicit U_inform", 2),
                tuple("U_request A_elicit U_inform", 2),
                tuple("U_chitchat A_recommend", 1)
            );
    }

    @Test
    void shouldLimitPatternLength() {
        List<Finding> findings = List.of(transition("d1", List.of("U_request", "A_elicit", "U_inform")));

        assertThat(new BreakdownPatternAnalyzer(2).analyze(findings).get(BreakdownType.UNEXPECTED_TRANSITION))
            .extracting(PatternCount::intents)
            .containsExactly(List.of("A_elicit", "U_inform"));
        assertThatThrownBy(() -> new BreakdownPatternAnalyzer(1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSkipPathsTooShortForPattern() {
        List<Finding> findings = List.of(transition("d1", List.of("U_request")));

        assertThat(new BreakdownPatternAnalyzer().analyze(findings)).isEmpty();
    }

    private static Finding transition(String dialogueId, List<String> path) {
        int turn = Math.max(1, path.size() - 1);
        return new Finding(BreakdownType.UNEXPECTED_TRANSITION, dialogueId, "conversation_flow",
            turn - 1, turn, "test", path);
    }
}
