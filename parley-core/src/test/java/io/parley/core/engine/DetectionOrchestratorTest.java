package io.parley.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.parley.core.detect.BreakdownType;
import io.parley.core.detect.ConversationFlowDetector;
import io.parley.core.detect.DetectorRegistry;
import io.parley.core.detect.DialogueDetector;
import io.parley.core.detect.DialogueOfTheDeafDetector;
import io.parley.core.detect.Finding;
import io.parley.core.detect.SystemFailureDetector;
import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import io.parley.core.model.GenerationError;
import io.parley.core.model.Turn;
import io.parley.core.report.BreakdownPatternAnalyzer;
import io.parley.core.report.DetectionReport;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DetectionOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final InteractionModel model = InteractionModel.builder()
        .edge("request", "elicit")
        .edge("elicit", "inform")
        .edge("inform", "recommend")
        .build();

    @Test
    void shouldRunAllRegisteredDetectorsWhenNoneSelected() {
        DetectionOrchestrator orchestrator = orchestrator(DetectorCatalog.defaults());
        Dialogue loop = new Dialogue("loop", List.of(
            Turn.user(0, "Recommend me a movie", "request"),
            Turn.agent(1, "Sorry?", "clarify"),
            Turn.agent(2, "Sorry?", "clarify")
        ), GenerationError.atTurn("KeyError", 3));

        DetectionReport report = orchestrator.run(new DetectionRequest(List.of(loop), List.of(), model));

        assertThat(report.detectors()).containsExactly(
            SystemFailureDetector.ID, ConversationFlowDetector.ID, DialogueOfTheDeafDetector.ID);
        assertThat(report.findingsFor("loop"))
            .extracting(Finding::type)
            .containsExactly(
                BreakdownType.UNEXPECTED_TRANSITION,
                BreakdownType.UNEXPECTED_TRANSITION,
                BreakdownType.DIALOGUE_OF_THE_DEAF,
                BreakdownType.SYSTEM_FAILURE);
        assertThat(report.findingsFor("loop"))
            .extracting(Finding::turnIndex)
            .isSorted();
        assertThat(report.count(BreakdownType.UNEXPECTED_TRANSITION)).isEqualTo(2);
        assertThat(report.countsByDetector()).containsEntry(SystemFailureDetector.ID, 1);
        assertThat(report.stats().dialoguesWithFindings()).isEqualTo(1);
        assertThat(orchestrator.state()).isEqualTo(RunState.COMPLETE);
        assertThat(orchestrator.lastReport()).contains(report);
    }

    @Test
    void shouldRejectUnknownDetectorBeforeRunning() {
        DetectionOrchestrator orchestrator = orchestrator(DetectorCatalog.defaults());

        assertThatThrownBy(() -> orchestrator.run(DetectionRequest.of(List.of(clean("d1")), List.of("bogus"))))
            .isInstanceOf(DetectionRequestException.class)
            .hasMessageContaining("bogus");
        assertThat(orchestrator.state()).isEqualTo(RunState.IDLE);
    }

    @Test
    void shouldRequireModelForFlowDetection() {
        DetectionOrchestrator orchestrator = orchestrator(DetectorCatalog.defaults());

        assertThatThrownBy(() -> orchestrator.run(DetectionRequest.of(List.of(clean("d1")), List.of("conversation_flow"))))
            .isInstanceOf(DetectionRequestException.class)
            .hasMessageContaining("interaction model");
        assertThat(orchestrator.lastReport()).isEmpty();
    }

    @Test
    void shouldRejectDuplicateDialogueIds() {
        DetectionOrchestrator orchestrator = orchestrator(DetectorCatalog.defaults());

        assertThatThrownBy(() -> orchestrator.run(
            DetectionRequest.of(List.of(clean("d1"), clean("d1")), List.of(SystemFailureDetector.ID))))
            .isInstanceOf(DetectionRequestException.class)
            .hasMessageContaining("Duplicate dialogue id: d1");
    }

    @Test
    void shouldIsolateFailingDetector() {
        DetectorRegistry registry = new DetectorRegistry()
            .register(new FailingDetector("broken-one"))
            .register(new SystemFailureDetector());
        Dialogue failed = new Dialogue("failed", clean("x").turns(), GenerationError.atTurn("KeyError", 1));

        DetectionReport report = orchestrator(registry).run(
            DetectionRequest.of(List.of(clean("broken-one"), failed), List.of()));

        assertThat(report.findingsFor("broken-one")).singleElement().satisfies(finding -> {
            assertThat(finding.type()).isEqualTo(BreakdownType.DETECTOR_ERROR);
            assertThat(finding.detectorId()).isEqualTo("failing");
            assertThat(finding.explanation()).contains("boom");
        });
        assertThat(report.findingsFor("failed"))
            .extracting(Finding::type)
            .containsExactly(BreakdownType.SYSTEM_FAILURE);
        assertThat(report.count(BreakdownType.DETECTOR_ERROR)).isEqualTo(1);
    }

    @Test
    void shouldProduceSameFindingsOnRepeatedRuns() {
        DetectionOrchestrator orchestrator = orchestrator(DetectorCatalog.defaults());
        DetectionRequest request = new DetectionRequest(List.of(
            new Dialogue("d2", List.of(Turn.user(0, "Recommend me a movie", "request"), Turn.agent(1, "Airplane!", "recommend"))),
            clean("d1")
        ), List.of(), model);

        DetectionReport first = orchestrator.run(request);
        DetectionReport second = orchestrator.run(request);

        assertThat(second.findings()).isEqualTo(first.findings());
        assertThat(second.findings().keySet()).containsExactly("d2", "d1");
        assertThat(second.findingsFor("d1")).isEmpty();
    }

    @Test
    void shouldReportEmptyBatch() {
        DetectionReport report = orchestrator(DetectorCatalog.defaults())
            .run(DetectionRequest.of(List.of(), List.of(SystemFailureDetector.ID, "deaf", "deaf")));

        assertThat(report.detectors()).containsExactly(SystemFailureDetector.ID, DialogueOfTheDeafDetector.ID);
        assertThat(report.stats().dialogues()).isZero();
        assertThat(report.allFindings()).isEmpty();
        assertThat(report.count(BreakdownType.SYSTEM_FAILURE)).isZero();
    }

    @Test
    void shouldRejectMissingDialogueWithItsPosition() {
        DetectionOrchestrator orchestrator = orchestrator(DetectorCatalog.defaults());
        DetectionRequest request = DetectionRequest.of(Arrays.asList(clean("d1"), null), List.of(SystemFailureDetector.ID));

        assertThatThrownBy(() -> orchestrator.run(request))
            .isInstanceOf(DetectionRequestException.class)
            .hasMessage("Dialogue at position 1 is missing");
        assertThat(orchestrator.state()).isEqualTo(RunState.IDLE);
    }

    @Test
    void shouldTreatNullDetectorResultAsNoFindings() {
        DetectorRegistry registry = new DetectorRegistry().register(new SilentDetector());

        DetectionReport report = orchestrator(registry).run(DetectionRequest.of(List.of(clean("d1")), List.of()));

        assertThat(report.findingsFor("d1")).isEmpty();
        assertThat(report.count(BreakdownType.DETECTOR_ERROR)).isZero();
    }

    private static DetectionOrchestrator orchestrator(DetectorRegistry registry) {
        return new DetectionOrchestrator(registry, new BreakdownPatternAnalyzer(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Dialogue clean(String id) {
        return new Dialogue(id, List.of(
            Turn.user(0, "Recommend me a movie", "request"),
            Turn.agent(1, "Which genre?", "elicit")
        ));
    }

    private static final class SilentDetector implements DialogueDetector {

        @Override
        public String id() {
            return "silent";
        }

        @Override
        public String description() {
            return "Returns no result list";
        }

        @Override
        public List<Finding> detect(Dialogue dialogue) {
            return null;
        }
    }

    private static final class FailingDetector implements DialogueDetector {
        private final String failOn;

        private FailingDetector(String failOn) {
            this.failOn = failOn;
        }

        @Override
        public String id() {
            return "failing";
        }

        @Override
        public String description() {
            return "Throws on one dialogue";
        }

        @Override
        public List<Finding> detect(Dialogue dialogue) {
            if (dialogue.id().equals(failOn)) {
                throw new IllegalStateException("boom");
            }
            return List.of();
        }
    }
}
