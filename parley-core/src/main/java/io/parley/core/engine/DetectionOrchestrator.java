package io.parley.core.engine;

import io.parley.core.detect.BreakdownType;
import io.parley.core.detect.Detector;
import io.parley.core.detect.DetectorRegistry;
import io.parley.core.detect.DialogueDetector;
import io.parley.core.detect.Finding;
import io.parley.core.detect.ModelDetector;
import io.parley.core.flow.InteractionModel;
import io.parley.core.model.Dialogue;
import io.parley.core.report.BreakdownPatternAnalyzer;
import io.parley.core.report.DetectionReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the selected detectors over a batch of dialogues and aggregates the findings.
 *
 * <p>The orchestrator moves from {@link RunState#IDLE} to {@link RunState#RUNNING} when a valid
 * request arrives and to {@link RunState#COMPLETE} once every (dialogue, detector) pair has been
 * evaluated. Invalid requests are rejected before detection starts. A detector throwing on one
 * dialogue is recorded as a {@code detector_error} finding for that pair only.
 */
public final class DetectionOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final DetectorRegistry registry;
    private final BreakdownPatternAnalyzer patternAnalyzer;
    private final Clock clock;

    private RunState state = RunState.IDLE;
    private DetectionReport lastReport;

    public DetectionOrchestrator(DetectorRegistry registry) {
        this(registry, new BreakdownPatternAnalyzer(), Clock.systemUTC());
    }

    public DetectionOrchestrator(DetectorRegistry registry, BreakdownPatternAnalyzer patternAnalyzer, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.patternAnalyzer = Objects.requireNonNull(patternAnalyzer, "patternAnalyzer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized RunState state() {
        return state;
    }

    public synchronized Optional<DetectionReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public DetectionReport run(DetectionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<Detector> detectors = resolveDetectors(request);
        validateDialogues(request.dialogues());
        InteractionModel model = request.interactionModel();

        begin();
        try {
            Instant started = clock.instant();
            LOG.info("Running {} detector(s) over {} dialogue(s)", detectors.size(), request.dialogues().size());

            Map<String, List<Finding>> findings = new LinkedHashMap<>();
            for (Dialogue dialogue : request.dialogues()) {
                List<Finding> dialogueFindings = new ArrayList<>();
                for (Detector detector : detectors) {
                    dialogueFindings.addAll(evaluate(detector, dialogue, model));
                }
                dialogueFindings.sort(Comparator.comparingInt(Finding::turnIndex));
                findings.put(dialogue.id(), dialogueFindings);
            }

            Duration duration = Duration.between(started, clock.instant());
            DetectionReport report = DetectionReport.build(
                clock.instant(),
                findings,
                detectors.stream().map(Detector::id).toList(),
                duration,
                patternAnalyzer
            );
            LOG.info("Detection complete: {} finding(s) in {} dialogue(s), {} detector error(s), {}ms",
                report.stats().findings(), report.stats().dialogues(),
                report.count(BreakdownType.DETECTOR_ERROR), duration.toMillis());
            complete(report);
            return report;
        } catch (RuntimeException e) {
            reset();
            throw e;
        }
    }

    private List<Finding> evaluate(Detector detector, Dialogue dialogue, InteractionModel model) {
        try {
            List<Finding> produced;
            if (detector instanceof ModelDetector modelDetector) {
                produced = modelDetector.detect(dialogue, model);
            } else if (detector instanceof DialogueDetector dialogueDetector) {
                produced = dialogueDetector.detect(dialogue);
            } else {
                throw new IllegalStateException("Detector " + detector.id() + " implements no detection capability");
            }
            if (produced == null) {
                produced = List.of();
            }
            LOG.debug("{} found {} breakdown(s) in dialogue {}", detector.id(), produced.size(), dialogue.id());
            return produced;
        } catch (RuntimeException e) {
            LOG.warn("Detector {} failed on dialogue {}", detector.id(), dialogue.id(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return List.of(Finding.detectorError(dialogue.id(), detector.id(), message));
        }
    }

    private List<Detector> resolveDetectors(DetectionRequest request) {
        List<Detector> detectors = new ArrayList<>();
        if (request.detectorIds().isEmpty()) {
            detectors.addAll(registry.all());
        } else {
            List<String> unknown = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (String id : request.detectorIds()) {
                Optional<Detector> detector = registry.find(id);
                if (detector.isEmpty()) {
                    unknown.add(id);
                } else if (seen.add(detector.get().id())) {
                    detectors.add(detector.get());
                }
            }
            if (!unknown.isEmpty()) {
                throw new DetectionRequestException("Unknown breakdown detector(s): " + String.join(", ", unknown));
            }
        }
        if (detectors.isEmpty()) {
            throw new DetectionRequestException("No breakdown detector selected");
        }
        if (request.interactionModel() == null) {
            List<String> needModel = detectors.stream()
                .filter(ModelDetector.class::isInstance)
                .map(Detector::id)
                .toList();
            if (!needModel.isEmpty()) {
                throw new DetectionRequestException(
                    "An interaction model is required by: " + String.join(", ", needModel));
            }
        }
        return detectors;
    }

    private void validateDialogues(List<Dialogue> dialogues) {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < dialogues.size(); i++) {
            Dialogue dialogue = dialogues.get(i);
            if (dialogue == null) {
                throw new DetectionRequestException("Dialogue at position " + i + " is missing");
            }
            if (!ids.add(dialogue.id())) {
                throw new DetectionRequestException("Duplicate dialogue id: " + dialogue.id());
            }
        }
    }

    private synchronized void begin() {
        if (state == RunState.RUNNING) {
            throw new IllegalStateException("A detection run is already in progress");
        }
        state = RunState.RUNNING;
    }

    private synchronized void complete(DetectionReport report) {
        lastReport = report;
        state = RunState.COMPLETE;
    }

    private synchronized void reset() {
        state = lastReport == null ? RunState.IDLE : RunState.COMPLETE;
    }
}
