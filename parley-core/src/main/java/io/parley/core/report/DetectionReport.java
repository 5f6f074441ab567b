package io.parley.core.report;

import io.parley.core.detect.BreakdownType;
import io.parley.core.detect.Finding;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Findings of one detection run, keyed by dialogue id in batch order, with summary counts.
 * Immutable.
 */
public record DetectionReport(
    Instant generatedAt,
    List<String> detectors,
    Map<String, List<Finding>> findings,
    Map<BreakdownType, Integer> countsByType,
    Map<String, Integer> countsByDetector,
    Map<BreakdownType, List<PatternCount>> patterns,
    RunStats stats
) {

    public DetectionReport {
        detectors = detectors == null ? List.of() : List.copyOf(detectors);
        Map<String, List<Finding>> copy = new LinkedHashMap<>();
        if (findings != null) {
            findings.forEach((id, list) -> copy.put(id, List.copyOf(list)));
        }
        findings = Collections.unmodifiableMap(copy);
        countsByType = countsByType == null ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(countsByType));
        countsByDetector = countsByDetector == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(countsByDetector));
        patterns = patterns == null || patterns.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(patterns));
    }

    public static DetectionReport build(
        Instant generatedAt,
        Map<String, List<Finding>> findings,
        List<String> detectorIds,
        Duration duration,
        BreakdownPatternAnalyzer patternAnalyzer
    ) {
        Map<BreakdownType, Integer> byType = new EnumMap<>(BreakdownType.class);
        for (BreakdownType type : BreakdownType.values()) {
            byType.put(type, 0);
        }
        Map<String, Integer> byDetector = new LinkedHashMap<>();
        detectorIds.forEach(id -> byDetector.put(id, 0));

        List<Finding> all = new ArrayList<>();
        int withFindings = 0;
        for (List<Finding> dialogueFindings : findings.values()) {
            if (!dialogueFindings.isEmpty()) {
                withFindings++;
            }
            for (Finding finding : dialogueFindings) {
                all.add(finding);
                byType.merge(finding.type(), 1, Integer::sum);
                byDetector.merge(finding.detectorId(), 1, Integer::sum);
            }
        }

        RunStats stats = new RunStats(
            findings.size(),
            detectorIds.size(),
            all.size(),
            withFindings,
            duration.toMillis()
        );
        return new DetectionReport(
            generatedAt,
            detectorIds,
            findings,
            byType,
            byDetector,
            patternAnalyzer.analyze(all),
            stats
        );
    }

    public List<Finding> findingsFor(String dialogueId) {
        return findings.getOrDefault(dialogueId, List.of());
    }

    public int count(BreakdownType type) {
        return countsByType.getOrDefault(type, 0);
    }

    public List<Finding> allFindings() {
        List<Finding> all = new ArrayList<>();
        findings.values().forEach(all::addAll);
        return all;
    }
}
