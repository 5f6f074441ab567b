package io.parley.core.report;

import io.parley.core.detect.BreakdownType;
import io.parley.core.detect.Finding;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds problematic conversational patterns: the intent n-grams (length 2 to {@code maxLength})
 * that end at a breakdown, counted per breakdown type.
 */
public final class BreakdownPatternAnalyzer {
    public static final int DEFAULT_MAX_LENGTH = 3;

    private final int maxLength;

    public BreakdownPatternAnalyzer() {
        this(DEFAULT_MAX_LENGTH);
    }

    public BreakdownPatternAnalyzer(int maxLength) {
        if (maxLength < 2) {
            throw new IllegalArgumentException("pattern length must be at least 2, got " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public Map<BreakdownType, List<PatternCount>> analyze(Collection<Finding> findings) {
        Map<BreakdownType, Map<List<String>, Integer>> counts = new EnumMap<>(BreakdownType.class);
        for (Finding finding : findings) {
            if (finding.type() == BreakdownType.DETECTOR_ERROR) {
                continue;
            }
            List<String> path = finding.intentPath();
            Map<List<String>, Integer> byPattern = counts.computeIfAbsent(finding.type(), k -> new HashMap<>());
            for (int length = 2; length <= Math.min(maxLength, path.size()); length++) {
                List<String> tail = List.copyOf(path.subList(path.size() - length, path.size()));
                byPattern.merge(tail, 1, Integer::sum);
            }
        }

        Map<BreakdownType, List<PatternCount>> result = new EnumMap<>(BreakdownType.class);
        counts.forEach((type, byPattern) -> {
            List<PatternCount> patterns = new ArrayList<>();
            byPattern.forEach((intents, count) -> patterns.add(new PatternCount(intents, count)));
            patterns.sort(Comparator.comparingInt(PatternCount::count).reversed()
                .thenComparing(PatternCount::pattern));
            if (!patterns.isEmpty()) {
                result.put(type, List.copyOf(patterns));
            }
        });
        return result;
    }
}
