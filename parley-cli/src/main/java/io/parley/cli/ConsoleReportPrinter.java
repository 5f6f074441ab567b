package io.parley.cli;

import io.parley.core.detect.BreakdownType;
import io.parley.core.detect.Finding;
import io.parley.core.report.DetectionReport;
import io.parley.core.report.PatternCount;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Human-readable rendering of a detection report.
 */
final class ConsoleReportPrinter {
    private final PrintStream out;

    ConsoleReportPrinter(PrintStream out) {
        this.out = out;
    }

    void print(DetectionReport report) {
        out.println("Detectors: " + String.join(", ", report.detectors()));
        out.println("Dialogues analysed: " + report.stats().dialogues()
            + " (" + report.stats().dialoguesWithFindings() + " with breakdowns)");
        out.println();

        for (Map.Entry<String, List<Finding>> entry : report.findings().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            out.println("Dialogue " + entry.getKey());
            for (Finding finding : entry.getValue()) {
                out.printf("  turn %-7s %-22s %s%n", finding.location(), finding.type().id(), finding.explanation());
            }
        }

        out.println();
        out.println("Breakdowns by type:");
        for (BreakdownType type : BreakdownType.values()) {
            int count = report.count(type);
            if (count > 0 || type != BreakdownType.DETECTOR_ERROR) {
                out.printf("  %-22s %d%n", type.id(), count);
            }
        }

        if (!report.patterns().isEmpty()) {
            out.println();
            out.println("Conversational patterns:");
            report.patterns().forEach((type, patterns) -> {
                out.println("  " + type.id());
                for (PatternCount pattern : patterns) {
                    out.printf("    %3d  %s%n", pattern.count(), pattern.pattern());
                }
            });
        }
        out.println();
        out.println("Total findings: " + report.stats().findings() + " in " + report.stats().durationMs() + "ms");
    }
}
