package io.parley.core.report;

public record RunStats(int dialogues, int detectors, int findings, int dialoguesWithFindings, long durationMs) {
}
