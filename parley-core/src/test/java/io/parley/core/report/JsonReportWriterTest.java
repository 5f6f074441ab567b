package io.parley.core.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.detect.BreakdownType;
import io.parley.core.detect.Finding;
import io.parley.core.detect.SystemFailureDetector;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteReportAsJson() throws Exception {
        Map<String, List<Finding>> findings = new LinkedHashMap<>();
        findings.put("d3", List.of(Finding.atTurn(BreakdownType.SYSTEM_FAILURE, "d3", SystemFailureDetector.ID, 4,
            "Generation failed with KeyError at turn 4", List.of("U_request", "A_recommend"))));
        findings.put("d1", List.of());
        DetectionReport report = DetectionReport.build(
            Instant.parse("2026-01-01T00:00:00Z"),
            findings,
            List.of(SystemFailureDetector.ID),
            Duration.ofMillis(12),
            new BreakdownPatternAnalyzer()
        );
        Path path = tempDir.resolve("out/report.json");

        new JsonReportWriter().write(report, path);

        JsonNode json = new ObjectMapper().readTree(Files.readString(path));
        assertThat(json.path("generatedAt").asText()).isEqualTo("2026-01-01T00:00:00Z");
        JsonNode finding = json.path("findings").path("d3").get(0);
        assertThat(finding.path("type").asText()).isEqualTo("system_failure");
        assertThat(finding.path("toTurn").asInt()).isEqualTo(4);
        assertThat(finding.has("turnIndex")).isFalse();
        assertThat(json.path("findings").path("d1").isArray()).isTrue();
        assertThat(json.path("stats").path("findings").asInt()).isEqualTo(1);
        assertThat(json.path("stats").path("durationMs").asLong()).isEqualTo(12);
        assertThat(Files.exists(tempDir.resolve("out/report.json.tmp"))).isFalse();
    }
}
