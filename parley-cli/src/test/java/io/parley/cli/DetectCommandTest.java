package io.parley.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class DetectCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private Path dialogues;
    private Path model;

    @BeforeEach
    void setUp() throws Exception {
        dialogues = tempDir.resolve("dialogues.json");
        Files.writeString(dialogues, """
            [
              {"conversation_id": "d1", "conversation": [
                {"participant": "agent", "utterance": "Sorry, I didn't understand", "intent": "clarify"},
                {"participant": "agent", "utterance": "Sorry, I didn't understand", "intent": "clarify"},
                {"participant": "simulator", "utterance": "ok", "intent": "inform"}
              ]},
              {"conversation_id": "d2", "conversation": [
                {"participant": "simulator", "utterance": "Recommend me a movie", "intent": "request"},
                {"participant": "agent", "utterance": "Try Airplane!", "intent": "recommend"}
              ]},
              {"conversation_id": "d3", "conversation": [
                {"participant": "simulator", "utterance": "Recommend me a movie", "intent": "request"},
                {"participant": "agent", "utterance": "Which genre?", "intent": "elicit"}
              ], "metadata": {"error": {"error_type": "KeyError", "error_message": "'genre'", "turn": 2}}}
            ]
            """);
        model = tempDir.resolve("flow.json");
        Files.writeString(model, """
            {"transitions": {"request": ["elicit", "inform"], "elicit": ["inform"], "inform": ["recommend"],
                             "clarify": ["clarify", "inform"]}}
            """);
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void shouldDetectBreakdownsAndWriteReport() throws Exception {
        Path report = tempDir.resolve("report.json");

        int code = new CommandLine(new DetectCommand(context())).execute(
            dialogues.toString(), model.toString(), "--output", report.toString(), "-n", "2");

        assertThat(code).isEqualTo(0);
        String console = out.toString(StandardCharsets.UTF_8);
        assertThat(console)
            .contains("Dialogue d1")
            .contains("dialogue_of_the_deaf")
            .contains("unexpected_transition")
            .contains("system_failure")
            .contains("Report written");

        JsonNode json = new ObjectMapper().readTree(Files.readString(report));
        assertThat(json.path("findings").path("d1").get(0).path("type").asText()).isEqualTo("dialogue_of_the_deaf");
        assertThat(json.path("findings").path("d2").get(0).path("type").asText()).isEqualTo("unexpected_transition");
        assertThat(json.path("findings").path("d3").get(0).path("toTurn").asInt()).isEqualTo(2);
    }

    @Test
    void shouldSkipFlowDetectionWithoutModel() {
        int code = new CommandLine(new DetectCommand(context())).execute(dialogues.toString());

        assertThat(code).isEqualTo(0);
        String console = out.toString(StandardCharsets.UTF_8);
        assertThat(console).contains("Detectors: system_failure, dialogue_of_the_deaf");
        assertThat(console).doesNotContain("No legal transition");
    }

    @Test
    void shouldFailOnUnknownDetector() {
        int code = new CommandLine(new DetectCommand(context())).execute(
            dialogues.toString(), model.toString(), "--detectors", "system_failure,bogus");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
            .contains("detect failed: Unknown breakdown detector(s): bogus");
    }

    @Test
    void shouldFailWhenFlowDetectorSelectedWithoutModel() {
        int code = new CommandLine(new DetectCommand(context())).execute(
            dialogues.toString(), "--detectors", "flow_discontinuation");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("interaction model is required");
    }

    @Test
    void shouldEnableDebugLogging() {
        AtomicBoolean debugEnabled = new AtomicBoolean();
        CliContext context = new CliContext(new ConfigService(), tempDir.resolve("config.json"), () -> debugEnabled.set(true));

        int code = new CommandLine(new DetectCommand(context)).execute(dialogues.toString(), "--debug");

        assertThat(code).isEqualTo(0);
        assertThat(debugEnabled).isTrue();
    }

    private CliContext context() {
        return new CliContext(new ConfigService(), tempDir.resolve("config.json"));
    }
}
