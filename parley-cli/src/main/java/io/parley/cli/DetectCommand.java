package io.parley.cli;

import io.parley.core.config.model.DetectionConfig;
import io.parley.core.config.model.ParleyConfig;
import io.parley.core.detect.DetectorRegistry;
import io.parley.core.detect.ModelDetector;
import io.parley.core.engine.DetectionOrchestrator;
import io.parley.core.engine.DetectionRequest;
import io.parley.core.engine.DetectorCatalog;
import io.parley.core.flow.InteractionModel;
import io.parley.core.flow.InteractionModelLoader;
import io.parley.core.io.DialogueReader;
import io.parley.core.model.Dialogue;
import io.parley.core.report.BreakdownPatternAnalyzer;
import io.parley.core.report.DetectionReport;
import io.parley.core.report.JsonReportWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "detect", description = "Detect breakdowns in stored dialogues")
public final class DetectCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(DetectCommand.class);

    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Dialogue JSON file or directory of JSON files")
    Path dialoguesPath;

    @Parameters(index = "1", arity = "0..1", description = "Interaction model (dialogue flow) JSON file; A_/U_ node names are matched against speaker-prefixed acts")
    Path modelPath;

    @Option(names = {"-d", "--detectors"}, split = ",", description = "Detectors to run (default: from config)")
    List<String> detectors;

    @Option(names = {"-o", "--output"}, description = "Write the JSON report to this file")
    Path output;

    @Option(names = "-n", description = "Maximum length of the conversational patterns")
    Integer patternLength;

    @Option(names = "--debug", description = "Enable debug logging")
    boolean debug;

    public DetectCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (debug) {
            context.logLevelSwitch().enableDebug();
        }
        try {
            ParleyConfig config = context.configService().load(context.configPath());
            DetectionConfig detection = config.detection();
            DetectorRegistry registry = DetectorCatalog.create(detection);

            List<Dialogue> dialogues = new DialogueReader(config.ingestion()).read(dialoguesPath);
            InteractionModel model = modelPath == null ? null : new InteractionModelLoader().load(modelPath);

            List<String> selected = detectors == null || detectors.isEmpty()
                ? configuredDetectors(detection, registry, model)
                : detectors;
            int maxLength = patternLength == null ? detection.patternLength() : patternLength;

            DetectionOrchestrator orchestrator = new DetectionOrchestrator(
                registry,
                new BreakdownPatternAnalyzer(maxLength),
                Clock.systemUTC()
            );
            DetectionReport report = orchestrator.run(new DetectionRequest(dialogues, selected, model));

            new ConsoleReportPrinter(System.out).print(report);
            if (output != null) {
                new JsonReportWriter().write(report, output);
                System.out.println("Report written: " + output);
            }
            return 0;
        } catch (Exception e) {
            LOG.debug("detect failed", e);
            System.err.println("detect failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Configured defaults, leaving out detectors that need an interaction model when none was given.
     */
    private List<String> configuredDetectors(DetectionConfig detection, DetectorRegistry registry, InteractionModel model) {
        if (model != null) {
            return detection.detectors();
        }
        List<String> selected = new ArrayList<>();
        for (String id : detection.detectors()) {
            boolean needsModel = registry.find(id).filter(ModelDetector.class::isInstance).isPresent();
            if (needsModel) {
                LOG.info("Skipping {}: no interaction model given", id);
            } else {
                selected.add(id);
            }
        }
        return selected;
    }
}
