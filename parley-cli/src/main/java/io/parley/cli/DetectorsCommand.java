package io.parley.cli;

import io.parley.core.config.model.ParleyConfig;
import io.parley.core.detect.Detector;
import io.parley.core.detect.DetectorRegistry;
import io.parley.core.detect.ModelDetector;
import io.parley.core.engine.DetectorCatalog;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "detectors", description = "List the available breakdown detectors")
public final class DetectorsCommand implements Callable<Integer> {
    private final CliContext context;

    public DetectorsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ParleyConfig config = context.configService().load(context.configPath());
            DetectorRegistry registry = DetectorCatalog.create(config.detection());
            for (Detector detector : registry.all()) {
                String needsModel = detector instanceof ModelDetector ? " [needs interaction model]" : "";
                System.out.printf("%-22s %s%s%n", detector.id(), detector.description(), needsModel);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("detectors failed: " + e.getMessage());
            return 1;
        }
    }
}
