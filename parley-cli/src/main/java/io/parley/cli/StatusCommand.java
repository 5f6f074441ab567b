package io.parley.cli;

import io.parley.core.config.model.DetectionConfig;
import io.parley.core.config.model.ParleyConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ParleyConfig config = context.configService().load(context.configPath());
            DetectionConfig detection = config.detection();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Default detectors: " + String.join(", ", detection.detectors()));
            System.out.println("Act labeling: " + detection.actLabeling());
            System.out.println("Pattern length: " + detection.patternLength());
            System.out.println("Reply signal: " + detection.flow().replySignal()
                + " (look-back " + detection.flow().lookBack() + ")");
            System.out.println("Deaf speakers: " + String.join(", ", detection.deaf().speakers()));
            System.out.println("Participants: agent=" + config.ingestion().agentId()
                + ", user=" + config.ingestion().userId());
            return 0;
        } catch (Exception e) {
            System.err.println("status failed: " + e.getMessage());
            return 1;
        }
    }
}
