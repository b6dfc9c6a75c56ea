package io.threadkeep.cli;

import io.threadkeep.core.config.model.ThreadkeepConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show capture, storage and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ThreadkeepConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Storage backend: " + (config.storage().usesFileBackend() ? "file" : "sqlite"));
            System.out.println("Storage path: " + (config.storage().usesFileBackend()
                ? config.storage().resolvedFilePath()
                : config.storage().resolvedSqlitePath()));
            System.out.println("Sessions stored: " + context.store().count());
            System.out.println("Capture enabled: " + config.capture().enabled());
            System.out.println("Capture probe configured: " + config.capture().probeConfigured());
            System.out.println("Poll interval: " + config.capture().pollIntervalMs() + "ms");
            System.out.println("Gateway: http://" + config.gateway().host() + ":" + config.gateway().port());
            System.out.println("Summarizer strategy: " + config.summarizer().strategy());
            System.out.println("Anthropic configured: " + config.providers().anthropic().configured());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
