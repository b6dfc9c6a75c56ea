package io.threadkeep.cli;

import io.threadkeep.core.capture.CaptureService;
import io.threadkeep.core.config.ConfigService;
import io.threadkeep.core.session.SessionStore;
import io.threadkeep.core.summarize.SummaryService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    SessionStore store,
    CaptureService captureService,
    SummaryService summaryService,
    ServeRunner serveRunner
) {
    public CliContext(
        ConfigService configService,
        Path configPath,
        SessionStore store,
        CaptureService captureService,
        SummaryService summaryService
    ) {
        this(configService, configPath, store, captureService, summaryService, (port, capture) -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
