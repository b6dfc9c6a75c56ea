package io.threadkeep.app;

import io.threadkeep.cli.CliContext;
import io.threadkeep.cli.IngestCommand;
import io.threadkeep.cli.OnboardCommand;
import io.threadkeep.cli.ServeCommand;
import io.threadkeep.cli.SessionsCommand;
import io.threadkeep.cli.StatusCommand;
import io.threadkeep.cli.SummarizeCommand;
import io.threadkeep.cli.ThreadkeepCliCommand;
import io.threadkeep.core.api.GatewayServer;
import io.threadkeep.core.capture.CaptureContext;
import io.threadkeep.core.capture.CapturePoller;
import io.threadkeep.core.capture.CaptureService;
import io.threadkeep.core.capture.CommandSnapshotProbe;
import io.threadkeep.core.capture.SnapshotProbe;
import io.threadkeep.core.capture.TranscriptReconciler;
import io.threadkeep.core.config.ConfigPaths;
import io.threadkeep.core.config.ConfigService;
import io.threadkeep.core.config.model.CaptureConfig;
import io.threadkeep.core.config.model.ProviderConfig;
import io.threadkeep.core.config.model.StorageConfig;
import io.threadkeep.core.config.model.SummarizerConfig;
import io.threadkeep.core.config.model.ThreadkeepConfig;
import io.threadkeep.core.provider.AnthropicProvider;
import io.threadkeep.core.provider.DisabledProvider;
import io.threadkeep.core.provider.LlmProvider;
import io.threadkeep.core.session.FileSessionStore;
import io.threadkeep.core.session.SessionStore;
import io.threadkeep.core.session.SqliteSessionStore;
import io.threadkeep.core.summarize.ExtractiveSummarizer;
import io.threadkeep.core.summarize.FallbackConversationSummarizer;
import io.threadkeep.core.summarize.LlmConversationSummarizer;
import io.threadkeep.core.summarize.SummaryService;
import io.threadkeep.core.summarize.TextRanker;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ThreadkeepApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ThreadkeepApplication.class);
    private static final String DEFAULT_ANTHROPIC_BASE = "https://api.anthropic.com/v1";

    private ThreadkeepApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        ThreadkeepConfig config = loadConfig(configService, configPath);

        SessionStore store = buildSessionStore(config.storage());
        ExtractiveSummarizer extractive = buildExtractiveSummarizer(config.summarizer());
        LlmProvider anthropic = buildAnthropicProvider("anthropic", config.providers().anthropic());
        FallbackConversationSummarizer summarizer = new FallbackConversationSummarizer(
            List.of(new LlmConversationSummarizer(anthropic, config.providers().anthropic().model())),
            extractive
        );
        SummaryService summaryService = new SummaryService(store, summarizer, extractive);

        CaptureService captureService = new CaptureService(
            buildProbe(config.capture()),
            store,
            new TranscriptReconciler(),
            new CaptureContext(config.capture().enabled()),
            Clock.systemUTC()
        );

        CliContext context = new CliContext(
            configService,
            configPath,
            store,
            captureService,
            summaryService,
            (portOverride, captureEnabled) -> runServer(
                config,
                portOverride,
                captureEnabled,
                store,
                captureService,
                summaryService
            )
        );

        CommandLine commandLine = new CommandLine(new ThreadkeepCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("sessions", new SessionsCommand(context));
        commandLine.addSubcommand("summarize", new SummarizeCommand(context));
        commandLine.addSubcommand("ingest", new IngestCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static ThreadkeepConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return ThreadkeepConfig.defaults();
        }
    }

    private static SessionStore buildSessionStore(StorageConfig storage) {
        if (storage.usesFileBackend()) {
            return new FileSessionStore(storage.resolvedFilePath());
        }
        Path sqlitePath = storage.resolvedSqlitePath();
        try {
            return new SqliteSessionStore(sqlitePath);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite session store at " + sqlitePath, e);
        }
    }

    private static ExtractiveSummarizer buildExtractiveSummarizer(SummarizerConfig summarizer) {
        int iterations = summarizer.iterations() > 0 ? summarizer.iterations() : TextRanker.DEFAULT_ITERATIONS;
        double damping = summarizer.damping() > 0.0 && summarizer.damping() <= 1.0
            ? summarizer.damping()
            : TextRanker.DEFAULT_DAMPING;
        int maxInputChars = summarizer.maxInputChars() > 0 ? summarizer.maxInputChars() : Integer.MAX_VALUE;
        return new ExtractiveSummarizer(new TextRanker(iterations, damping), maxInputChars);
    }

    private static LlmProvider buildAnthropicProvider(String name, ProviderConfig providerConfig) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
                ? DEFAULT_ANTHROPIC_BASE
                : providerConfig.apiBase();
            return new AnthropicProvider(name, providerConfig.apiKey(), apiBase);
        }
        return new DisabledProvider(name, "missing API key");
    }

    private static SnapshotProbe buildProbe(CaptureConfig capture) {
        if (!capture.probeConfigured()) {
            return null;
        }
        long timeoutMs = capture.probeTimeoutMs() > 0 ? capture.probeTimeoutMs() : 15_000;
        return new CommandSnapshotProbe(capture.probeCommand(), Duration.ofMillis(timeoutMs));
    }

    private static int runServer(
        ThreadkeepConfig config,
        Integer portOverride,
        boolean captureEnabled,
        SessionStore store,
        CaptureService captureService,
        SummaryService summaryService
    ) throws Exception {
        if (!captureEnabled) {
            captureService.context().disable();
        }
        int port = portOverride != null ? portOverride : config.gateway().port();
        long intervalMs = config.capture().pollIntervalMs() > 0 ? config.capture().pollIntervalMs() : 3_000;

        CountDownLatch shutdown = new CountDownLatch(1);
        try (CapturePoller poller = new CapturePoller(captureService, Duration.ofMillis(intervalMs));
             GatewayServer server = new GatewayServer(
                 config.gateway().host(),
                 port,
                 store,
                 captureService,
                 poller,
                 summaryService,
                 config.summarizer().ratio()
             )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            if (config.capture().probeConfigured()) {
                poller.start();
            } else {
                LOG.info("No capture probe configured; accepting pushed snapshots only");
            }
            System.out.println("Threadkeep running on http://" + config.gateway().host() + ":" + server.port());
            System.out.println("Capturing: " + (captureService.context().isEnabled() ? "on" : "off"));
            shutdown.await();
        }
        return 0;
    }
}
