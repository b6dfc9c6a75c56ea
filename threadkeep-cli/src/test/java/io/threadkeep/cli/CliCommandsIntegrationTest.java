package io.threadkeep.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.threadkeep.core.capture.CaptureContext;
import io.threadkeep.core.capture.CaptureService;
import io.threadkeep.core.capture.TranscriptReconciler;
import io.threadkeep.core.config.ConfigService;
import io.threadkeep.core.model.Message;
import io.threadkeep.core.provider.DisabledProvider;
import io.threadkeep.core.session.CapturedSession;
import io.threadkeep.core.session.FileSessionStore;
import io.threadkeep.core.summarize.ExtractiveSummarizer;
import io.threadkeep.core.summarize.FallbackConversationSummarizer;
import io.threadkeep.core.summarize.LlmConversationSummarizer;
import io.threadkeep.core.summarize.SummaryService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliCommandsIntegrationTest {

    @TempDir
    Path tempDir;

    private FileSessionStore store;
    private CliContext context;

    @BeforeEach
    void setUp() {
        store = new FileSessionStore(tempDir.resolve("sessions.json"));
        ExtractiveSummarizer extractive = new ExtractiveSummarizer();
        SummaryService summaryService = new SummaryService(
            store,
            new FallbackConversationSummarizer(
                List.of(new LlmConversationSummarizer(new DisabledProvider("anthropic", "no key"), "m")),
                extractive
            ),
            extractive
        );
        CaptureService captureService = new CaptureService(
            null, store, new TranscriptReconciler(), new CaptureContext(), Clock.systemUTC());
        context = new CliContext(new ConfigService(), tempDir.resolve("config.json"), store, captureService, summaryService);
    }

    @Test
    void shouldIngestSnapshotFileAndListIt() throws Exception {
        Path snapshot = tempDir.resolve("snapshot.json");
        Files.writeString(snapshot, """
            {"workbookName":"Sales.xlsx","fragments":[
              {"role":"user","text":"Chart monthly sales","position":1},
              {"role":"assistant","text":"Inserted a line chart on Sheet2.","position":2}
            ]}
            """);

        String ingested = run(new IngestCommand(context), snapshot.toString());
        String listed = run(new SessionsCommand(context));
        String unchanged = run(new IngestCommand(context), snapshot.toString());

        assertThat(ingested).contains("Saved session").contains("Sales.xlsx").contains("2 messages");
        assertThat(listed).contains("Sales.xlsx").contains("Chart monthly sales");
        assertThat(unchanged).contains("No update: unchanged");
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void shouldFilterSessionsBySearchAndWorkbook() throws Exception {
        store.insert(CapturedSession.create("A.xlsx", Instant.parse("2026-03-01T09:00:00Z"),
            List.of(Message.user("Build a pivot table"))));
        store.insert(CapturedSession.create("B.xlsx", Instant.parse("2026-03-01T10:00:00Z"),
            List.of(Message.user("Format headers"))));

        assertThat(run(new SessionsCommand(context), "--search", "pivot")).contains("A.xlsx").doesNotContain("B.xlsx");
        assertThat(run(new SessionsCommand(context), "--workbook", "B.xlsx")).contains("B.xlsx").doesNotContain("A.xlsx");
        assertThat(run(new SessionsCommand(context), "--search", "chart")).contains("No sessions found.");
    }

    @Test
    void shouldPrintExtractiveSummary() throws Exception {
        CapturedSession session = CapturedSession.create("Costs.xlsx", Instant.now(), List.of(
            Message.user("Review costs"),
            Message.assistant("Travel is over plan. Payroll is on plan. Software is under plan. Rent is flat this year.")
        ));
        store.insert(session);

        String output = run(new SummarizeCommand(context), session.id(), "--extractive", "--ratio", "0.5");

        assertThat(output).contains("Strategy: extractive (ratio 0.5)");
        assertThat(output).contains("[user]").contains("Review costs").contains("[assistant]");
    }

    @Test
    void shouldFailForUnknownSession() {
        int code = new CommandLine(new SummarizeCommand(context)).execute("missing");

        assertThat(code).isEqualTo(1);
    }

    @Test
    void shouldPassServeOptionsToRunner() {
        List<Object> received = new ArrayList<>();
        CliContext serveContext = new CliContext(
            context.configService(),
            context.configPath(),
            store,
            context.captureService(),
            context.summaryService(),
            (port, capture) -> {
                received.add(port);
                received.add(capture);
                return 0;
            }
        );

        int code = new CommandLine(new ServeCommand(serveContext)).execute("--port", "4000", "--no-capture");

        assertThat(code).isZero();
        assertThat(received).containsExactly(4000, false);
    }

    @Test
    void shouldOnboardAndReportStatus() throws Exception {
        String onboard = run(new OnboardCommand(context));
        String status = run(new StatusCommand(context));

        assertThat(onboard).contains("Created config: ").contains("Data directory ready: ");
        assertThat(status).contains("Config exists: true").contains("Sessions stored: 0").contains("Anthropic configured: false");
    }

    private String run(Callable<Integer> command, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            assertThat(code).isEqualTo(0);
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
