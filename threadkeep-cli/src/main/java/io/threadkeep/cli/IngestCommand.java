package io.threadkeep.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.threadkeep.core.capture.CaptureService;
import io.threadkeep.core.capture.RawCaptureReader;
import io.threadkeep.core.model.RawCapture;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Feeds a saved snapshot through the same reconciliation path the poller uses.
 */
@Command(name = "ingest", description = "Reconcile a snapshot JSON file into the session store")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper();

    @Parameters(index = "0", description = "Snapshot file: {\"workbookName\":...,\"fragments\":[...]}")
    Path snapshotFile;

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RawCapture capture = RawCaptureReader.fromJson(mapper.readTree(Files.readString(snapshotFile)));
            CaptureService.CaptureResult result = context.captureService().ingest(capture);
            if (result.updated()) {
                System.out.println("Saved session " + result.session().id() + " for " + capture.workbookName()
                    + " (" + result.session().messages().size() + " messages)");
            } else {
                System.out.println("No update: " + result.reason().name().toLowerCase(Locale.ROOT));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Ingest failed: " + e.getMessage());
            return 1;
        }
    }
}
