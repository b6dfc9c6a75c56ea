package io.threadkeep.cli;

import io.threadkeep.core.session.SessionSummary;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "sessions", description = "List captured sessions, newest first")
public final class SessionsCommand implements Callable<Integer> {
    private static final int PREVIEW_COLUMNS = 60;

    private final CliContext context;

    @Option(names = "--search", description = "Only sessions whose prompt or response contains this text")
    String search;

    @Option(names = "--workbook", description = "Only sessions captured from this workbook")
    String workbook;

    public SessionsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<SessionSummary> sessions;
            if (workbook != null && !workbook.isBlank()) {
                sessions = context.store().listByWorkbook(workbook);
            } else if (search != null && !search.isBlank()) {
                sessions = context.store().search(search);
            } else {
                sessions = context.store().list();
            }

            if (sessions.isEmpty()) {
                System.out.println("No sessions found.");
                return 0;
            }
            for (SessionSummary session : sessions) {
                System.out.println(session.id() + "  " + session.capturedAt() + "  " + session.workbookName()
                    + "  " + oneLine(session.userPromptPreview()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Sessions command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String oneLine(String text) {
        String flattened = text.replaceAll("\\s+", " ").trim();
        return flattened.length() <= PREVIEW_COLUMNS ? flattened : flattened.substring(0, PREVIEW_COLUMNS) + "...";
    }
}
