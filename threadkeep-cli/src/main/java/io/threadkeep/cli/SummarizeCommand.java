package io.threadkeep.cli;

import io.threadkeep.core.config.model.ThreadkeepConfig;
import io.threadkeep.core.model.Message;
import io.threadkeep.core.summarize.SummaryService;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "summarize", description = "Print a compressed view of one session")
public final class SummarizeCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Session id")
    String sessionId;

    @Option(names = "--ratio", description = "Fraction of prose to keep (defaults to the configured ratio)")
    Double ratio;

    @Option(names = "--extractive", description = "Skip the remote model and use local extraction only")
    boolean extractive;

    public SummarizeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ThreadkeepConfig config = context.configService().load(context.configPath());
            double effectiveRatio = ratio == null ? config.summarizer().ratio() : ratio;
            SummaryService.Strategy strategy = extractive
                ? SummaryService.Strategy.EXTRACTIVE
                : SummaryService.Strategy.parse(config.summarizer().strategy());

            Optional<SummaryService.Summary> summary =
                context.summaryService().summarizeSession(sessionId, effectiveRatio, strategy);
            if (summary.isEmpty()) {
                System.err.println("Session not found: " + sessionId);
                return 1;
            }

            System.out.println("Strategy: " + summary.get().strategy() + " (ratio " + summary.get().ratio() + ")");
            for (Message message : summary.get().messages()) {
                System.out.println();
                System.out.println("[" + message.role().wireName() + "]");
                System.out.println(message.content());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Summarize failed: " + e.getMessage());
            return 1;
        }
    }
}
