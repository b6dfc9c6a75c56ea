package io.threadkeep.core.summarize;

import io.threadkeep.core.model.Message;
import io.threadkeep.core.model.MessageRole;
import java.util.List;
import java.util.Optional;

/**
 * Unsupervised extractive compression (TextRank). Deterministic and local; used on its own or as
 * the last resort behind a remote summarizer.
 */
public final class ExtractiveSummarizer implements ConversationSummarizer {
    public static final double DEFAULT_RATIO = 0.3;
    static final int PASSTHROUGH_UNITS = 3;

    private final SentenceSegmenter segmenter;
    private final TextRanker ranker;
    private final SentenceSelector selector;
    private final int maxInputChars;

    public ExtractiveSummarizer() {
        this(new TextRanker(), Integer.MAX_VALUE);
    }

    /**
     * @param maxInputChars assistant messages longer than this are passed through by
     *     {@link #compress(List, double)} instead of being ranked
     */
    public ExtractiveSummarizer(TextRanker ranker, int maxInputChars) {
        this.segmenter = new SentenceSegmenter();
        this.ranker = ranker;
        this.selector = new SentenceSelector();
        this.maxInputChars = Math.max(1, maxInputChars);
    }

    @Override
    public String name() {
        return "extractive";
    }

    /**
     * Texts of three units or fewer come back unchanged.
     */
    public String summarize(String text, double ratio) {
        if (text == null) {
            return "";
        }
        List<TextUnit> units = segmenter.segment(text);
        if (units.size() <= PASSTHROUGH_UNITS) {
            return text;
        }
        double[] scores = ranker.rank(SimilarityGraph.build(units));
        return selector.join(selector.select(units, scores, clampRatio(ratio)));
    }

    /**
     * User messages are kept verbatim; each assistant message is summarized on its own.
     */
    public List<Message> compress(List<Message> messages, double ratio) {
        return messages.stream()
            .map(message -> message.role() == MessageRole.USER || message.content().length() > maxInputChars
                ? message
                : message.withContent(summarize(message.content(), ratio)))
            .toList();
    }

    @Override
    public Optional<List<Message>> summarize(List<Message> messages, double ratio) {
        return Optional.of(compress(messages, ratio));
    }

    static double clampRatio(double ratio) {
        if (Double.isNaN(ratio) || ratio <= 0.0) {
            return DEFAULT_RATIO;
        }
        return Math.min(1.0, ratio);
    }
}
