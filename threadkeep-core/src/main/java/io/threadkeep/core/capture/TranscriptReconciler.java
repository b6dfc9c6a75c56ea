package io.threadkeep.core.capture;

import io.threadkeep.core.model.ConversationSnapshot;
import io.threadkeep.core.model.Fragment;
import io.threadkeep.core.model.Message;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds repeated, partial captures of one conversation into a single canonical transcript.
 *
 * <p>Entries are matched by {@link Fingerprints#ofContent(String)}. A matching entry is replaced in
 * place only by strictly longer content; unmatched messages are appended, so the transcript is in
 * admission order rather than conversation order. Nothing is ever removed.
 */
public final class TranscriptReconciler {
    private static final Logger LOG = LoggerFactory.getLogger(TranscriptReconciler.class);
    private static final String DIGEST_SEPARATOR = "|||";
    private static final int MIN_FRAGMENTS = 2;

    private final TextNormalizer normalizer;

    public TranscriptReconciler() {
        this(new TextNormalizer());
    }

    public TranscriptReconciler(TextNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    /**
     * Normalizes and gatekeeps one capture, then merges it into {@code existing}. The context digest
     * moves forward only when the snapshot is accepted.
     */
    public ReconcileOutcome reconcile(CaptureContext context, List<Message> existing, List<Fragment> fragments) {
        Objects.requireNonNull(context, "context must not be null");
        if (!context.isEnabled()) {
            return new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.CAPTURE_DISABLED);
        }
        if (fragments == null || fragments.size() < MIN_FRAGMENTS) {
            return new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.TOO_FEW_FRAGMENTS);
        }

        ConversationSnapshot snapshot = assemble(fragments);
        if (!snapshot.hasRolePair()) {
            LOG.debug("Discarding snapshot without a user/assistant pair");
            return new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.MISSING_ROLE_PAIR);
        }
        if (snapshot.digest().equals(context.lastDigest())) {
            return new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.UNCHANGED);
        }

        context.accept(snapshot.digest());
        List<Message> merged = merge(existing == null ? List.of() : existing, snapshot.messages());
        LOG.debug(
            "Reconciled snapshot {}: existing={} incoming={} merged={}",
            snapshot.digest(),
            existing == null ? 0 : existing.size(),
            snapshot.messages().size(),
            merged.size()
        );
        return new ReconcileOutcome.Updated(merged, snapshot);
    }

    /**
     * Orders fragments by screen position, cleans their text and computes the whole-capture digest
     * over the raw texts.
     */
    public ConversationSnapshot assemble(List<Fragment> fragments) {
        List<Fragment> ordered = new ArrayList<>(fragments);
        ordered.sort(Comparator.comparingDouble(Fragment::position));

        StringBuilder raw = new StringBuilder();
        List<Message> messages = new ArrayList<>();
        for (Fragment fragment : ordered) {
            if (raw.length() > 0) {
                raw.append(DIGEST_SEPARATOR);
            }
            raw.append(fragment.text());
            Optional<String> cleaned = normalizer.normalize(fragment.text());
            cleaned.ifPresent(text -> messages.add(new Message(fragment.role(), text)));
        }
        return new ConversationSnapshot(messages, Fingerprints.rollingHash(raw.toString()));
    }

    public List<Message> merge(List<Message> canonical, List<Message> incoming) {
        if (canonical.isEmpty()) {
            return List.copyOf(incoming);
        }

        List<Message> result = new ArrayList<>(canonical);
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < result.size(); i++) {
            positions.putIfAbsent(Fingerprints.ofContent(result.get(i).content()), i);
        }

        for (Message message : incoming) {
            String fingerprint = Fingerprints.ofContent(message.content());
            Integer position = positions.get(fingerprint);
            if (position == null) {
                positions.put(fingerprint, result.size());
                result.add(message);
            } else if (result.get(position).content().length() < message.content().length()) {
                result.set(position, message);
            }
        }
        return List.copyOf(result);
    }
}
