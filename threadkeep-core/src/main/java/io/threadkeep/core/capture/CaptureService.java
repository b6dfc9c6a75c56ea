package io.threadkeep.core.capture;

import io.threadkeep.core.model.Message;
import io.threadkeep.core.model.RawCapture;
import io.threadkeep.core.session.CapturedSession;
import io.threadkeep.core.session.SessionStore;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Glues a probe, the reconciler and the session store together. One session is kept per workbook;
 * each accepted capture is merged into it.
 */
public final class CaptureService {
    private static final Logger LOG = LoggerFactory.getLogger(CaptureService.class);

    private final SnapshotProbe probe;
    private final SessionStore store;
    private final TranscriptReconciler reconciler;
    private final CaptureContext context;
    private final Clock clock;
    private volatile Consumer<CapturedSession> listener = session -> {
    };

    public CaptureService(
        SnapshotProbe probe,
        SessionStore store,
        TranscriptReconciler reconciler,
        CaptureContext context,
        Clock clock
    ) {
        this.probe = probe;
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public CaptureContext context() {
        return context;
    }

    public void setListener(Consumer<CapturedSession> listener) {
        this.listener = listener == null ? session -> {
        } : listener;
    }

    /**
     * One polling tick. Failures are logged and swallowed so the poller keeps running.
     */
    public void captureOnce() {
        if (probe == null || !context.isEnabled()) {
            return;
        }
        try {
            Optional<RawCapture> capture = probe.capture();
            if (capture.isPresent()) {
                ingest(capture.get());
            }
        } catch (IOException e) {
            LOG.warn("Capture tick failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Capture tick failed unexpectedly", e);
        }
    }

    public synchronized CaptureResult ingest(RawCapture capture) throws IOException {
        Objects.requireNonNull(capture, "capture must not be null");
        Optional<CapturedSession> existing = store.findActiveByWorkbook(capture.workbookName());
        List<Message> existingMessages = existing.map(CapturedSession::messages).orElse(List.of());

        String previousDigest = context.lastDigest();
        ReconcileOutcome outcome = reconciler.reconcile(context, existingMessages, capture.fragments());
        if (outcome instanceof ReconcileOutcome.NoUpdate noUpdate) {
            LOG.debug("No update for {}: {}", capture.workbookName(), noUpdate.reason());
            return CaptureResult.skipped(noUpdate.reason());
        }

        List<Message> merged = ((ReconcileOutcome.Updated) outcome).messages();
        CapturedSession saved;
        try {
            saved = write(capture.workbookName(), existing, existingMessages, merged);
        } catch (IOException e) {
            // Nothing was stored, so the same snapshot must be accepted again on the next tick.
            context.accept(previousDigest);
            throw e;
        }

        try {
            listener.accept(saved);
        } catch (RuntimeException e) {
            LOG.warn("Capture listener failed for session {}", saved.id(), e);
        }
        return CaptureResult.saved(saved);
    }

    private CapturedSession write(
        String workbookName,
        Optional<CapturedSession> existing,
        List<Message> existingMessages,
        List<Message> merged
    ) throws IOException {
        CapturedSession saved;
        if (existing.isPresent()) {
            saved = existing.get().withMessages(clock.instant(), merged);
            store.update(saved);
            LOG.info(
                "Thread updated for {} ({}): {} -> {} messages",
                workbookName,
                saved.id(),
                existingMessages.size(),
                merged.size()
            );
        } else {
            saved = CapturedSession.create(workbookName, clock.instant(), merged);
            store.insert(saved);
            LOG.info("New thread for {} ({}): {} messages", workbookName, saved.id(), merged.size());
        }
        return saved;
    }

    public record CaptureResult(boolean updated, ReconcileOutcome.Reason reason, CapturedSession session) {

        static CaptureResult skipped(ReconcileOutcome.Reason reason) {
            return new CaptureResult(false, reason, null);
        }

        static CaptureResult saved(CapturedSession session) {
            return new CaptureResult(true, null, session);
        }
    }
}
