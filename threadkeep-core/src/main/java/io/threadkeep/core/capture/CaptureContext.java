package io.threadkeep.core.capture;

/**
 * Mutable state shared between polling ticks: whether capturing is switched on and the digest of
 * the last accepted snapshot.
 */
public final class CaptureContext {
    private volatile boolean captureEnabled;
    private volatile String lastDigest = "";

    public CaptureContext() {
        this(true);
    }

    public CaptureContext(boolean captureEnabled) {
        this.captureEnabled = captureEnabled;
    }

    public boolean isEnabled() {
        return captureEnabled;
    }

    public void enable() {
        captureEnabled = true;
    }

    public void disable() {
        captureEnabled = false;
    }

    public String lastDigest() {
        return lastDigest;
    }

    /**
     * Forgets the last accepted digest so the next snapshot is reconciled even if unchanged.
     */
    public void reset() {
        lastDigest = "";
    }

    void accept(String digest) {
        lastDigest = digest == null ? "" : digest;
    }
}
