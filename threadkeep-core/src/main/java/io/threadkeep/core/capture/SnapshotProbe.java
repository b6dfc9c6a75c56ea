package io.threadkeep.core.capture;

import io.threadkeep.core.model.RawCapture;
import java.io.IOException;
import java.util.Optional;

/**
 * Source of raw conversation captures, typically a platform screen reader.
 */
@FunctionalInterface
public interface SnapshotProbe {
    /**
     * Empty when no conversation is currently visible.
     */
    Optional<RawCapture> capture() throws IOException;
}
