package io.threadkeep.core.session;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for canonical transcripts, one session record per conversation identity.
 */
public interface SessionStore {
    void insert(CapturedSession session) throws IOException;

    void update(CapturedSession session) throws IOException;

    /**
     * Most recently captured session for a workbook, if any.
     */
    Optional<CapturedSession> findActiveByWorkbook(String workbookName) throws IOException;

    Optional<CapturedSession> findById(String id) throws IOException;

    List<SessionSummary> list() throws IOException;

    List<SessionSummary> listByWorkbook(String workbookName) throws IOException;

    List<SessionSummary> search(String query) throws IOException;

    boolean delete(String id) throws IOException;

    int count() throws IOException;

    void clear() throws IOException;
}
