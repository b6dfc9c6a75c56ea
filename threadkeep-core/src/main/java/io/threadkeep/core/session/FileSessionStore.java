package io.threadkeep.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single JSON file store. Suited to small installs and tests; every write rewrites the file.
 */
public final class FileSessionStore implements SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileSessionStore.class);
    private static final Comparator<CapturedSession> NEWEST_FIRST =
        Comparator.comparing(CapturedSession::capturedAt).reversed();

    private final Path path;
    private final ObjectMapper mapper;
    private final TranscriptCodec codec;

    public FileSessionStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.codec = new TranscriptCodec(mapper);
    }

    @Override
    public synchronized void insert(CapturedSession session) throws IOException {
        List<CapturedSession> all = new ArrayList<>(load());
        if (all.stream().anyMatch(existing -> existing.id().equals(session.id()))) {
            throw new IOException("Session already exists: " + session.id());
        }
        all.add(session);
        save(all);
    }

    @Override
    public synchronized void update(CapturedSession session) throws IOException {
        List<CapturedSession> all = new ArrayList<>(load());
        for (int i = 0; i < all.size(); i++) {
            if (all.get(i).id().equals(session.id())) {
                CapturedSession existing = all.get(i);
                all.set(i, new CapturedSession(
                    existing.id(),
                    existing.workbookName(),
                    session.capturedAt(),
                    existing.model(),
                    session.userPrompt(),
                    session.assistantResponse(),
                    session.messages()
                ));
                save(all);
                return;
            }
        }
        throw new IOException("Session not found: " + session.id());
    }

    @Override
    public synchronized Optional<CapturedSession> findActiveByWorkbook(String workbookName) throws IOException {
        return load().stream()
            .filter(s -> workbookName != null && workbookName.equals(s.workbookName()))
            .sorted(NEWEST_FIRST)
            .findFirst();
    }

    @Override
    public synchronized Optional<CapturedSession> findById(String id) throws IOException {
        return load().stream().filter(s -> s.id().equals(id)).findFirst();
    }

    @Override
    public synchronized List<SessionSummary> list() throws IOException {
        return summaries(s -> true);
    }

    @Override
    public synchronized List<SessionSummary> listByWorkbook(String workbookName) throws IOException {
        return summaries(s -> workbookName != null && workbookName.equals(s.workbookName()));
    }

    @Override
    public synchronized List<SessionSummary> search(String query) throws IOException {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        return summaries(s -> s.userPrompt().toLowerCase(Locale.ROOT).contains(needle)
            || s.assistantResponse().toLowerCase(Locale.ROOT).contains(needle));
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        List<CapturedSession> all = new ArrayList<>(load());
        boolean removed = all.removeIf(s -> s.id().equals(id));
        if (removed) {
            save(all);
        }
        return removed;
    }

    @Override
    public synchronized int count() throws IOException {
        return load().size();
    }

    @Override
    public synchronized void clear() throws IOException {
        save(List.of());
    }

    private List<SessionSummary> summaries(Predicate<CapturedSession> filter) throws IOException {
        return load().stream()
            .filter(filter)
            .sorted(NEWEST_FIRST)
            .map(CapturedSession::toSummary)
            .toList();
    }

    private List<CapturedSession> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        JsonNode root = mapper.readTree(Files.readString(path));
        if (root == null || !root.isArray()) {
            return List.of();
        }
        List<CapturedSession> sessions = new ArrayList<>();
        for (JsonNode row : root) {
            String id = row.path("id").asText("");
            DecodedTranscript decoded = codec.decode(row.get("transcript"));
            if (decoded instanceof DecodedTranscript.Unreadable unreadable) {
                LOG.warn("Stored transcript for session {} is unreadable ({}); treating it as empty", id, unreadable.reason());
            }
            sessions.add(new CapturedSession(
                id,
                row.path("workbook_name").asText(null),
                Instant.parse(row.path("captured_at").asText()),
                row.path("model").asText(null),
                row.path("user_prompt").asText(""),
                row.path("assistant_response").asText(""),
                decoded.messages()
            ));
        }
        return sessions;
    }

    private void save(List<CapturedSession> sessions) throws IOException {
        ArrayNode root = mapper.createArrayNode();
        for (CapturedSession session : sessions) {
            ObjectNode row = root.addObject();
            row.put("id", session.id());
            row.put("workbook_name", session.workbookName());
            row.put("captured_at", session.capturedAt().toString());
            row.put("model", session.model());
            row.put("user_prompt", session.userPrompt());
            row.put("assistant_response", session.assistantResponse());
            row.set("transcript", codec.encodeTree(session.messages()));
        }
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        Files.writeString(path, json + System.lineSeparator());
    }
}
