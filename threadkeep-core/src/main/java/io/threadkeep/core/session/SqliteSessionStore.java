package io.threadkeep.core.session;

import io.threadkeep.core.model.Message;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteSessionStore implements SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteSessionStore.class);
    // Fixed width so that ORDER BY captured_at sorts chronologically.
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
        .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'")
        .withZone(ZoneOffset.UTC);
    private static final String SUMMARY_COLUMNS = """
        id, workbook_name, captured_at, model, SUBSTR(user_prompt, 1, 200) AS user_prompt_preview
        """;

    private final String jdbcUrl;
    private final TranscriptCodec codec;

    public SqliteSessionStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.codec = new TranscriptCodec();
        init();
    }

    @Override
    public synchronized void insert(CapturedSession session) throws IOException {
        String sql = """
            INSERT INTO sessions (
                id, workbook_name, captured_at, model, user_prompt, assistant_response, transcript_json
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, session.id());
            statement.setString(2, session.workbookName());
            statement.setString(3, TIMESTAMP.format(session.capturedAt()));
            statement.setString(4, session.model());
            statement.setString(5, session.userPrompt());
            statement.setString(6, session.assistantResponse());
            statement.setString(7, codec.encode(session.messages()));
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to insert session " + session.id(), e);
        }
    }

    @Override
    public synchronized void update(CapturedSession session) throws IOException {
        String sql = """
            UPDATE sessions SET
                captured_at = ?,
                user_prompt = ?,
                assistant_response = ?,
                transcript_json = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, TIMESTAMP.format(session.capturedAt()));
            statement.setString(2, session.userPrompt());
            statement.setString(3, session.assistantResponse());
            statement.setString(4, codec.encode(session.messages()));
            statement.setString(5, session.id());
            if (statement.executeUpdate() == 0) {
                throw new IOException("Session not found: " + session.id());
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update session " + session.id(), e);
        }
    }

    @Override
    public synchronized Optional<CapturedSession> findActiveByWorkbook(String workbookName) throws IOException {
        String sql = """
            SELECT * FROM sessions
            WHERE workbook_name = ?
            ORDER BY captured_at DESC
            LIMIT 1
            """;
        return querySingle(sql, workbookName);
    }

    @Override
    public synchronized Optional<CapturedSession> findById(String id) throws IOException {
        return querySingle("SELECT * FROM sessions WHERE id = ?", id);
    }

    @Override
    public synchronized List<SessionSummary> list() throws IOException {
        return querySummaries("SELECT " + SUMMARY_COLUMNS + " FROM sessions ORDER BY captured_at DESC");
    }

    @Override
    public synchronized List<SessionSummary> listByWorkbook(String workbookName) throws IOException {
        return querySummaries(
            "SELECT " + SUMMARY_COLUMNS + " FROM sessions WHERE workbook_name = ? ORDER BY captured_at DESC",
            workbookName
        );
    }

    @Override
    public synchronized List<SessionSummary> search(String query) throws IOException {
        String term = "%" + (query == null ? "" : query) + "%";
        return querySummaries(
            "SELECT " + SUMMARY_COLUMNS + " FROM sessions "
                + "WHERE user_prompt LIKE ? OR assistant_response LIKE ? ORDER BY captured_at DESC",
            term,
            term
        );
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM sessions WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete session " + id, e);
        }
    }

    @Override
    public synchronized int count() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM sessions")) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException e) {
            throw new IOException("Failed to count sessions", e);
        }
    }

    @Override
    public synchronized void clear() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM sessions");
        } catch (SQLException e) {
            throw new IOException("Failed to clear sessions", e);
        }
    }

    private Optional<CapturedSession> querySingle(String sql, String parameter) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, parameter);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(toSession(resultSet));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load session", e);
        }
    }

    private List<SessionSummary> querySummaries(String sql, String... parameters) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < parameters.length; i++) {
                statement.setString(i + 1, parameters[i]);
            }
            List<SessionSummary> summaries = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    summaries.add(new SessionSummary(
                        resultSet.getString("id"),
                        resultSet.getString("workbook_name"),
                        Instant.from(TIMESTAMP.parse(resultSet.getString("captured_at"))),
                        resultSet.getString("model"),
                        safe(resultSet.getString("user_prompt_preview"))
                    ));
                }
            }
            return summaries;
        } catch (SQLException e) {
            throw new IOException("Failed to list sessions", e);
        }
    }

    private CapturedSession toSession(ResultSet resultSet) throws SQLException {
        String id = resultSet.getString("id");
        DecodedTranscript decoded = codec.decode(resultSet.getString("transcript_json"));
        if (decoded instanceof DecodedTranscript.Unreadable unreadable) {
            LOG.warn("Stored transcript for session {} is unreadable ({}); treating it as empty", id, unreadable.reason());
        }
        List<Message> messages = decoded.messages();
        return new CapturedSession(
            id,
            resultSet.getString("workbook_name"),
            Instant.from(TIMESTAMP.parse(resultSet.getString("captured_at"))),
            resultSet.getString("model"),
            resultSet.getString("user_prompt"),
            resultSet.getString("assistant_response"),
            messages
        );
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS sessions (
                id TEXT PRIMARY KEY,
                workbook_name TEXT,
                captured_at TEXT NOT NULL,
                model TEXT,
                user_prompt TEXT,
                assistant_response TEXT,
                transcript_json TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute("CREATE INDEX IF NOT EXISTS idx_sessions_workbook ON sessions(workbook_name)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_sessions_captured ON sessions(captured_at)");
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite session store", e);
        }
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
