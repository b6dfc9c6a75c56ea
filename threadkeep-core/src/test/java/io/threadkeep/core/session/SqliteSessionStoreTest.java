package io.threadkeep.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.threadkeep.core.model.Message;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteSessionStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistAndReloadSessions() throws Exception {
        Path db = tempDir.resolve("sessions.db");
        CapturedSession session = CapturedSession.create(
            "Budget.xlsx",
            Instant.parse("2026-03-01T10:00:00Z"),
            List.of(Message.user("Q1"), Message.assistant("A1"))
        );

        new SqliteSessionStore(db).insert(session);
        SqliteSessionStore reopened = new SqliteSessionStore(db);

        assertThat(reopened.findById(session.id())).contains(session);
        assertThat(reopened.count()).isEqualTo(1);
    }

    @Test
    void shouldUpdateTranscriptAndKeepIdentity() throws Exception {
        SqliteSessionStore store = new SqliteSessionStore(tempDir.resolve("sessions.db"));
        CapturedSession session = CapturedSession.create(
            "Budget.xlsx",
            Instant.parse("2026-03-01T10:00:00Z"),
            List.of(Message.user("Q1"), Message.assistant("A1"))
        );
        store.insert(session);

        CapturedSession grown = session.withMessages(
            Instant.parse("2026-03-01T10:05:00Z"),
            List.of(Message.user("Q1"), Message.assistant("A1"), Message.user("Q2"))
        );
        store.update(grown);

        CapturedSession loaded = store.findById(session.id()).orElseThrow();
        assertThat(loaded.messages()).hasSize(3);
        assertThat(loaded.capturedAt()).isEqualTo(Instant.parse("2026-03-01T10:05:00Z"));
        assertThat(loaded.workbookName()).isEqualTo("Budget.xlsx");
    }

    @Test
    void shouldFailToUpdateUnknownSession() throws Exception {
        SqliteSessionStore store = new SqliteSessionStore(tempDir.resolve("sessions.db"));
        CapturedSession ghost = CapturedSession.create("Book1", Instant.now(), List.of(Message.user("Q")));

        assertThatThrownBy(() -> store.update(ghost)).isInstanceOf(IOException.class);
    }

    @Test
    void shouldListNewestFirstAndFindActiveByWorkbook() throws Exception {
        SqliteSessionStore store = new SqliteSessionStore(tempDir.resolve("sessions.db"));
        CapturedSession older = CapturedSession.create(
            "Budget.xlsx", Instant.parse("2026-03-01T09:00:00Z"), List.of(Message.user("older")));
        CapturedSession newer = CapturedSession.create(
            "Budget.xlsx", Instant.parse("2026-03-01T09:00:00.5Z"), List.of(Message.user("newer")));
        CapturedSession other = CapturedSession.create(
            "Forecast.xlsx", Instant.parse("2026-03-02T09:00:00Z"), List.of(Message.user("other")));
        store.insert(older);
        store.insert(newer);
        store.insert(other);

        assertThat(store.list()).extracting(SessionSummary::id).containsExactly(other.id(), newer.id(), older.id());
        assertThat(store.listByWorkbook("Budget.xlsx")).extracting(SessionSummary::id)
            .containsExactly(newer.id(), older.id());
        assertThat(store.findActiveByWorkbook("Budget.xlsx").orElseThrow().id()).isEqualTo(newer.id());
        assertThat(store.findActiveByWorkbook("Missing.xlsx")).isEmpty();
    }

    @Test
    void shouldSearchPromptAndResponse() throws Exception {
        SqliteSessionStore store = new SqliteSessionStore(tempDir.resolve("sessions.db"));
        store.insert(CapturedSession.create("A", Instant.parse("2026-03-01T09:00:00Z"),
            List.of(Message.user("Build a pivot table"), Message.assistant("Done"))));
        store.insert(CapturedSession.create("B", Instant.parse("2026-03-01T09:01:00Z"),
            List.of(Message.user("Chart it"), Message.assistant("Added a VLOOKUP helper column"))));

        assertThat(store.search("pivot")).extracting(SessionSummary::workbookName).containsExactly("A");
        assertThat(store.search("vlookup")).extracting(SessionSummary::workbookName).containsExactly("B");
        assertThat(store.search("nothing like this")).isEmpty();
    }

    @Test
    void shouldTruncatePreviewToTwoHundredCharacters() throws Exception {
        SqliteSessionStore store = new SqliteSessionStore(tempDir.resolve("sessions.db"));
        store.insert(CapturedSession.create("A", Instant.now(), List.of(Message.user("p".repeat(500)))));

        assertThat(store.list().get(0).userPromptPreview()).hasSize(200);
    }

    @Test
    void shouldDeleteAndClear() throws Exception {
        SqliteSessionStore store = new SqliteSessionStore(tempDir.resolve("sessions.db"));
        CapturedSession first = CapturedSession.create("A", Instant.now(), List.of(Message.user("1")));
        store.insert(first);
        store.insert(CapturedSession.create("B", Instant.now(), List.of(Message.user("2"))));

        assertThat(store.delete(first.id())).isTrue();
        assertThat(store.delete(first.id())).isFalse();
        assertThat(store.count()).isEqualTo(1);

        store.clear();
        assertThat(store.count()).isZero();
    }

    @Test
    void shouldTreatCorruptTranscriptAsEmpty() throws Exception {
        Path db = tempDir.resolve("sessions.db");
        SqliteSessionStore store = new SqliteSessionStore(db);
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.executeUpdate(
                "INSERT INTO sessions (id, workbook_name, captured_at, model, user_prompt, assistant_response, transcript_json) "
                    + "VALUES ('broken', 'Book1', '2026-03-01T09:00:00.000000000Z', 'claude-for-excel', 'Q', 'A', '{oops')"
            );
        }

        CapturedSession loaded = store.findById("broken").orElseThrow();

        assertThat(loaded.messages()).isEmpty();
        assertThat(loaded.userPrompt()).isEqualTo("Q");
    }
}
