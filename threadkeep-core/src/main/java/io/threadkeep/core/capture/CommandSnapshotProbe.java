package io.threadkeep.core.capture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.threadkeep.core.model.Fragment;
import io.threadkeep.core.model.MessageRole;
import io.threadkeep.core.model.RawCapture;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external capture command and parses its output.
 *
 * <p>The command prints one Base64 encoded JSON document:
 * {@code {"found":true,"workbookName":"Book1","messages":[{"role":"user","content":"...","y":120}]}}.
 * Base64 keeps control characters from the screen reader out of the process pipe.
 */
public final class CommandSnapshotProbe implements SnapshotProbe {
    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public CommandSnapshotProbe(List<String> command, Duration timeout) {
        Objects.requireNonNull(command, "command must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public Optional<RawCapture> capture() throws IOException {
        // Output goes through a file: a large capture would otherwise fill the pipe and stall the child.
        Path output = Files.createTempFile("threadkeep-capture", ".out");
        Process process = null;
        try {
            process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .redirectOutput(output.toFile())
                .start();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("capture command timed out after " + timeout.toMillis() + "ms");
            }
            if (process.exitValue() != 0) {
                throw new IOException("capture command exited with code " + process.exitValue());
            }
            return parse(Files.readString(output, StandardCharsets.UTF_8));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("capture command interrupted", ie);
        } finally {
            Files.deleteIfExists(output);
        }
    }

    Optional<RawCapture> parse(String output) throws IOException {
        String trimmed = output == null ? "" : output.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        String json;
        try {
            json = new String(Base64.getMimeDecoder().decode(trimmed), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IOException("capture output is not valid Base64", e);
        }

        JsonNode root = mapper.readTree(json);
        if (!root.path("found").asBoolean(false)) {
            return Optional.empty();
        }
        JsonNode messages = root.path("messages");
        // PowerShell's ConvertTo-Json collapses a single-element array into an object.
        List<JsonNode> rows = new ArrayList<>();
        if (messages.isArray()) {
            messages.forEach(rows::add);
        } else if (messages.isObject()) {
            rows.add(messages);
        }

        List<Fragment> fragments = new ArrayList<>();
        for (JsonNode row : rows) {
            MessageRole role = MessageRole.fromWire(row.path("role").asText(null));
            if (role == null) {
                continue;
            }
            fragments.add(new Fragment(role, row.path("content").asText(""), row.path("y").asDouble(0)));
        }
        if (fragments.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RawCapture(root.path("workbookName").asText(""), fragments));
    }
}
