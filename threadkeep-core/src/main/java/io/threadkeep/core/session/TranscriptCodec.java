package io.threadkeep.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.threadkeep.core.model.Message;
import io.threadkeep.core.model.MessageRole;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored transcript shape: {@code {"messages":[{"role":"user|assistant","content":"..."}]}}.
 */
public final class TranscriptCodec {
    private final ObjectMapper mapper;

    public TranscriptCodec() {
        this(new ObjectMapper());
    }

    public TranscriptCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(List<Message> messages) {
        try {
            return mapper.writeValueAsString(encodeTree(messages));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode transcript", e);
        }
    }

    public ObjectNode encodeTree(List<Message> messages) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode array = root.putArray("messages");
        for (Message message : messages) {
            ObjectNode row = array.addObject();
            row.put("role", message.role().wireName());
            row.put("content", message.content());
        }
        return root;
    }

    public DecodedTranscript decode(String json) {
        if (json == null || json.isBlank()) {
            return new DecodedTranscript.Unreadable("empty document");
        }
        try {
            return decode(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            return new DecodedTranscript.Unreadable("malformed JSON: " + e.getOriginalMessage());
        }
    }

    public DecodedTranscript decode(JsonNode root) {
        if (root == null || !root.isObject()) {
            return new DecodedTranscript.Unreadable("root is not an object");
        }
        JsonNode array = root.get("messages");
        if (array == null || !array.isArray()) {
            return new DecodedTranscript.Unreadable("messages is not an array");
        }
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode row = array.get(i);
            if (!row.isObject()) {
                return new DecodedTranscript.Unreadable("messages[" + i + "] is not an object");
            }
            MessageRole role = MessageRole.fromWire(row.path("role").asText(null));
            if (role == null) {
                return new DecodedTranscript.Unreadable("messages[" + i + "].role is not user or assistant");
            }
            JsonNode content = row.get("content");
            if (content == null || !content.isTextual()) {
                return new DecodedTranscript.Unreadable("messages[" + i + "].content is not a string");
            }
            messages.add(new Message(role, content.asText()));
        }
        return new DecodedTranscript.Parsed(messages);
    }
}
