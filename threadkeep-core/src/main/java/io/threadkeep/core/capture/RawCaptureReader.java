package io.threadkeep.core.capture;

import com.fasterxml.jackson.databind.JsonNode;
import io.threadkeep.core.model.Fragment;
import io.threadkeep.core.model.MessageRole;
import io.threadkeep.core.model.RawCapture;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the pushed snapshot shape {@code {"workbookName":"...","fragments":[{"role","text","position"}]}}.
 * Fragments with an unknown role are skipped.
 */
public final class RawCaptureReader {

    private RawCaptureReader() {
    }

    public static RawCapture fromJson(JsonNode body) {
        if (body == null || !body.path("fragments").isArray()) {
            throw new IllegalArgumentException("fragments must be an array");
        }
        List<Fragment> fragments = new ArrayList<>();
        for (JsonNode row : body.path("fragments")) {
            MessageRole role = MessageRole.fromWire(row.path("role").asText(null));
            if (role != null) {
                fragments.add(new Fragment(role, row.path("text").asText(""), row.path("position").asDouble(0)));
            }
        }
        return new RawCapture(body.path("workbookName").asText(""), fragments);
    }
}
