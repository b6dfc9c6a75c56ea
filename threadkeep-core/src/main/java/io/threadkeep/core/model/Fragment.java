package io.threadkeep.core.model;

import java.util.Objects;

/**
 * One piece of on-screen text, already tagged with a role by the probe. The position is a vertical
 * screen coordinate and only orders fragments within a single capture.
 */
public record Fragment(MessageRole role, String text, double position) {

    public Fragment {
        Objects.requireNonNull(role, "role must not be null");
        text = text == null ? "" : text;
    }
}
