package io.threadkeep.core.capture;

import java.util.Locale;

/**
 * Approximate identity keys for captured text.
 *
 * <p>The key is a 32-bit {@code h * 31 + c} rolling hash rendered as signed hexadecimal. It is not
 * collision free: two different messages sharing a fingerprint are merged as if one were a partial
 * capture of the other.
 */
public final class Fingerprints {
    static final int PREFIX_LENGTH = 100;

    private Fingerprints() {
    }

    /**
     * Fingerprint of a message: the first 100 characters, lower-cased and trimmed.
     */
    public static String ofContent(String content) {
        String value = content == null ? "" : content;
        String prefix = value.length() > PREFIX_LENGTH ? value.substring(0, PREFIX_LENGTH) : value;
        return rollingHash(prefix.toLowerCase(Locale.ROOT).trim());
    }

    public static String rollingHash(String value) {
        int hash = 0;
        for (int i = 0; i < value.length(); i++) {
            hash = 31 * hash + value.charAt(i);
        }
        return Integer.toString(hash, 16);
    }
}
