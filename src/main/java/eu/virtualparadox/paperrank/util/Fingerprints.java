package eu.virtualparadox.paperrank.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable cache keys: SHA-256 over the given parts.
 */
public final class Fingerprints {

    private static final char SEPARATOR = '\u001F';

    private Fingerprints() {
        // prevent instantiation
    }

    public static String of(final String... parts) {
        final StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                joined.append(SEPARATOR);
            }
            joined.append(parts[i] == null ? "" : parts[i]);
        }
        return sha256(joined.toString());
    }

    public static String sha256(final String text) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
