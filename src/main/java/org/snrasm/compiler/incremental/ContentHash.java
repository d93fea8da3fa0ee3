package org.snrasm.compiler.incremental;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digests used as cache keys.
 */
public final class ContentHash {

    private ContentHash() {
    }

    /**
     * Hashes the given parts. Parts are separated by a NUL so that {@code ("ab", "c")} and
     * {@code ("a", "bc")} give different digests.
     *
     * @param parts The texts to hash, in order.
     * @return The lower-case hex digest.
     */
    public static String of(String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String part : parts) {
                digest.update(part.getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
