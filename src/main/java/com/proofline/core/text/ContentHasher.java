package com.proofline.core.text;

import com.proofline.core.model.TaskValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Hex content hashes used for change detection between passes.
 * <p>
 * Accepts the short lower-case names stored on tasks ({@code sha256}, {@code md5}, ...)
 * as well as the JCA algorithm names.
 */
public final class ContentHasher {

    private static final Map<String, String> ALIASES = Map.of(
            "md5", "MD5",
            "sha1", "SHA-1",
            "sha224", "SHA-224",
            "sha256", "SHA-256",
            "sha384", "SHA-384",
            "sha512", "SHA-512",
            "sha3_256", "SHA3-256",
            "sha3_512", "SHA3-512"
    );

    private ContentHasher() {}

    /**
     * Hashes {@code text} (null is treated as empty) encoded as UTF-8.
     *
     * @throws TaskValidationException when the algorithm is unknown
     */
    public static String hash(String text, String method) {
        MessageDigest digest = digestFor(method);
        byte[] bytes = (text == null ? "" : text).getBytes(StandardCharsets.UTF_8);
        return HexFormat.of().formatHex(digest.digest(bytes));
    }

    /**
     * Fails fast on an unknown algorithm before any row is read.
     */
    public static void requireSupported(String method) {
        digestFor(method);
    }

    private static MessageDigest digestFor(String method) {
        if (method == null || method.isBlank()) {
            throw new TaskValidationException("Hash algorithm not specified");
        }
        String key = method.trim().toLowerCase(Locale.ROOT);
        String algorithm = ALIASES.getOrDefault(key, method.trim());
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new TaskValidationException("Unsupported hash algorithm: " + method, e);
        }
    }
}
