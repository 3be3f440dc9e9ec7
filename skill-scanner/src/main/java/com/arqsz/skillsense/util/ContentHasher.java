package com.arqsz.skillsense.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

import com.arqsz.skillsense.model.ScannedFile;

/**
 * SHA-256 content hashing with line endings normalized to {@code \n}
 */
public final class ContentHasher {

    private static final String HASH_ALGORITHM = "SHA-256";

    /**
     * Hashes a single text
     * 
     * @param content The text to hash
     * @return Lowercase hex digest
     */
    public static String hash(String content) {
        MessageDigest digest = newDigest();
        return HexFormat.of().formatHex(digest.digest(normalize(content).getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Hashes an ordered file set; path and text both contribute
     * 
     * @param files The files in submission order
     * @return Lowercase hex digest
     */
    public static String hash(List<ScannedFile> files) {
        MessageDigest digest = newDigest();
        for (ScannedFile file : files) {
            digest.update(file.path().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(normalize(file.text()).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static String normalize(String content) {
        return content.replace("\r\n", "\n").replace("\r", "\n");
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " is not available", e);
        }
    }

    private ContentHasher() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
