package com.arqsz.skillsense.scanner;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import com.arqsz.skillsense.constants.ScanConstants;

/**
 * Derives stable finding ids of the form {@code <RULE_ID>_<8 hex chars>}
 */
public final class FindingIdGenerator {

    /**
     * Generates the id of a finding. The same inputs always yield the same id,
     * across runs and processes.
     * 
     * @param ruleId    Id of the rule or manifest check
     * @param filePath  Path of the file
     * @param lineStart 1-indexed line, or null
     * @param evidence  Normalized evidence text
     * @return Rule id followed by a short hex digest
     */
    public static String generate(String ruleId, String filePath, Integer lineStart, String evidence) {
        String rawId = String.join(
                ScanConstants.ID_SEPARATOR,
                ruleId,
                filePath,
                lineStart == null ? ScanConstants.ID_NO_LINE : lineStart.toString(),
                evidence);

        try {
            MessageDigest digest = MessageDigest.getInstance(ScanConstants.ID_HASH_ALGORITHM);
            byte[] hash = digest.digest(rawId.getBytes(StandardCharsets.UTF_8));

            StringBuilder hexString = new StringBuilder(ruleId).append(ScanConstants.ID_PREFIX_SEPARATOR);
            for (int i = 0; i < ScanConstants.ID_HASH_OUTPUT_BYTES; i++) {
                String hex = Integer.toHexString(0xff & hash[i]);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();

        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ScanConstants.ID_HASH_ALGORITHM + " is not available", e);
        }
    }

    private FindingIdGenerator() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
