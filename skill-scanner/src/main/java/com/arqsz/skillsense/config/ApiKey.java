package com.arqsz.skillsense.config;

import java.security.SecureRandom;
import java.util.Base64;

import com.arqsz.skillsense.constants.SecurityConstants;

/**
 * Represents an API key for authentication
 */
public record ApiKey(String name, String token) {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public ApiKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("API key name must not be blank");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("API key token must not be blank");
        }
    }

    /**
     * Creates a new API key with the given name
     * 
     * @param name The name/description for this API key
     * @return A new ApiKey instance
     */
    public static ApiKey create(String name) {
        return new ApiKey(name, generateToken());
    }

    /**
     * Parses a configured {@code name:token} entry
     * 
     * @param entry The configured entry
     * @return The parsed key
     * @throws IllegalArgumentException If the entry has no name or token
     */
    public static ApiKey parse(String entry) {
        String trimmed = entry.strip();
        int separator = trimmed.indexOf(SecurityConstants.API_KEY_NAME_SEPARATOR);
        if (separator <= 0 || separator == trimmed.length() - 1) {
            throw new IllegalArgumentException("API key entry must have the form name:token");
        }
        return new ApiKey(trimmed.substring(0, separator).strip(), trimmed.substring(separator + 1).strip());
    }

    /**
     * Formats this key as a configuration entry
     * 
     * @return The {@code name:token} form
     */
    public String toEntry() {
        return name + SecurityConstants.API_KEY_NAME_SEPARATOR + token;
    }

    /**
     * Generates a random token
     * 
     * @return A URL-safe base64 encoded token
     */
    private static String generateToken() {
        byte[] randomBytes = new byte[SecurityConstants.API_TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    @Override
    public String toString() {
        return "ApiKey[name=" + name + "]";
    }
}
