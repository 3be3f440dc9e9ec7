package com.arqsz.skillsense.service;

import java.util.Optional;

import com.arqsz.skillsense.config.ApiKey;
import com.arqsz.skillsense.config.ScannerSettings;
import com.arqsz.skillsense.constants.SecurityConstants;

/**
 * Service for handling API authentication
 */
public class AuthenticationService {

    private final ScannerSettings settings;

    public AuthenticationService(ScannerSettings settings) {
        this.settings = settings;
    }

    /**
     * Validates a Bearer token from an Authorization header
     * 
     * @param authHeader The Authorization header value
     * @return An Optional containing the API key if valid, empty otherwise
     */
    public Optional<ApiKey> validateBearerToken(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(SecurityConstants.AUTH_HEADER_PREFIX)) {
            return Optional.empty();
        }

        String token = authHeader.substring(SecurityConstants.AUTH_HEADER_PREFIX_LENGTH);
        if (token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(settings.findKeyByToken(token));
    }

    /**
     * Checks whether any API key is configured
     * 
     * @return true if at least one key can authenticate
     */
    public boolean hasConfiguredKeys() {
        return !settings.getApiKeys().isEmpty();
    }
}
