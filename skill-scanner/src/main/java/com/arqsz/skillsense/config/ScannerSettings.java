package com.arqsz.skillsense.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.constants.AcquisitionConstants;
import com.arqsz.skillsense.constants.ConfigConstants;
import com.arqsz.skillsense.constants.SecurityConstants;
import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.constants.ValidationConstants;

/**
 * Manages scanner configuration and API key lookup.
 * <p>
 * Values are layered: classpath defaults, then an optional external properties
 * file named by the {@code skillsense.config} system property, then environment
 * variables. Missing keys fall back to built-in defaults.
 */
public class ScannerSettings {

    private static final Logger log = LoggerFactory.getLogger(ScannerSettings.class);

    private final Properties properties;
    private final Map<String, ApiKey> keyCache;

    /**
     * Creates settings from already resolved properties
     * 
     * @param properties The configuration values
     */
    public ScannerSettings(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        this.keyCache = buildKeyCache();
    }

    /**
     * Loads settings from the classpath, the external file and the process environment
     * 
     * @return The loaded settings
     */
    public static ScannerSettings load() {
        return load(System.getProperty(ConfigConstants.EXTERNAL_CONFIG_PROPERTY), System.getenv());
    }

    /**
     * Loads settings with an explicit external file and environment
     * 
     * @param externalConfig Path of an extra properties file, or null
     * @param environment    Environment variables to apply last
     * @return The loaded settings
     * @throws IllegalStateException If a configuration file cannot be read
     */
    public static ScannerSettings load(String externalConfig, Map<String, String> environment) {
        Properties properties = new Properties();

        try (InputStream in = ScannerSettings.class.getResourceAsStream(ConfigConstants.CLASSPATH_CONFIG)) {
            if (in != null) {
                properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + ConfigConstants.CLASSPATH_CONFIG, e);
        }

        if (externalConfig != null && !externalConfig.isBlank()) {
            Path path = Path.of(externalConfig);
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                properties.load(reader);
                log.info("Loaded configuration from {}", path);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read configuration file " + path, e);
            }
        }

        applyEnvironment(properties, environment);
        return new ScannerSettings(properties);
    }

    /**
     * Maps a property key to its environment variable name
     * 
     * @param key The property key, e.g. {@code server.port}
     * @return The variable name, e.g. {@code SKILLSENSE_SERVER_PORT}
     */
    static String environmentName(String key) {
        return ConfigConstants.ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static void applyEnvironment(Properties properties, Map<String, String> environment) {
        List<String> keys = List.of(
                ConfigConstants.KEY_BIND_ADDRESS,
                ConfigConstants.KEY_PORT,
                ConfigConstants.KEY_ALLOWED_ORIGINS,
                ConfigConstants.KEY_API_KEYS,
                ConfigConstants.KEY_VALIDATOR_ENDPOINT,
                ConfigConstants.KEY_VALIDATOR_API_KEY,
                ConfigConstants.KEY_VALIDATOR_DEFAULT_MODEL,
                ConfigConstants.KEY_VALIDATOR_ESCALATED_MODEL,
                ConfigConstants.KEY_VALIDATOR_ESCALATED_EFFORT,
                ConfigConstants.KEY_VALIDATOR_TIMEOUT_SECONDS,
                ConfigConstants.KEY_VALIDATOR_MAX_OUTPUT_TOKENS,
                ConfigConstants.KEY_VALIDATOR_FAILURE_MODE,
                ConfigConstants.KEY_MAX_FILE_BYTES);

        String openAiKey = environment.get(ConfigConstants.ENV_OPENAI_API_KEY);
        if (openAiKey != null && !openAiKey.isBlank()) {
            properties.setProperty(ConfigConstants.KEY_VALIDATOR_API_KEY, openAiKey);
        }
        for (String key : keys) {
            String value = environment.get(environmentName(key));
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
    }

    /**
     * Gets all configured API keys
     * 
     * @return List of API keys, empty when authentication is disabled
     */
    public List<ApiKey> getApiKeys() {
        return new ArrayList<>(keyCache.values());
    }

    /**
     * Finds an API key by its token value
     * 
     * @param token The token to search for
     * @return The API key, or null if not found
     */
    public ApiKey findKeyByToken(String token) {
        return keyCache.get(token);
    }

    private Map<String, ApiKey> buildKeyCache() {
        Map<String, ApiKey> cache = new HashMap<>();
        String configured = properties.getProperty(ConfigConstants.KEY_API_KEYS);
        if (configured == null || configured.isBlank()) {
            return cache;
        }
        for (String entry : configured.split(SecurityConstants.API_KEY_ENTRY_SEPARATOR)) {
            if (entry.isBlank()) {
                continue;
            }
            ApiKey key = ApiKey.parse(entry);
            cache.put(key.token(), key);
        }
        return cache;
    }

    /**
     * Gets the configured bind IP address
     * 
     * @return The IP address
     */
    public String getIp() {
        return getString(ConfigConstants.KEY_BIND_ADDRESS, ServerConstants.DEFAULT_BIND_ADDRESS);
    }

    /**
     * Gets the configured port number
     * 
     * @return The port number
     */
    public int getPort() {
        return getInt(ConfigConstants.KEY_PORT, ServerConstants.DEFAULT_PORT);
    }

    /**
     * Gets the list of allowed CORS origins
     * 
     * @return List of allowed origin URLs
     */
    public List<String> getAllowedOrigins() {
        String origins = properties.getProperty(ConfigConstants.KEY_ALLOWED_ORIGINS);
        if (origins == null || origins.isBlank()) {
            return List.of(
                    ServerConstants.DEFAULT_ALLOWED_ORIGIN_LOCALHOST,
                    ServerConstants.DEFAULT_ALLOWED_ORIGIN_127);
        }
        return Arrays.stream(origins.split(","))
                .map(String::strip)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }

    public String getValidatorEndpoint() {
        return getString(ConfigConstants.KEY_VALIDATOR_ENDPOINT, ValidationConstants.DEFAULT_ENDPOINT);
    }

    /**
     * Gets the validator API key
     * 
     * @return The key, or null when none is configured
     */
    public String getValidatorApiKey() {
        String key = properties.getProperty(ConfigConstants.KEY_VALIDATOR_API_KEY);
        return key == null || key.isBlank() ? null : key.strip();
    }

    public String getValidatorDefaultModel() {
        return getString(ConfigConstants.KEY_VALIDATOR_DEFAULT_MODEL, ValidationConstants.DEFAULT_MODEL);
    }

    public String getValidatorEscalatedModel() {
        return getString(ConfigConstants.KEY_VALIDATOR_ESCALATED_MODEL, ValidationConstants.ESCALATED_MODEL);
    }

    public String getValidatorEscalatedEffort() {
        return getString(ConfigConstants.KEY_VALIDATOR_ESCALATED_EFFORT, ValidationConstants.ESCALATED_REASONING_EFFORT);
    }

    public int getValidatorTimeoutSeconds() {
        return getInt(ConfigConstants.KEY_VALIDATOR_TIMEOUT_SECONDS, ValidationConstants.DEFAULT_TIMEOUT_SECONDS);
    }

    public int getValidatorMaxOutputTokens() {
        return getInt(ConfigConstants.KEY_VALIDATOR_MAX_OUTPUT_TOKENS, ValidationConstants.DEFAULT_MAX_OUTPUT_TOKENS);
    }

    /**
     * Gets the behavior on validator failure
     * 
     * @return The configured mode, {@link FailureMode#FAIL_UNIT} by default
     */
    public FailureMode getFailureMode() {
        String mode = properties.getProperty(ConfigConstants.KEY_VALIDATOR_FAILURE_MODE);
        if (mode == null || mode.isBlank()) {
            return FailureMode.FAIL_UNIT;
        }
        try {
            return FailureMode.valueOf(mode.strip().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown " + ConfigConstants.KEY_VALIDATOR_FAILURE_MODE + ": " + mode, e);
        }
    }

    public long getMaxFileBytes() {
        String value = properties.getProperty(ConfigConstants.KEY_MAX_FILE_BYTES);
        if (value == null || value.isBlank()) {
            return AcquisitionConstants.DEFAULT_MAX_FILE_BYTES;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid " + ConfigConstants.KEY_MAX_FILE_BYTES + ": " + value, e);
        }
    }

    private String getString(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.strip();
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }
}
