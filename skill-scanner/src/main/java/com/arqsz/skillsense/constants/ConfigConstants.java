package com.arqsz.skillsense.constants;

/**
 * Configuration keys, file locations and environment overrides
 */
public final class ConfigConstants {

    public static final String CLASSPATH_CONFIG = "/skillsense.properties";
    public static final String EXTERNAL_CONFIG_PROPERTY = "skillsense.config";

    public static final String KEY_BIND_ADDRESS = "server.bind-address";
    public static final String KEY_PORT = "server.port";
    public static final String KEY_ALLOWED_ORIGINS = "server.allowed-origins";
    public static final String KEY_API_KEYS = "server.api-keys";

    public static final String KEY_VALIDATOR_ENDPOINT = "validator.endpoint";
    public static final String KEY_VALIDATOR_API_KEY = "validator.api-key";
    public static final String KEY_VALIDATOR_DEFAULT_MODEL = "validator.default-model";
    public static final String KEY_VALIDATOR_ESCALATED_MODEL = "validator.escalated-model";
    public static final String KEY_VALIDATOR_ESCALATED_EFFORT = "validator.escalated-effort";
    public static final String KEY_VALIDATOR_TIMEOUT_SECONDS = "validator.timeout-seconds";
    public static final String KEY_VALIDATOR_MAX_OUTPUT_TOKENS = "validator.max-output-tokens";
    public static final String KEY_VALIDATOR_FAILURE_MODE = "validator.failure-mode";

    public static final String KEY_MAX_FILE_BYTES = "acquisition.max-file-bytes";

    public static final String ENV_PREFIX = "SKILLSENSE_";
    public static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";

    private ConfigConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
