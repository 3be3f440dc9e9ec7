package com.arqsz.skillsense.constants;

import io.undertow.util.HttpString;

/**
 * Constants for HTTP server configuration
 */
public final class ServerConstants {

    public static final String DEFAULT_BIND_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_PORT = 1337;
    public static final int DEFAULT_MAX_HEADER_SIZE = 8192;
    public static final int DEFAULT_MAX_PARAMETERS = 1000;
    public static final int DEFAULT_MAX_HEADERS = 200;
    public static final long DEFAULT_MAX_ENTITY_SIZE = 20L * 1024 * 1024;

    public static final String DEFAULT_ALLOWED_ORIGIN_LOCALHOST = "http://localhost";
    public static final String DEFAULT_ALLOWED_ORIGIN_127 = "http://127.0.0.1";

    public static final String HEADER_ACCESS_CONTROL_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String HEADER_ACCESS_CONTROL_ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";
    public static final String HEADER_ACCESS_CONTROL_ALLOW_METHODS = "Access-Control-Allow-Methods";
    public static final String HEADER_ACCESS_CONTROL_ALLOW_HEADERS = "Access-Control-Allow-Headers";
    public static final String HEADER_ACCESS_CONTROL_MAX_AGE = "Access-Control-Max-Age";
    public static final HttpString X_RATE_LIMIT_LIMIT = new HttpString("X-RateLimit-Limit");
    public static final HttpString X_RATE_LIMIT_REMAINING = new HttpString("X-RateLimit-Remaining");

    public static final String HTTP_METHODS_ALLOWED = "GET, POST, OPTIONS";
    public static final String HTTP_HEADERS_ALLOWED = "Authorization, Content-Type";
    public static final String CORS_MAX_AGE = "3600";

    public static final String HTTP_METHOD_OPTIONS = "OPTIONS";

    public static final String CONTENT_TYPE_JSON = "application/json";

    public static final String ENDPOINT_HEALTH = "/health";
    public static final String ENDPOINT_RULES = "/rules";
    public static final String ENDPOINT_ANALYZE = "/analyze";

    public static final String JSON_KEY_FILES = "files";
    public static final String JSON_KEY_PATH = "path";
    public static final String JSON_KEY_TEXT = "text";
    public static final String JSON_KEY_VALIDATE = "validate";
    public static final String JSON_KEY_ERROR = "error";
    public static final String JSON_KEY_STATUS = "status";
    public static final String JSON_KEY_CONTENT_HASH = "content_hash";
    public static final String JSON_KEY_OVERALL_SCORE = "overall_score";

    public static final String STATUS_OK = "ok";
    public static final String STATUS_FAILED = "failed";

    public static final int ANALYSIS_CACHE_SIZE = 256;

    private ServerConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
