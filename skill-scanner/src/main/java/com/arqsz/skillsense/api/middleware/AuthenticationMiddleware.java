package com.arqsz.skillsense.api.middleware;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.config.ApiKey;
import com.arqsz.skillsense.constants.SecurityConstants;
import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.service.AuthenticationService;
import com.google.gson.JsonObject;

import io.undertow.server.HttpHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;

/**
 * Middleware for API authentication using Bearer tokens, with per-client rate limiting
 */
public class AuthenticationMiddleware {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationMiddleware.class);

    private final AuthenticationService authenticationService;
    private final RateLimiter rateLimiter;

    public AuthenticationMiddleware(AuthenticationService authenticationService) {
        this(authenticationService,
                new RateLimiter(SecurityConstants.MAX_REQUESTS_PER_MINUTE, SecurityConstants.WINDOW_SECONDS));
    }

    public AuthenticationMiddleware(AuthenticationService authenticationService, RateLimiter rateLimiter) {
        this.authenticationService = authenticationService;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Wraps a handler with authentication and rate limiting
     * 
     * @param next The next handler in the chain
     * @return A handler with authentication and rate limiting
     */
    public HttpHandler wrap(HttpHandler next) {
        return exchange -> {
            String clientIp = exchange.getSourceAddress().getAddress().getHostAddress();

            if (!rateLimiter.allowRequest(clientIp)) {
                log.info("Rate limit exceeded for IP: {}", clientIp);

                JsonObject error = new JsonObject();
                error.addProperty(ServerConstants.JSON_KEY_ERROR, "Too many requests. Please try again later.");
                exchange.setStatusCode(StatusCodes.TOO_MANY_REQUESTS);
                exchange.getResponseHeaders().put(
                        Headers.RETRY_AFTER,
                        String.valueOf(rateLimiter.getResetTime(clientIp)));
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, ServerConstants.CONTENT_TYPE_JSON);
                exchange.getResponseSender().send(error.toString());
                return;
            }

            String authHeader = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
            Optional<ApiKey> apiKey = authenticationService.validateBearerToken(authHeader);

            if (apiKey.isEmpty()) {
                log.info("Failed authentication attempt from IP: {}", clientIp);
                exchange.setStatusCode(StatusCodes.UNAUTHORIZED);
                return;
            }

            exchange.getResponseHeaders().put(
                    ServerConstants.X_RATE_LIMIT_LIMIT,
                    String.valueOf(SecurityConstants.MAX_REQUESTS_PER_MINUTE));
            exchange.getResponseHeaders().put(
                    ServerConstants.X_RATE_LIMIT_REMAINING,
                    String.valueOf(rateLimiter.getRemainingRequests(clientIp)));

            log.debug("Authenticated request from {} with key {}", clientIp, apiKey.get().name());
            next.handleRequest(exchange);
        };
    }

    /**
     * Releases the rate limiter resources
     */
    public void shutdown() {
        rateLimiter.shutdown();
    }
}
