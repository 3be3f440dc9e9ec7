package com.arqsz.skillsense.api.middleware;

import java.util.List;

import com.arqsz.skillsense.config.ScannerSettings;
import com.arqsz.skillsense.constants.ServerConstants;

import io.undertow.server.HttpHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;

/**
 * Middleware restricting browser callers to the configured origins
 */
public class CorsMiddleware {

    private final List<String> allowedOrigins;

    public CorsMiddleware(ScannerSettings settings) {
        this(settings.getAllowedOrigins());
    }

    public CorsMiddleware(List<String> allowedOrigins) {
        this.allowedOrigins = List.copyOf(allowedOrigins);
    }

    /**
     * Wraps a handler with CORS support.
     * Requests from an unknown origin are rejected with 403; preflight requests end here with 204.
     * 
     * @param next The next handler in the chain
     * @return A handler with CORS support
     */
    public HttpHandler wrap(HttpHandler next) {
        return exchange -> {
            String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);

            if (origin != null && !allowedOrigins.contains(origin)) {
                exchange.setStatusCode(StatusCodes.FORBIDDEN);
                return;
            }
            if (origin != null) {
                exchange.getResponseHeaders().put(
                        new HttpString(ServerConstants.HEADER_ACCESS_CONTROL_ALLOW_ORIGIN),
                        origin);
                exchange.getResponseHeaders().put(
                        new HttpString(ServerConstants.HEADER_ACCESS_CONTROL_ALLOW_CREDENTIALS),
                        "true");
            }

            exchange.getResponseHeaders().put(
                    new HttpString(ServerConstants.HEADER_ACCESS_CONTROL_ALLOW_METHODS),
                    ServerConstants.HTTP_METHODS_ALLOWED);
            exchange.getResponseHeaders().put(
                    new HttpString(ServerConstants.HEADER_ACCESS_CONTROL_ALLOW_HEADERS),
                    ServerConstants.HTTP_HEADERS_ALLOWED);
            exchange.getResponseHeaders().put(
                    new HttpString(ServerConstants.HEADER_ACCESS_CONTROL_MAX_AGE),
                    ServerConstants.CORS_MAX_AGE);

            if (exchange.getRequestMethod().equalToString(ServerConstants.HTTP_METHOD_OPTIONS)) {
                exchange.setStatusCode(StatusCodes.NO_CONTENT);
                return;
            }

            next.handleRequest(exchange);
        };
    }
}
