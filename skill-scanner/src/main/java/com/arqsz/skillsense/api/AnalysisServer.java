package com.arqsz.skillsense.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.api.handler.AnalyzeHandler;
import com.arqsz.skillsense.api.handler.HealthHandler;
import com.arqsz.skillsense.api.handler.RulesHandler;
import com.arqsz.skillsense.api.middleware.AuthenticationMiddleware;
import com.arqsz.skillsense.api.middleware.CorsMiddleware;
import com.arqsz.skillsense.config.ScannerSettings;
import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.service.AnalysisCache;
import com.arqsz.skillsense.service.AnalysisService;
import com.arqsz.skillsense.service.AuthenticationService;

import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.StatusCodes;

/**
 * HTTP server exposing artifact analysis
 */
public class AnalysisServer {

    private static final Logger log = LoggerFactory.getLogger(AnalysisServer.class);

    private final ScannerSettings settings;
    private final AnalysisService analysisService;
    private final AuthenticationService authenticationService;
    private final AnalysisCache cache;

    private Undertow server;
    private AuthenticationMiddleware authenticationMiddleware;
    private volatile boolean running = false;

    public AnalysisServer(ScannerSettings settings, AnalysisService analysisService) {
        this.settings = settings;
        this.analysisService = analysisService;
        this.authenticationService = new AuthenticationService(settings);
        this.cache = new AnalysisCache(ServerConstants.ANALYSIS_CACHE_SIZE);
    }

    /**
     * Starts the analysis server
     */
    public void start() {
        if (!authenticationService.hasConfiguredKeys()) {
            log.warn("No API keys configured; every request will be rejected with 401");
        }

        HttpHandler routes = createRoutes();

        authenticationMiddleware = new AuthenticationMiddleware(authenticationService);
        HttpHandler withAuth = authenticationMiddleware.wrap(routes);
        HttpHandler withCors = new CorsMiddleware(settings).wrap(withAuth);

        server = Undertow.builder()
                .addHttpListener(settings.getPort(), settings.getIp())
                .setHandler(withCors)
                .setServerOption(UndertowOptions.MAX_HEADER_SIZE, ServerConstants.DEFAULT_MAX_HEADER_SIZE)
                .setServerOption(UndertowOptions.MAX_PARAMETERS, ServerConstants.DEFAULT_MAX_PARAMETERS)
                .setServerOption(UndertowOptions.MAX_HEADERS, ServerConstants.DEFAULT_MAX_HEADERS)
                .setServerOption(UndertowOptions.MAX_ENTITY_SIZE, ServerConstants.DEFAULT_MAX_ENTITY_SIZE)
                .setServerOption(UndertowOptions.ENABLE_STATISTICS, false)
                .build();

        server.start();
        running = true;
        log.info("SkillSense analysis server is live at {}:{}", settings.getIp(), settings.getPort());
    }

    /**
     * Stops the analysis server
     */
    public void stop() {
        if (server != null) {
            server.stop();
            server = null;
            running = false;
            log.info("SkillSense analysis server stopped");
        }
        if (authenticationMiddleware != null) {
            authenticationMiddleware.shutdown();
            authenticationMiddleware = null;
        }
    }

    /**
     * Checks if the server is currently running
     * 
     * @return true if running
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * Creates the routing handler with all endpoints
     * 
     * @return Configured routing handler
     */
    private HttpHandler createRoutes() {
        return new RoutingHandler()
                .get(ServerConstants.ENDPOINT_HEALTH, new HealthHandler())
                .get(ServerConstants.ENDPOINT_RULES, new RulesHandler())
                .post(ServerConstants.ENDPOINT_ANALYZE, new AnalyzeHandler(analysisService, cache))
                .setInvalidMethodHandler(exchange -> {
                    exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
                    exchange.getResponseSender().send("Method Not Allowed");
                });
    }
}
