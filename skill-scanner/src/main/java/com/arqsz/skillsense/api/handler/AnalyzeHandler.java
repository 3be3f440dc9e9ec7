package com.arqsz.skillsense.api.handler;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.model.AnalysisReport;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.report.ReportJsonMapper;
import com.arqsz.skillsense.scanner.ScoringEngine;
import com.arqsz.skillsense.service.AnalysisCache;
import com.arqsz.skillsense.service.AnalysisFailedException;
import com.arqsz.skillsense.service.AnalysisService;
import com.arqsz.skillsense.util.ContentHasher;
import com.arqsz.skillsense.util.StrictJson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;

/**
 * Handler for the analyze endpoint.
 * <p>
 * The body is read asynchronously; the analysis itself runs on a worker thread
 * since validation may block on the external validator.
 */
public class AnalyzeHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeHandler.class);

    private final AnalysisService analysisService;
    private final AnalysisCache cache;
    private final ScoringEngine scoringEngine = new ScoringEngine();

    public AnalyzeHandler(AnalysisService analysisService, AnalysisCache cache) {
        this.analysisService = analysisService;
        this.cache = cache;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!exchange.getRequestMethod().equalToString("POST")) {
            exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
            exchange.getResponseSender().send("Method Not Allowed");
            return;
        }

        exchange.getRequestReceiver().receiveFullString(
                (ex, message) -> ex.dispatch(() -> processAnalysis(ex, message)),
                StandardCharsets.UTF_8);
    }

    /**
     * Parses the request body, runs or reuses the analysis and writes the response
     * 
     * @param exchange The exchange to respond on
     * @param body     The raw request body
     */
    void processAnalysis(HttpServerExchange exchange, String body) {
        AnalyzeRequest request;
        try {
            request = parseRequest(body);
        } catch (IllegalArgumentException | JsonParseException | IllegalStateException e) {
            log.debug("Rejected analyze request: {}", e.getMessage());
            sendError(exchange, StatusCodes.BAD_REQUEST, errorBody(null, "Invalid request body: " + e.getMessage()));
            return;
        }

        String contentHash = ContentHasher.hash(request.files());
        AnalysisReport report = cache.get(contentHash, request.validate());
        if (report == null) {
            try {
                report = analysisService.analyze(request.files(), request.validate());
            } catch (AnalysisFailedException e) {
                sendError(exchange, StatusCodes.BAD_GATEWAY, errorBody(ServerConstants.STATUS_FAILED, e.getMessage()));
                return;
            }
            cache.put(contentHash, request.validate(), report);
        } else {
            log.debug("Serving cached analysis for {}", contentHash);
        }

        JsonObject response = ReportJsonMapper.toJson(report);
        response.addProperty(ServerConstants.JSON_KEY_CONTENT_HASH, contentHash);
        response.addProperty(ServerConstants.JSON_KEY_OVERALL_SCORE, scoringEngine.overallScore(report.riskScore()));

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, ServerConstants.CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(response.toString());
    }

    static AnalyzeRequest parseRequest(String body) {
        JsonElement parsed = StrictJson.parse(body);
        if (!parsed.isJsonObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }
        JsonObject json = parsed.getAsJsonObject();

        JsonElement filesElement = json.get(ServerConstants.JSON_KEY_FILES);
        if (filesElement == null || !filesElement.isJsonArray()) {
            throw new IllegalArgumentException("'" + ServerConstants.JSON_KEY_FILES + "' must be an array");
        }

        List<ScannedFile> files = new ArrayList<>();
        JsonArray filesArray = filesElement.getAsJsonArray();
        for (JsonElement entry : filesArray) {
            if (!entry.isJsonObject()) {
                throw new IllegalArgumentException("every file must be an object");
            }
            JsonObject file = entry.getAsJsonObject();
            files.add(new ScannedFile(
                    requireString(file, ServerConstants.JSON_KEY_PATH),
                    requireString(file, ServerConstants.JSON_KEY_TEXT)));
        }

        boolean validate = false;
        JsonElement validateElement = json.get(ServerConstants.JSON_KEY_VALIDATE);
        if (validateElement != null && !validateElement.isJsonNull()) {
            if (!validateElement.isJsonPrimitive() || !validateElement.getAsJsonPrimitive().isBoolean()) {
                throw new IllegalArgumentException("'" + ServerConstants.JSON_KEY_VALIDATE + "' must be a boolean");
            }
            validate = validateElement.getAsBoolean();
        }
        return new AnalyzeRequest(files, validate);
    }

    private static String requireString(JsonObject json, String key) {
        JsonElement value = json.get(key);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException("'" + key + "' must be a string");
        }
        return value.getAsString();
    }

    private static JsonObject errorBody(String status, String message) {
        JsonObject error = new JsonObject();
        if (status != null) {
            error.addProperty(ServerConstants.JSON_KEY_STATUS, status);
        }
        error.addProperty(ServerConstants.JSON_KEY_ERROR, message);
        return error;
    }

    private static void sendError(HttpServerExchange exchange, int statusCode, JsonObject error) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, ServerConstants.CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(error.toString());
    }

    record AnalyzeRequest(List<ScannedFile> files, boolean validate) {
    }
}
