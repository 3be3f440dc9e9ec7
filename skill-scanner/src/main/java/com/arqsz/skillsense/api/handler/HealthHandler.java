package com.arqsz.skillsense.api.handler;

import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.scanner.RuleCatalog;
import com.google.gson.JsonObject;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

/**
 * Handler for the health check endpoint
 */
public class HealthHandler implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        JsonObject response = new JsonObject();
        response.addProperty(ServerConstants.JSON_KEY_STATUS, ServerConstants.STATUS_OK);
        response.addProperty("rules", RuleCatalog.rules().size());

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, ServerConstants.CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(response.toString());
    }
}
