package com.arqsz.skillsense.api.handler;

import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.model.Rule;
import com.arqsz.skillsense.report.ReportJsonMapper;
import com.arqsz.skillsense.scanner.RuleCatalog;
import com.google.gson.JsonArray;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

/**
 * Handler listing the rule catalog
 */
public class RulesHandler implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        JsonArray rules = new JsonArray();
        for (Rule rule : RuleCatalog.rules()) {
            rules.add(ReportJsonMapper.ruleToJson(rule));
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, ServerConstants.CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(rules.toString());
    }
}
