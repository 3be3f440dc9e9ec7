package com.arqsz.skillsense.api.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.testutil.TestResponseSender;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.Headers;

@DisplayName("RulesHandler")
class RulesHandlerTest {

    private RulesHandler handler;
    private HttpServerExchange exchange;
    private TestResponseSender responseSender;
    private HeaderMap responseHeaders;

    @BeforeEach
    void setUp() {
        handler = new RulesHandler();

        exchange = mock(HttpServerExchange.class);
        responseHeaders = new HeaderMap();
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);

        responseSender = new TestResponseSender();
        when(exchange.getResponseSender()).thenReturn(responseSender);
    }

    @Test
    @DisplayName("should list every rule of the catalog as JSON")
    void shouldListCatalog() {
        handler.handleRequest(exchange);

        assertThat(responseHeaders.getFirst(Headers.CONTENT_TYPE)).isEqualTo(ServerConstants.CONTENT_TYPE_JSON);

        JsonArray rules = JsonParser.parseString(responseSender.getSentData()).getAsJsonArray();
        assertThat(rules).hasSize(18);
        assertThat(rules.get(0).getAsJsonObject().get("id").getAsString()).isEqualTo("SEC_PY_EVAL_001");
    }

    @Test
    @DisplayName("should expose applicability of each rule")
    void shouldExposeApplicability() {
        handler.handleRequest(exchange);

        JsonArray rules = JsonParser.parseString(responseSender.getSentData()).getAsJsonArray();
        JsonObject postinstall = null;
        JsonObject rmRf = null;
        for (JsonElement element : rules) {
            JsonObject rule = element.getAsJsonObject();
            String id = rule.get("id").getAsString();
            if (id.equals("SEC_DEP_POSTINSTALL_001")) {
                postinstall = rule;
            } else if (id.equals("SEC_FS_RM_RF_001")) {
                rmRf = rule;
            }
        }

        assertThat(postinstall).isNotNull();
        assertThat(postinstall.get("file_name_pattern").isJsonNull()).isFalse();
        assertThat(rmRf).isNotNull();
        assertThat(rmRf.get("file_extensions").isJsonNull())
                .as("Rules without an extension filter apply everywhere")
                .isTrue();
    }
}
