package com.arqsz.skillsense.api.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.testutil.TestResponseSender;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.Headers;

@DisplayName("HealthHandler")
class HealthHandlerTest {

    private HealthHandler handler;
    private HttpServerExchange exchange;
    private TestResponseSender responseSender;
    private HeaderMap responseHeaders;

    @BeforeEach
    void setUp() {
        handler = new HealthHandler();

        exchange = mock(HttpServerExchange.class);
        responseHeaders = new HeaderMap();
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);

        responseSender = new TestResponseSender();
        when(exchange.getResponseSender()).thenReturn(responseSender);
    }

    @Test
    @DisplayName("should return ok status with correct content type")
    void shouldReturnOkStatusWithCorrectContentType() {
        handler.handleRequest(exchange);

        assertThat(responseHeaders.getFirst(Headers.CONTENT_TYPE))
                .isEqualTo(ServerConstants.CONTENT_TYPE_JSON);

        JsonObject body = JsonParser.parseString(responseSender.getSentData()).getAsJsonObject();
        assertThat(body.get("status").getAsString()).isEqualTo(ServerConstants.STATUS_OK);
        assertThat(body.get("rules").getAsInt()).isEqualTo(18);
    }

    @Test
    @DisplayName("should handle multiple requests")
    void shouldHandleMultipleRequests() {
        handler.handleRequest(exchange);
        String first = responseSender.getSentData();

        handler.handleRequest(exchange);

        assertThat(responseSender.getSentData()).isEqualTo(first);
    }
}
