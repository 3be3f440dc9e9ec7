package com.arqsz.skillsense.validation;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.config.ScannerSettings;
import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.constants.ValidationConstants;
import com.arqsz.skillsense.model.ValidatedSecurity;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Validator backed by the OpenAI Responses API.
 * <p>
 * One request per call with a bounded timeout; failures surface as {@link ValidationException}
 * and are never retried here.
 */
public class OpenAiFindingValidator implements FindingValidator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiFindingValidator.class);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;
    private final int maxOutputTokens;
    private final ValidationResponseParser responseParser;

    public OpenAiFindingValidator(ScannerSettings settings) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(settings.getValidatorTimeoutSeconds()))
                .build(),
                URI.create(settings.getValidatorEndpoint()),
                settings.getValidatorApiKey(),
                Duration.ofSeconds(settings.getValidatorTimeoutSeconds()),
                settings.getValidatorMaxOutputTokens(),
                new ValidationResponseParser());
    }

    public OpenAiFindingValidator(
            HttpClient httpClient,
            URI endpoint,
            String apiKey,
            Duration timeout,
            int maxOutputTokens,
            ValidationResponseParser responseParser) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.maxOutputTokens = maxOutputTokens;
        this.responseParser = responseParser;
    }

    @Override
    public ValidatedSecurity validate(ValidationRequest request) throws ValidationException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ValidationException(
                    ValidationException.Kind.TRANSPORT, "Validator API key must be set for finding validation.");
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", ServerConstants.CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request).toString()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.error("Validator call timed out after {}s", timeout.toSeconds());
            throw new ValidationException(ValidationException.Kind.TIMEOUT,
                    "Validator call timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            log.error("Validator call failed: {}", e.getMessage());
            throw new ValidationException(ValidationException.Kind.TRANSPORT,
                    "Validator call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ValidationException(ValidationException.Kind.TRANSPORT, "Validator call interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            log.error("Validator returned HTTP {}", response.statusCode());
            throw new ValidationException(ValidationException.Kind.HTTP_STATUS,
                    "Validator returned HTTP " + response.statusCode() + ": " + response.body());
        }
        return responseParser.parse(response.body());
    }

    /**
     * Builds the Responses API body: system and user messages, token cap, optional
     * reasoning effort, and the strict JSON schema as output format
     * 
     * @param request The validation request
     * @return The request body
     */
    JsonObject buildRequestBody(ValidationRequest request) {
        JsonObject body = new JsonObject();
        body.addProperty("model", request.profile().model());

        JsonArray input = new JsonArray();
        input.add(message("system", ValidationConstants.SYSTEM_INSTRUCTION));
        input.add(message("user", ValidationJsonMapper.toTaskPayload(request).toString()));
        body.add("input", input);
        body.addProperty("max_output_tokens", maxOutputTokens);

        if (request.profile().reasoningEffort() != null) {
            JsonObject reasoning = new JsonObject();
            reasoning.addProperty("effort", request.profile().reasoningEffort());
            body.add("reasoning", reasoning);
        }

        JsonObject format = new JsonObject();
        format.addProperty("type", "json_schema");
        format.addProperty("name", ValidationConstants.SCHEMA_NAME);
        format.addProperty("strict", true);
        format.add("schema", ValidationJsonMapper.responseSchema());
        JsonObject text = new JsonObject();
        text.add("format", format);
        body.add("text", text);

        return body;
    }

    private static JsonObject message(String role, String text) {
        JsonObject content = new JsonObject();
        content.addProperty("type", "input_text");
        content.addProperty("text", text);
        JsonArray contents = new JsonArray();
        contents.add(content);

        JsonObject message = new JsonObject();
        message.addProperty("role", role);
        message.add("content", contents);
        return message;
    }
}
