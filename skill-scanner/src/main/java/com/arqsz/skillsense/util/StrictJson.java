package com.arqsz.skillsense.util;

import java.io.IOException;
import java.io.StringReader;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

/**
 * RFC 8259 JSON parsing: unquoted names, single quotes, comments and trailing
 * content are all rejected
 */
public final class StrictJson {

    /**
     * Parses one strict JSON document
     *
     * @param text The JSON text
     * @return The parsed element
     * @throws JsonParseException If the text is not exactly one well-formed JSON value
     */
    public static JsonElement parse(String text) {
        try (JsonReader reader = new JsonReader(new StringReader(text))) {
            reader.setStrictness(Strictness.STRICT);
            JsonElement root = JsonParser.parseReader(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonSyntaxException("Unexpected content after the JSON document");
            }
            return root;
        } catch (IOException | IllegalStateException e) {
            throw new JsonSyntaxException(e.getMessage(), e);
        }
    }

    private StrictJson() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
