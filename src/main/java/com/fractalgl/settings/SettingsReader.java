package com.fractalgl.settings;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a render request from a JSON document such as
 * <pre>
 * {"equation": "z^{3}+c", "iterations": 200, "coloring": "domain", "julia": true}
 * </pre>
 * Every field is optional; missing ones keep the values of {@link RenderRequest#defaults()}.
 */
public class SettingsReader {
    private final JsonFactory factory = new JsonFactory();

    public RenderRequest read(Path path) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            return read(input);
        }
    }

    public RenderRequest read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Settings must be a JSON object");
            }
            RenderRequest request = readObject(parser);
            if (parser.nextToken() != null) {
                throw new IOException("Unexpected content after settings object: " + parser.currentToken());
            }
            return request;
        }
    }

    private RenderRequest readObject(JsonParser parser) throws IOException {
        RenderRequest defaults = RenderRequest.defaults();
        String equation = defaults.equation();
        RenderSettings settings = defaults.settings();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken token = parser.nextToken();

            switch (fieldName) {
                case "equation" -> equation = readString(parser, token, fieldName);
                case "iterations" -> settings = settings.withIterations(readInt(parser, token, fieldName));
                case "breakout" -> settings = settings.withBreakout(readDouble(parser, token, fieldName));
                case "coloring" -> settings = settings.withColoring(readString(parser, token, fieldName));
                case "bias" -> settings = settings.withBias(readDouble(parser, token, fieldName));
                case "hueShift" -> settings = settings.withHueShift(readDouble(parser, token, fieldName));
                case "julia" -> settings = settings.withJulia(readBoolean(parser, token, fieldName));
                case "smooth" -> settings = settings.withSmooth(readBoolean(parser, token, fieldName));
                default -> throw new IOException("Unknown setting: " + fieldName);
            }
        }

        return new RenderRequest(equation, settings);
    }

    private String readString(JsonParser parser, JsonToken token, String field) throws IOException {
        if (token != JsonToken.VALUE_STRING) {
            throw unexpected(token, field);
        }
        return parser.getText();
    }

    private int readInt(JsonParser parser, JsonToken token, String field) throws IOException {
        if (token != JsonToken.VALUE_NUMBER_INT) {
            throw unexpected(token, field);
        }
        return parser.getIntValue();
    }

    private double readDouble(JsonParser parser, JsonToken token, String field) throws IOException {
        return switch (token) {
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            default -> throw unexpected(token, field);
        };
    }

    private boolean readBoolean(JsonParser parser, JsonToken token, String field) throws IOException {
        return switch (token) {
            case VALUE_TRUE -> true;
            case VALUE_FALSE -> false;
            default -> throw unexpected(token, field);
        };
    }

    private IOException unexpected(JsonToken token, String field) {
        return new IOException("Unexpected JSON token for '" + field + "': " + token);
    }
}
