package com.acmeCables.proposalEngine.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON files from the classpath.
 */
public final class JsonFileLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonFileLoader() {
    }

    /**
     * Loads a JSON file from the classpath as a String.
     *
     * @param resourcePath The path to the JSON file (e.g., "data/rfps.json")
     * @return The JSON content as a String
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a JSON file from the classpath as a JsonNode.
     *
     * @throws IOException if the file cannot be read, doesn't exist, or is not valid JSON
     */
    public static JsonNode loadAsJsonNode(String resourcePath) throws IOException {
        return objectMapper.readTree(loadAsString(resourcePath));
    }
}
