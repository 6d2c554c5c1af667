package com.refinement_copilot.common.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Locates a JSON object inside free-form model output
 */
@Slf4j
@UtilityClass
public class JsonUtils {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final String JSON_CODE_BLOCK_START = "```json";
    private static final String CODE_BLOCK_DELIMITER = "```";
    private static final int JSON_CODE_BLOCK_START_LENGTH = JSON_CODE_BLOCK_START.length();
    private static final int CODE_BLOCK_DELIMITER_LENGTH = CODE_BLOCK_DELIMITER.length();

    /**
     * Extracts the first valid JSON object from a model response.
     * Looks in a ```json block first, then a generic ``` block, then the raw text.
     *
     * @return the JSON object text, or empty when the response holds no valid object
     */
    public static Optional<String> extractJsonObject(String response) {
        if (response == null || response.trim().isEmpty()) {
            return Optional.empty();
        }

        String extracted = extractFromJsonCodeBlock(response);
        if (extracted != null) {
            return Optional.of(extracted);
        }

        extracted = extractFromGenericCodeBlock(response);
        if (extracted != null) {
            return Optional.of(extracted);
        }

        extracted = findCompleteJsonObject(response);
        if (isValidJsonObject(extracted)) {
            return Optional.of(extracted);
        }

        log.debug("Could not extract a JSON object from response: {}", response);
        return Optional.empty();
    }

    private static String extractFromJsonCodeBlock(String response) {
        if (!response.contains(JSON_CODE_BLOCK_START)) {
            return null;
        }

        int jsonStart = response.indexOf(JSON_CODE_BLOCK_START) + JSON_CODE_BLOCK_START_LENGTH;
        int jsonEnd = response.indexOf(CODE_BLOCK_DELIMITER, jsonStart);

        if (jsonEnd > jsonStart) {
            String content = response.substring(jsonStart, jsonEnd).trim();
            return isValidJsonObject(content) ? content : null;
        }

        return null;
    }

    private static String extractFromGenericCodeBlock(String response) {
        if (!response.contains(CODE_BLOCK_DELIMITER)) {
            return null;
        }

        int start = response.indexOf(CODE_BLOCK_DELIMITER) + CODE_BLOCK_DELIMITER_LENGTH;
        int end = response.indexOf(CODE_BLOCK_DELIMITER, start);

        if (end > start) {
            String content = response.substring(start, end).trim();
            if (content.startsWith("{") && isValidJsonObject(content)) {
                return content;
            }
        }

        return null;
    }

    private static String findCompleteJsonObject(String response) {
        int startIndex = response.indexOf('{');
        if (startIndex == -1) {
            return null;
        }

        int braceCount = 0;
        int endIndex = -1;
        boolean inString = false;
        boolean escaped = false;

        for (int i = startIndex; i < response.length(); i++) {
            char c = response.charAt(i);

            if (escaped) {
                escaped = false;
                continue;
            }

            if (c == '\\') {
                escaped = true;
                continue;
            }

            if (c == '"') {
                inString = !inString;
                continue;
            }

            if (!inString) {
                if (c == '{') {
                    braceCount++;
                } else if (c == '}') {
                    braceCount--;
                    if (braceCount == 0) {
                        endIndex = i;
                        break;
                    }
                }
            }
        }

        if (endIndex > startIndex) {
            return response.substring(startIndex, endIndex + 1);
        }

        return null;
    }

    private static boolean isValidJsonObject(String json) {
        if (json == null || json.trim().isEmpty()) {
            return false;
        }

        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject();
        } catch (Exception e) {
            return false;
        }
    }
}
