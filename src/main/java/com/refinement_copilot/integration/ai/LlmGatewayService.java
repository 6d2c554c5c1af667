package com.refinement_copilot.integration.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.refinement_copilot.config.LlmGatewayConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.HttpClientResponseHandler;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for interacting with the LLM Gateway
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmGatewayService implements AIService {

    private static final String GENERATIONS_PATH = "/v1.0/generations";
    private static final String CHAT_GENERATIONS_PATH = "/v1.0/chat/generations";

    private final LlmGatewayConfig config;
    private final ObjectMapper objectMapper;

    /**
     * Generate a text response from the LLM
     */
    @Override
    public String generate(String prompt) throws Exception {
        config.validate();

        log.info("Sending generation request to LLM Gateway...");

        Map<String, Object> requestPayload = new HashMap<>();
        requestPayload.put("prompt", prompt);
        requestPayload.put("temperature", config.getTemperature());
        requestPayload.put("max_tokens", config.getMaxTokens());
        requestPayload.put("model", config.getModel());

        return post("Generation", GENERATIONS_PATH, requestPayload, responseBody -> {
            JsonNode responseJson = objectMapper.readTree(responseBody);

            // Handle LLM Gateway generations format
            JsonNode generations = responseJson.get("generations");
            if (generations != null && generations.isArray() && !generations.isEmpty()) {
                JsonNode firstGeneration = generations.get(0);

                String text = nonBlankText(firstGeneration, "text");
                if (text != null) {
                    return text;
                }
                String content = nonBlankText(firstGeneration, "content");
                if (content != null) {
                    return content;
                }
                log.warn("LLM Gateway returned generation with no valid text or content");
            }

            log.warn("Unable to parse LLM Gateway response format. Response structure: {}", responseJson.toPrettyString());
            throw new IllegalStateException("LLM Gateway returned unrecognized response format");
        });
    }

    /**
     * Generate a strictly structured JSON response using Structured Outputs (response_format)
     */
    @Override
    public String generateStructured(String prompt, Map<String, Object> jsonSchema) throws Exception {
        config.validate();

        log.info("Sending structured output request to LLM Gateway...");

        Map<String, Object> userMsg = new HashMap<>();
        userMsg.put("role", "user");
        userMsg.put("content", prompt);

        Map<String, Object> generationSettings = new HashMap<>();
        generationSettings.put("max_tokens", config.getMaxTokens());
        generationSettings.put("temperature", config.getClassificationTemperature());

        Map<String, Object> responseFormat = new HashMap<>();
        responseFormat.put("type", "json_schema");
        responseFormat.put("json_schema", new HashMap<>(jsonSchema));

        Map<String, Object> parameters = new HashMap<>();
        parameters.put("response_format", responseFormat);

        Map<String, Object> requestPayload = new HashMap<>();
        requestPayload.put("model", config.getModel());
        requestPayload.put("messages", List.of(userMsg));
        requestPayload.put("generation_settings", generationSettings);
        requestPayload.put("parameters", parameters);

        return post("Structured output", CHAT_GENERATIONS_PATH, requestPayload, responseBody -> {
            JsonNode generationDetails = objectMapper.readTree(responseBody).get("generation_details");
            if (generationDetails != null && generationDetails.has("generations")) {
                JsonNode gens = generationDetails.get("generations");
                if (gens.isArray() && !gens.isEmpty()) {
                    JsonNode first = gens.get(0);
                    if (first.has("content")) {
                        return first.get("content").asText();
                    }
                    if (first.has("text")) {
                        return first.get("text").asText();
                    }
                }
            }
            // Fallback to raw body; the classifier parser decides whether it is usable
            log.warn("Unable to parse structured output response; returning raw body");
            return responseBody;
        });
    }

    private String post(String operation, String path, Map<String, Object> payload, BodyHandler bodyHandler) throws Exception {
        String jsonPayload = objectMapper.writeValueAsString(payload);
        log.debug("{} request payload: {}", operation, jsonPayload);

        String endpoint = config.getGatewayUrl() + path;
        HttpPost request = new HttpPost(endpoint);
        setCommonHeaders(request);
        request.setEntity(new StringEntity(jsonPayload, ContentType.APPLICATION_JSON));

        HttpClientResponseHandler<String> responseHandler = response -> {
            String responseBody = response.getEntity() != null
                ? EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)
                : "";

            if (response.getCode() >= 200 && response.getCode() < 300) {
                log.info("Successfully received {} response from LLM Gateway", operation.toLowerCase());
                log.debug("Response body: {}", responseBody);
                return bodyHandler.handle(responseBody);
            }

            logRequestFailure(operation, response.getCode(), response.getReasonPhrase(), endpoint, jsonPayload, responseBody);
            throw new IllegalStateException(operation + " request failed: " + response.getCode() + " " + response.getReasonPhrase());
        };

        try (CloseableHttpClient httpClient = createHttpClient()) {
            return httpClient.execute(request, responseHandler);
        }
    }

    private CloseableHttpClient createHttpClient() {
        if (config.getTimeoutSeconds() <= 0) {
            return HttpClients.createDefault();
        }
        RequestConfig requestConfig = RequestConfig.custom()
            .setResponseTimeout(Timeout.ofSeconds(config.getTimeoutSeconds()))
            .build();
        return HttpClients.custom()
            .setDefaultRequestConfig(requestConfig)
            .build();
    }

    private String nonBlankText(JsonNode generation, String field) {
        if (!generation.has(field)) {
            return null;
        }
        String value = generation.get(field).asText();
        if (value == null || value.trim().isEmpty()) {
            log.warn("LLM Gateway returned empty {} field", field);
            return null;
        }
        return value;
    }

    private void setCommonHeaders(HttpPost request) {
        request.setHeader("Content-Type", "application/json");
        request.setHeader("X-LLM-Provider", config.getLlmProvider());
        request.setHeader("X-Org-Id", config.getOrgId());
        request.setHeader("Authorization", config.getAuthScheme() + " " + config.getAuthToken());
        request.setHeader("x-sfdc-core-tenant-id", config.getTenantId());

        if (config.getClientFeatureId() != null && !config.getClientFeatureId().isEmpty()) {
            request.setHeader("x-client-feature-id", config.getClientFeatureId());
        }
    }

    private void logRequestFailure(String operation, int statusCode, String reasonPhrase, String endpoint, String payload, String responseBody) {
        log.error("{} request failed with status: {} {}", operation, statusCode, reasonPhrase);
        log.error("Request URL: {}", endpoint);
        log.debug("Request payload: {}", payload);
        log.error("Response body: {}", responseBody);
    }

    @FunctionalInterface
    private interface BodyHandler {
        String handle(String responseBody) throws IOException;
    }
}
