package com.refinement_copilot.service.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.refinement_copilot.common.exception.ClassificationParseException;
import com.refinement_copilot.common.util.JsonUtils;
import com.refinement_copilot.domain.classification.ClassificationResult;
import com.refinement_copilot.domain.intent.Intent;
import com.refinement_copilot.service.observability.PipelineObserver;
import com.refinement_copilot.service.observability.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.refinement_copilot.common.constants.ClassificationConstants.*;

/**
 * Validates classifier output against the expected shape.
 * <p>
 * Absent fields take their defaults. A field with the wrong JSON type, or a confidence outside [0, 1],
 * rejects the whole response. Intent names the copilot does not know are not type errors: an unknown
 * primary intent falls back to {@link Intent#FALLBACK} with the reported confidence, and unknown
 * secondary intents are dropped.
 */
@Component
@RequiredArgsConstructor
public class ClassificationParser {

    private final ObjectMapper objectMapper;
    private final PipelineObserver observer;

    public ClassificationResult parse(String rawResponse) throws ClassificationParseException {
        String json = JsonUtils.extractJsonObject(rawResponse)
            .orElseThrow(() -> new ClassificationParseException("Classifier response contains no JSON object"));

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ClassificationParseException("Classifier response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationParseException("Classifier response is not a JSON object");
        }

        Intent primary = parsePrimary(root);
        List<Intent> secondary = parseSecondary(root);
        double confidence = parseConfidence(root);

        return new ClassificationResult(primary, secondary, confidence);
    }

    private Intent parsePrimary(JsonNode root) throws ClassificationParseException {
        if (!hasNonNullValue(root, FIELD_PRIMARY_INTENT)) {
            return Intent.FALLBACK;
        }
        String name = intentName(root.get(FIELD_PRIMARY_INTENT), FIELD_PRIMARY_INTENT);
        Optional<Intent> primary = Intent.fromName(name);
        if (primary.isEmpty()) {
            observer.onEvent(PipelineState.INTENT_CLASSIFIED, "Unknown primary intent '{}', using {}", name, Intent.FALLBACK);
        }
        return primary.orElse(Intent.FALLBACK);
    }

    private List<Intent> parseSecondary(JsonNode root) throws ClassificationParseException {
        if (!hasNonNullValue(root, FIELD_SECONDARY_INTENTS)) {
            return List.of();
        }
        JsonNode node = root.get(FIELD_SECONDARY_INTENTS);
        if (!node.isArray()) {
            throw new ClassificationParseException(FIELD_SECONDARY_INTENTS + " must be an array");
        }
        List<Intent> intents = new ArrayList<>(node.size());
        List<String> unknown = new ArrayList<>();
        for (JsonNode element : node) {
            String name = intentName(element, FIELD_SECONDARY_INTENTS);
            Intent.fromName(name).ifPresentOrElse(intents::add, () -> unknown.add(name));
        }
        if (!unknown.isEmpty()) {
            observer.onEvent(PipelineState.INTENT_CLASSIFIED, "Dropped unknown secondary intents: {}", unknown);
        }
        return intents;
    }

    private double parseConfidence(JsonNode root) throws ClassificationParseException {
        if (!hasNonNullValue(root, FIELD_CONFIDENCE)) {
            return MISSING_CONFIDENCE_DEFAULT;
        }
        JsonNode node = root.get(FIELD_CONFIDENCE);
        if (!node.isNumber()) {
            throw new ClassificationParseException(FIELD_CONFIDENCE + " must be a number");
        }
        double confidence = node.asDouble();
        if (confidence < MIN_CONFIDENCE || confidence > MAX_CONFIDENCE) {
            throw new ClassificationParseException(FIELD_CONFIDENCE + " out of range: " + confidence);
        }
        return confidence;
    }

    private String intentName(JsonNode node, String fieldName) throws ClassificationParseException {
        if (!node.isTextual()) {
            throw new ClassificationParseException(fieldName + " must contain intent names");
        }
        return node.asText();
    }

    private boolean hasNonNullValue(JsonNode node, String fieldName) {
        return node.has(fieldName) && !node.get(fieldName).isNull();
    }
}
