package com.refinement_copilot.service.classification;

import com.refinement_copilot.common.exception.ClassificationParseException;
import com.refinement_copilot.domain.classification.ClassificationResult;
import com.refinement_copilot.integration.ai.ClassifierCapability;
import com.refinement_copilot.integration.ai.PromptTemplates;
import com.refinement_copilot.service.observability.FailureKind;
import com.refinement_copilot.service.observability.PipelineObserver;
import com.refinement_copilot.service.observability.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;

import static com.refinement_copilot.common.constants.ClassificationConstants.CAPABILITY_FAILURE_CONFIDENCE;
import static com.refinement_copilot.common.constants.ClassificationConstants.PARSE_FAILURE_CONFIDENCE;

/**
 * Classifies a question through the classifier capability.
 * <p>
 * Never throws: a failing capability degrades to {@code STORY_REFINEMENT} at 0.3 and
 * unparseable output degrades to {@code STORY_REFINEMENT} at 0.4.
 */
@Service
@RequiredArgsConstructor
public class IntentClassifier {

    private final PromptTemplates promptTemplates;
    private final ClassificationParser classificationParser;
    private final PipelineObserver observer;

    public ClassificationResult classify(ClassifierCapability classifier, String question) {
        String prompt = promptTemplates.intentClassification(question);

        String rawResponse;
        try {
            rawResponse = classifier.classify(prompt);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            observer.onFailure(FailureKind.CLASSIFICATION_CAPABILITY_FAILURE, "Intent classification failed", e);
            return ClassificationResult.degraded(CAPABILITY_FAILURE_CONFIDENCE);
        }

        try {
            ClassificationResult result = classificationParser.parse(rawResponse);
            observer.onEvent(PipelineState.INTENT_CLASSIFIED, "Intent classified: {} (confidence: {}, secondary: {})",
                result.primary(), String.format(Locale.ROOT, "%.2f", result.confidence()), result.secondary());
            return result;
        } catch (ClassificationParseException e) {
            observer.onFailure(FailureKind.CLASSIFICATION_PARSE_FAILURE,
                "Failed to parse classifier response: " + e.getMessage() + " | raw: " + abbreviate(rawResponse), e);
            return ClassificationResult.degraded(PARSE_FAILURE_CONFIDENCE);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
