package com.refinement_copilot.service.gate;

import com.refinement_copilot.common.constants.IntentConstants;
import com.refinement_copilot.domain.classification.ClassificationResult;
import com.refinement_copilot.domain.intent.IntentTable;
import com.refinement_copilot.service.observability.PipelineObserver;
import com.refinement_copilot.service.observability.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Refuses to answer when the classifier is not confident enough for the primary intent
 */
@Service
@RequiredArgsConstructor
public class ThresholdGate {

    private final IntentTable<Double> intentThresholds;
    private final PipelineObserver observer;

    public ThresholdDecision evaluate(ClassificationResult result) {
        double threshold = intentThresholds.get(result.primary());

        // Equal confidence passes
        if (result.confidence() < threshold) {
            observer.onEvent(PipelineState.CLARIFY_TERMINAL, "Low confidence ({}) below threshold ({}) for {}",
                result.confidence(), threshold, result.primary());
            return ThresholdDecision.clarify(threshold, IntentConstants.CLARIFYING_QUESTIONS.get(result.primary()));
        }
        return ThresholdDecision.proceed(threshold);
    }
}
