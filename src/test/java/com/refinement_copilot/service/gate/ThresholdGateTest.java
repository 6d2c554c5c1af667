package com.refinement_copilot.service.gate;

import com.refinement_copilot.common.constants.IntentConstants;
import com.refinement_copilot.domain.classification.ClassificationResult;
import com.refinement_copilot.domain.intent.Intent;
import com.refinement_copilot.service.observability.PipelineObserver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class ThresholdGateTest {

    private final ThresholdGate gate = new ThresholdGate(IntentConstants.DEFAULT_THRESHOLDS, PipelineObserver.NO_OP);

    @Test
    public void shouldAskClarifyingQuestionBelowThreshold() {
        ThresholdDecision decision = gate.evaluate(new ClassificationResult(Intent.ACCEPTANCE_CRITERIA, List.of(), 0.45));

        Assertions.assertTrue(decision.clarificationRequired());
        Assertions.assertEquals(0.6, decision.threshold(), 1e-9);
        Assertions.assertEquals(IntentConstants.CLARIFYING_QUESTIONS.get(Intent.ACCEPTANCE_CRITERIA), decision.clarifyingQuestion());
    }

    @Test
    public void shouldProceedWhenConfidenceEqualsThreshold() {
        ThresholdDecision decision = gate.evaluate(new ClassificationResult(Intent.SCOPE_DEFINITION, List.of(), 0.65));

        Assertions.assertFalse(decision.clarificationRequired());
        Assertions.assertNull(decision.clarifyingQuestion());
    }

    @Test
    public void shouldClarifyDegradedClassifications() {
        Assertions.assertTrue(gate.evaluate(ClassificationResult.degraded(0.4)).clarificationRequired());
        Assertions.assertTrue(gate.evaluate(ClassificationResult.degraded(0.3)).clarificationRequired());
        Assertions.assertFalse(gate.evaluate(ClassificationResult.degraded(0.5)).clarificationRequired());
    }

    @Test
    public void shouldUseOverriddenThresholds() {
        ThresholdGate strict = new ThresholdGate(
            IntentConstants.DEFAULT_THRESHOLDS.withOverrides(Map.of(Intent.EDGE_CASE_RISK_ANALYSIS, 0.8)),
            PipelineObserver.NO_OP);

        Assertions.assertTrue(strict.evaluate(new ClassificationResult(Intent.EDGE_CASE_RISK_ANALYSIS, List.of(), 0.75)).clarificationRequired());
        Assertions.assertFalse(gate.evaluate(new ClassificationResult(Intent.EDGE_CASE_RISK_ANALYSIS, List.of(), 0.75)).clarificationRequired());
    }
}
