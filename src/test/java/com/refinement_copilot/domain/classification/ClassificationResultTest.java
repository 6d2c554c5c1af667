package com.refinement_copilot.domain.classification;

import com.refinement_copilot.domain.intent.Intent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class ClassificationResultTest {

    @Test
    public void shouldRejectConfidenceOutsideUnitInterval() {
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> new ClassificationResult(Intent.BUSINESS_RULE, List.of(), 1.01));
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> new ClassificationResult(Intent.BUSINESS_RULE, List.of(), Double.NaN));
    }

    @Test
    public void shouldRequirePrimaryIntent() {
        Assertions.assertThrows(NullPointerException.class, () -> new ClassificationResult(null, List.of(), 0.5));
    }

    @Test
    public void shouldCopySecondaryIntents() {
        List<Intent> secondary = new ArrayList<>(List.of(Intent.SCOPE_DEFINITION));
        ClassificationResult result = new ClassificationResult(Intent.OBJECTIVE_INTENT, secondary, 0.8);
        secondary.add(Intent.BUSINESS_RULE);

        Assertions.assertEquals(List.of(Intent.SCOPE_DEFINITION), result.secondary());
        Assertions.assertTrue(result.hasSecondary());
    }

    @Test
    public void shouldDegradeToFallbackIntent() {
        ClassificationResult degraded = ClassificationResult.degraded(0.3);

        Assertions.assertEquals(Intent.STORY_REFINEMENT, degraded.primary());
        Assertions.assertFalse(degraded.hasSecondary());
        Assertions.assertEquals(0.3, degraded.confidence(), 1e-9);
    }
}
