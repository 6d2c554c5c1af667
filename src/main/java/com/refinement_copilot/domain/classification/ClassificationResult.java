package com.refinement_copilot.domain.classification;

import com.refinement_copilot.domain.intent.Intent;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of intent classification for one question.
 *
 * @param primary    the intent that drives gating and prompt composition
 * @param secondary  further intents in the order the classifier reported them, duplicates kept
 * @param confidence classifier certainty in the primary intent, within [0.0, 1.0]
 */
public record ClassificationResult(Intent primary, List<Intent> secondary, double confidence) {

    public ClassificationResult {
        Objects.requireNonNull(primary, "primary intent is required");
        secondary = secondary == null ? List.of() : List.copyOf(secondary);
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0] but was " + confidence);
        }
    }

    /**
     * Fallback result used when classification cannot be trusted
     */
    public static ClassificationResult degraded(double confidence) {
        return new ClassificationResult(Intent.FALLBACK, List.of(), confidence);
    }

    public boolean hasSecondary() {
        return !secondary.isEmpty();
    }
}
