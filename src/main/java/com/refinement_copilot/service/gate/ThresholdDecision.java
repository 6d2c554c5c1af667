package com.refinement_copilot.service.gate;

/**
 * Result of comparing classifier confidence with the intent's threshold.
 *
 * @param clarificationRequired true when confidence fell strictly below the threshold
 * @param threshold             the threshold that was applied
 * @param clarifyingQuestion    text returned to the user instead of an answer; null when proceeding
 */
public record ThresholdDecision(boolean clarificationRequired, double threshold, String clarifyingQuestion) {

    public static ThresholdDecision proceed(double threshold) {
        return new ThresholdDecision(false, threshold, null);
    }

    public static ThresholdDecision clarify(double threshold, String clarifyingQuestion) {
        return new ThresholdDecision(true, threshold, clarifyingQuestion);
    }
}
