package com.refinement_copilot.common.constants;

/**
 * Constants for intent classification output and its degraded outcomes
 */
public final class ClassificationConstants {

    // Prevent instantiation
    private ClassificationConstants() {}

    // Classifier output fields
    public static final String FIELD_PRIMARY_INTENT = "primary_intent";
    public static final String FIELD_SECONDARY_INTENTS = "secondary_intents";
    public static final String FIELD_CONFIDENCE = "confidence";

    // Confidence Values
    public static final double CAPABILITY_FAILURE_CONFIDENCE = 0.3;
    public static final double PARSE_FAILURE_CONFIDENCE = 0.4;
    public static final double MISSING_CONFIDENCE_DEFAULT = 0.5;
    public static final double MIN_CONFIDENCE = 0.0;
    public static final double MAX_CONFIDENCE = 1.0;
}
