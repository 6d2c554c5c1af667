package com.refinement_copilot.integration.ai;

/**
 * Text-in/text-out capability that answers the intent classification prompt.
 * Expected to return JSON with {@code primary_intent}, {@code secondary_intents} and {@code confidence}.
 */
@FunctionalInterface
public interface ClassifierCapability {

    String classify(String prompt) throws Exception;
}
