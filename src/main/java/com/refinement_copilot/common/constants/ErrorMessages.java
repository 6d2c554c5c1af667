package com.refinement_copilot.common.constants;

/**
 * Constants for user-facing error messages
 */
public final class ErrorMessages {

    // Prevent instantiation
    private ErrorMessages() {}

    // Generation
    public static final String GENERATION_FAILURE_MESSAGE = "I apologize, but I encountered an error generating the response. Please try rephrasing your question or contact support if the issue persists.";

    // Pipeline
    public static final String PIPELINE_FAILURE_MESSAGE = "I apologize, but I encountered an unexpected error processing your request. Please try rephrasing your question or contact support if the issue persists.";

    // Format Templates
    public static final String SECONDARY_INTENTS_FORMAT = "\n\nWould you also like help with: %s?";
}
