package com.refinement_copilot.integration.ai;

import java.util.Map;

/**
 * Interface for AI service interactions
 */
public interface AIService {
    /**
     * Generate text based on a prompt
     */
    String generate(String prompt) throws Exception;

    /**
     * Generate a strictly structured JSON string according to the provided JSON schema
     */
    String generateStructured(String prompt, Map<String, Object> jsonSchema) throws Exception;
}
