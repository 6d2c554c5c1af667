package com.refinement_copilot.integration.ai;

/**
 * Text-in/text-out capability that writes the final answer from a composed prompt
 */
@FunctionalInterface
public interface GeneratorCapability {

    String generate(String prompt) throws Exception;
}
