package com.refinement_copilot.service.generation;

/**
 * Text produced by the generator capability, or the apology that replaced it
 */
public record GenerationResult(String text, boolean failed) {

    public static GenerationResult success(String text) {
        return new GenerationResult(text, false);
    }

    public static GenerationResult failure(String apology) {
        return new GenerationResult(apology, true);
    }
}
