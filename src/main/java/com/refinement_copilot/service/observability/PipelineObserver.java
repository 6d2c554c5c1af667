package com.refinement_copilot.service.observability;

/**
 * Diagnostics sink handed to every pipeline stage.
 * <p>
 * Messages use SLF4J-style {@code {}} placeholders.
 */
public interface PipelineObserver {

    /**
     * Observer that discards everything
     */
    PipelineObserver NO_OP = new PipelineObserver() {};

    default void onTransition(PipelineState state) {}

    default void onEvent(PipelineState stage, String message, Object... args) {}

    default void onFailure(FailureKind kind, String message, Throwable cause) {}
}
