package com.refinement_copilot.service.observability;

/**
 * States a single copilot invocation moves through
 */
public enum PipelineState {
    INIT,
    CONTEXT_EXTRACTED,
    STYLE_DETECTED,
    INTENT_CLASSIFIED,
    CLARIFY_TERMINAL,
    ASSUMPTION_GATED,
    PROMPT_COMPOSED,
    RESPONSE_GENERATED,
    SECONDARY_ANNOTATED,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == CLARIFY_TERMINAL || this == DONE || this == ERROR;
    }
}
