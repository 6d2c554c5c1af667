package com.refinement_copilot.service.prompt;

/**
 * Sections of the answer prompt, in render order
 */
public enum PromptSection {
    MASTER_INSTRUCTIONS,
    RESPONSE_STYLE,
    TASK,
    ASSUMPTIONS,
    FIGMA_EMPHASIS,
    UI_FIGMA_SUGGESTION,
    EDGE_CASE_FOCUS,
    EXTRACTED_CONTEXT,
    USER_QUESTION
}
