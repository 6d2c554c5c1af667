package com.refinement_copilot.domain.intent;

import java.util.Locale;
import java.util.Optional;

/**
 * Purpose of a refinement question, as decided by the intent classifier
 */
public enum Intent {
    OBJECTIVE_INTENT,
    SCOPE_DEFINITION,
    ACCEPTANCE_CRITERIA,
    UI_UX_BEHAVIOUR,
    FIGMA_ALIGNMENT,
    EDGE_CASE_RISK_ANALYSIS,
    BUSINESS_RULE,
    DEPENDENCY_IMPACT,
    STORY_REFINEMENT,
    DEVELOPMENT_READINESS;

    /**
     * Intent used whenever classification degrades or a lookup has nothing better to offer
     */
    public static final Intent FALLBACK = STORY_REFINEMENT;

    /**
     * Resolves an intent name case-insensitively; unknown or blank names resolve to empty
     */
    public static Optional<Intent> fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Intent.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
