package com.refinement_copilot.common.constants;

import com.refinement_copilot.domain.intent.Intent;
import com.refinement_copilot.domain.intent.IntentTable;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-intent confidence thresholds and clarifying questions
 */
public final class IntentConstants {

    // Prevent instantiation
    private IntentConstants() {}

    /**
     * Confidence below which the copilot asks a clarifying question instead of answering.
     * Nuanced intents (edge cases, general refinement) get a lower bar.
     */
    public static final IntentTable<Double> DEFAULT_THRESHOLDS = IntentTable.of(defaultThresholds());

    public static final IntentTable<String> CLARIFYING_QUESTIONS = IntentTable.of(clarifyingQuestions());

    private static Map<Intent, Double> defaultThresholds() {
        Map<Intent, Double> thresholds = new EnumMap<>(Intent.class);
        thresholds.put(Intent.OBJECTIVE_INTENT, 0.7);
        thresholds.put(Intent.SCOPE_DEFINITION, 0.65);
        thresholds.put(Intent.ACCEPTANCE_CRITERIA, 0.6);
        thresholds.put(Intent.UI_UX_BEHAVIOUR, 0.6);
        thresholds.put(Intent.FIGMA_ALIGNMENT, 0.65);
        thresholds.put(Intent.EDGE_CASE_RISK_ANALYSIS, 0.5);
        thresholds.put(Intent.BUSINESS_RULE, 0.6);
        thresholds.put(Intent.DEPENDENCY_IMPACT, 0.55);
        thresholds.put(Intent.STORY_REFINEMENT, 0.5);
        thresholds.put(Intent.DEVELOPMENT_READINESS, 0.6);
        return thresholds;
    }

    private static Map<Intent, String> clarifyingQuestions() {
        Map<Intent, String> questions = new EnumMap<>(Intent.class);
        questions.put(Intent.OBJECTIVE_INTENT,
            "I need a bit more clarity. Could you specify:\n" +
            "- What business goal does this feature support?\n" +
            "- Who are the primary users?\n" +
            "- What problem does this solve?");
        questions.put(Intent.SCOPE_DEFINITION,
            "To define the scope clearly, please clarify:\n" +
            "- What functionality is included?\n" +
            "- What is explicitly out of scope?\n" +
            "- Are there any phase requirements?");
        questions.put(Intent.ACCEPTANCE_CRITERIA,
            "To create clear acceptance criteria, I need:\n" +
            "- What are the specific conditions to be met?\n" +
            "- What are the expected outcomes?\n" +
            "- Are there UI/UX or data validation requirements?");
        questions.put(Intent.UI_UX_BEHAVIOUR,
            "For UI/UX behavior, please specify:\n" +
            "- What user actions trigger this behavior?\n" +
            "- What visual feedback should users see?\n" +
            "- Are there error or loading states?");
        questions.put(Intent.FIGMA_ALIGNMENT,
            "To ensure Figma alignment, I need:\n" +
            "- Which Figma design/mockup should be referenced?\n" +
            "- Are there specific components or flows to validate?\n" +
            "- Are there any design system requirements?");
        questions.put(Intent.EDGE_CASE_RISK_ANALYSIS,
            "For edge case analysis, help me understand:\n" +
            "- What are the expected normal conditions?\n" +
            "- What unusual inputs or scenarios concern you?\n" +
            "- Are there integration or data quality risks?");
        questions.put(Intent.BUSINESS_RULE,
            "To extract business rules clearly:\n" +
            "- What conditions must be met?\n" +
            "- What are the validation requirements?\n" +
            "- Are there any exceptions or special cases?");
        questions.put(Intent.DEPENDENCY_IMPACT,
            "To identify dependencies, clarify:\n" +
            "- What other systems or features are affected?\n" +
            "- Are there API or data dependencies?\n" +
            "- What's the impact on existing functionality?");
        questions.put(Intent.STORY_REFINEMENT,
            "To refine this story, I need more context:\n" +
            "- What aspect needs refinement (clarity, completeness, readiness)?\n" +
            "- Are there specific concerns or gaps?\n" +
            "- What level of detail is needed?");
        questions.put(Intent.DEVELOPMENT_READINESS,
            "To assess development readiness:\n" +
            "- Have all dependencies been identified?\n" +
            "- Are acceptance criteria defined?\n" +
            "- Are there any open questions or blockers?");
        return questions;
    }
}
