package com.refinement_copilot.integration.ai;

import com.refinement_copilot.common.constants.ClassificationConstants;
import com.refinement_copilot.domain.intent.Intent;
import com.refinement_copilot.domain.intent.IntentTable;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Templates for LLM prompts
 */
@Component
public class PromptTemplates {

    public static final String MASTER_PROMPT = """
        You are a Senior Business Analyst, Product Owner, and Jira Coach assistant.

        Your role is to help refine Jira tickets by analysing:
        - Business intent
        - Functional scope
        - UI/UX behaviour (including Figma expectations)
        - Acceptance criteria
        - Edge cases, risks, and dependencies

        Rules:
        - Understand the user's intent first.
        - Adapt response style based on the question.
        - Do NOT assume missing requirements.
        - Clearly list assumptions when information is missing.
        - Ask clarification questions when needed.
        - Provide Jira-ready, practical outputs.

        You are a thinking partner, not a decision authority.""";

    public static final String ASSUMPTION_INSTRUCTIONS = """
        If information is missing:
        - List assumptions explicitly
        - Ask clarification questions""";

    public static final String FIGMA_EMPHASIS = "IMPORTANT: User mentioned Figma. Emphasize design alignment checks and verify against Figma mockups.";
    public static final String UI_FIGMA_SUGGESTION = "NOTE: This is UI-related. Consider suggesting Figma validation if designs exist.";
    public static final String EDGE_CASE_FOCUS = "FOCUS: User is concerned about edge cases. Provide comprehensive risk analysis.";

    private final IntentTable<String> modePrompts = IntentTable.of(buildModePrompts());

    /**
     * Creates the prompt asking the classifier for primary/secondary intents and a confidence score
     */
    public String intentClassification(String question) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("<instructions>\n")
              .append("You are an intent classifier for a Jira Refinement Copilot.\n\n")
              .append("Identify:\n")
              .append("- Primary intent\n")
              .append("- Secondary intents (if any)\n")
              .append("- Confidence score (0.0 to 1.0)\n\n")
              .append("Return a single JSON object with these fields:\n")
              .append("- ").append(ClassificationConstants.FIELD_PRIMARY_INTENT).append(" (string; one of the intents below)\n")
              .append("- ").append(ClassificationConstants.FIELD_SECONDARY_INTENTS).append(" (array of strings; may be empty)\n")
              .append("- ").append(ClassificationConstants.FIELD_CONFIDENCE).append(" (number 0.0-1.0)\n\n")
              .append("Possible intents:\n");
        for (Intent intent : Intent.values()) {
            prompt.append(intent.name()).append("\n");
        }
        prompt.append("\nReturn JSON ONLY, no extra text.\n")
              .append("</instructions>\n\n")
              .append("<user_question>\n")
              .append(question)
              .append("\n</user_question>\n");
        return prompt.toString();
    }

    /**
     * JSON schema for structured classifier output
     */
    public Map<String, Object> intentClassificationSchema() {
        List<String> intentNames = Arrays.stream(Intent.values())
            .map(Intent::name)
            .collect(Collectors.toList());

        Map<String, Object> properties = new HashMap<>();
        properties.put(ClassificationConstants.FIELD_PRIMARY_INTENT, Map.of("type", "string", "enum", intentNames));
        properties.put(ClassificationConstants.FIELD_SECONDARY_INTENTS,
            Map.of("type", "array", "items", Map.of("type", "string", "enum", intentNames)));
        properties.put(ClassificationConstants.FIELD_CONFIDENCE, Map.of("type", "number", "minimum", 0, "maximum", 1));

        Map<String, Object> schemaDef = new HashMap<>();
        schemaDef.put("type", "object");
        schemaDef.put("properties", properties);
        schemaDef.put("required", List.of(
            ClassificationConstants.FIELD_PRIMARY_INTENT,
            ClassificationConstants.FIELD_SECONDARY_INTENTS,
            ClassificationConstants.FIELD_CONFIDENCE));
        schemaDef.put("additionalProperties", false);

        Map<String, Object> schema = new HashMap<>();
        schema.put("name", "intent_classification");
        schema.put("strict", true);
        schema.put("schema", schemaDef);
        return schema;
    }

    /**
     * Intent-specific task instructions
     */
    public IntentTable<String> modePrompts() {
        return modePrompts;
    }

    private static Map<Intent, String> buildModePrompts() {
        Map<Intent, String> prompts = new EnumMap<>(Intent.class);
        prompts.put(Intent.OBJECTIVE_INTENT,
            "Explain the objective and business purpose.\n" +
            "Focus on: WHY this feature exists, WHO benefits, and WHAT problem it solves.");
        prompts.put(Intent.SCOPE_DEFINITION,
            "Define in-scope and out-of-scope items.\n" +
            "Structure: IN SCOPE (what's included), OUT OF SCOPE (what's excluded), " +
            "ASSUMPTIONS (what's assumed but unconfirmed).");
        prompts.put(Intent.ACCEPTANCE_CRITERIA,
            "Generate clear Given/When/Then acceptance criteria.\n\n" +
            "Template:\n" +
            "- GIVEN [precondition/context]\n" +
            "- WHEN [action/trigger]\n" +
            "- THEN [expected outcome]\n\n" +
            "Example:\n" +
            "- GIVEN a user is on the login page\n" +
            "- WHEN they enter valid credentials and click 'Login'\n" +
            "- THEN they should be redirected to the dashboard");
        prompts.put(Intent.UI_UX_BEHAVIOUR,
            "Describe expected UI behaviour and states.\n" +
            "Include: Default state, Loading state, Success state, Error state, " +
            "Edge cases (empty, disabled, etc.)");
        prompts.put(Intent.FIGMA_ALIGNMENT,
            "List Figma design checks for alignment.\n" +
            "Verify: Component spacing, Typography, Colors, Icons, " +
            "Interaction states (hover, active, disabled), Responsive behavior");
        prompts.put(Intent.EDGE_CASE_RISK_ANALYSIS,
            "Identify edge cases and risks.\n" +
            "Consider: Invalid inputs, Boundary conditions, System failures, " +
            "Integration issues, Performance constraints, Security vulnerabilities");
        prompts.put(Intent.BUSINESS_RULE,
            "Extract business rules.\n" +
            "Format: IF [condition] THEN [action/outcome] ELSE [alternative]");
        prompts.put(Intent.DEPENDENCY_IMPACT,
            "Identify dependencies and impacts.\n" +
            "Categories: System dependencies, Data dependencies, " +
            "Feature dependencies, API dependencies, Impact on existing features");
        prompts.put(Intent.STORY_REFINEMENT,
            "Improve clarity and readiness of the requirement.\n" +
            "Check: Clear objective, Defined scope, Acceptance criteria, " +
            "Dependencies identified, Assumptions documented");
        prompts.put(Intent.DEVELOPMENT_READINESS,
            "Assess if ready for development and list gaps.\n" +
            "Checklist: [ ] Clear requirements, [ ] Acceptance criteria defined, " +
            "[ ] Dependencies identified, [ ] Designs available, [ ] Technical approach agreed");
        return prompts;
    }
}
