package com.refinement_copilot.service.prompt;

import com.refinement_copilot.domain.context.QuestionContext;
import com.refinement_copilot.domain.context.ResponseStyle;
import com.refinement_copilot.domain.intent.Intent;
import com.refinement_copilot.integration.ai.PromptTemplates;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;

/**
 * Assembles the answer prompt from the master instructions, the intent's task template
 * and the signals found in the question. Identical inputs always render identical prompts.
 */
@Service
@RequiredArgsConstructor
public class PromptComposer {

    private final PromptTemplates promptTemplates;

    /**
     * Composes the prompt for a classified intent, using the configured master prompt and task template
     */
    public ComposedPrompt compose(Intent primary, String question, QuestionContext context,
                                  ResponseStyle style, boolean needsAssumptions) {
        return compose(
            PromptTemplates.MASTER_PROMPT,
            promptTemplates.modePrompts().get(primary),
            question,
            context,
            style,
            needsAssumptions
        );
    }

    public ComposedPrompt compose(String master, String modeTemplate, String question, QuestionContext context,
                                  ResponseStyle style, boolean needsAssumptions) {
        EnumMap<PromptSection, String> sections = new EnumMap<>(PromptSection.class);

        sections.put(PromptSection.MASTER_INSTRUCTIONS, master.strip());
        sections.put(PromptSection.RESPONSE_STYLE, "Response Style: " + style.name());
        sections.put(PromptSection.TASK, "Task:\n" + modeTemplate);

        if (needsAssumptions) {
            sections.put(PromptSection.ASSUMPTIONS, PromptTemplates.ASSUMPTION_INSTRUCTIONS);
        }

        // Figma emphasis replaces the UI suggestion; edge-case focus is independent of both
        if (context.mentionsFigma()) {
            sections.put(PromptSection.FIGMA_EMPHASIS, PromptTemplates.FIGMA_EMPHASIS);
        } else if (context.uiRelated()) {
            sections.put(PromptSection.UI_FIGMA_SUGGESTION, PromptTemplates.UI_FIGMA_SUGGESTION);
        }
        if (context.mentionsEdgeCases()) {
            sections.put(PromptSection.EDGE_CASE_FOCUS, PromptTemplates.EDGE_CASE_FOCUS);
        }

        sections.put(PromptSection.EXTRACTED_CONTEXT, "Context Extracted:\n" + context.describe());
        sections.put(PromptSection.USER_QUESTION, "User Question:\n" + question);

        return new ComposedPrompt(sections);
    }
}
