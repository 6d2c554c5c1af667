package com.refinement_copilot.service.analysis;

import com.refinement_copilot.domain.context.QuestionContext;
import com.refinement_copilot.service.observability.PipelineObserver;
import com.refinement_copilot.service.observability.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

import static com.refinement_copilot.common.constants.KeywordConstants.*;

/**
 * Derives keyword signals from a question. Never fails; a null question yields all-false flags.
 */
@Service
@RequiredArgsConstructor
public class ContextExtractor {

    private final PipelineObserver observer;

    public QuestionContext extract(String question) {
        String q = normalize(question);

        QuestionContext context = new QuestionContext(
            containsAny(q, UI_KEYWORDS),
            containsAny(q, FIGMA_KEYWORDS),
            containsAny(q, SCOPE_KEYWORDS),
            containsAny(q, ACCEPTANCE_KEYWORDS),
            containsAny(q, READINESS_KEYWORDS),
            containsAny(q, EDGE_CASE_KEYWORDS),
            containsAny(q, BUSINESS_RULE_KEYWORDS),
            containsAny(q, QUESTION_WORDS)
        );

        observer.onEvent(PipelineState.CONTEXT_EXTRACTED, "Extracted context: {}", context.asFlags());
        return context;
    }

    static String normalize(String question) {
        return question == null ? "" : question.toLowerCase(Locale.ROOT);
    }

    static boolean containsAny(String normalizedQuestion, List<String> keywords) {
        return keywords.stream().anyMatch(normalizedQuestion::contains);
    }
}
