package com.refinement_copilot.service.analysis;

import com.refinement_copilot.domain.context.QuestionContext;
import com.refinement_copilot.service.observability.PipelineObserver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ContextExtractorTest {

    private final ContextExtractor extractor = new ContextExtractor(PipelineObserver.NO_OP);

    @Test
    public void shouldDetectUiAndFigmaSignals() {
        QuestionContext context = extractor.extract("Does the Save BUTTON match the Figma mockup?");

        Assertions.assertTrue(context.uiRelated());
        Assertions.assertTrue(context.mentionsFigma());
        Assertions.assertFalse(context.mentionsScope());
        Assertions.assertFalse(context.mentionsEdgeCases());
    }

    @Test
    public void shouldDetectScopeAndQuestionWords() {
        QuestionContext context = extractor.extract("What is out of scope for this story?");

        Assertions.assertTrue(context.mentionsScope());
        Assertions.assertTrue(context.hasQuestionWords());
        Assertions.assertFalse(context.uiRelated());
    }

    @Test
    public void shouldDetectEdgeCasesReadinessAndRules() {
        QuestionContext context = extractor.extract("Is the story ready? Any validation rule or failure risk?");

        Assertions.assertTrue(context.mentionsReady());
        Assertions.assertTrue(context.mentionsEdgeCases());
        Assertions.assertTrue(context.mentionsBusinessRules());
    }

    @Test
    public void shouldMatchSubstringsLikeAcInsideWords() {
        // "ac" also matches inside words such as "back"
        QuestionContext context = extractor.extract("Go back");

        Assertions.assertTrue(context.mentionsAc());
    }

    @Test
    public void shouldReturnAllFalseForNullOrEmptyQuestion() {
        Assertions.assertEquals(QuestionContext.EMPTY, extractor.extract(null));
        Assertions.assertEquals(QuestionContext.EMPTY, extractor.extract(""));
    }

    @Test
    public void shouldDescribeFlagsOnePerLine() {
        String description = extractor.extract("click").describe();

        Assertions.assertTrue(description.startsWith("ui_related: true\n"));
        Assertions.assertTrue(description.endsWith("has_question_words: false"));
        Assertions.assertEquals(8, description.split("\n").length);
    }
}
