package com.refinement_copilot.service;

import com.refinement_copilot.common.constants.ErrorMessages;
import com.refinement_copilot.common.util.JiraRichTextFormatter;
import com.refinement_copilot.config.CopilotProperties;
import com.refinement_copilot.domain.classification.ClassificationResult;
import com.refinement_copilot.domain.context.QuestionContext;
import com.refinement_copilot.domain.context.ResponseStyle;
import com.refinement_copilot.domain.intent.Intent;
import com.refinement_copilot.integration.ai.ClassifierCapability;
import com.refinement_copilot.integration.ai.GeneratorCapability;
import com.refinement_copilot.service.analysis.ContextExtractor;
import com.refinement_copilot.service.analysis.ResponseStyleDetector;
import com.refinement_copilot.service.classification.IntentClassifier;
import com.refinement_copilot.service.gate.AssumptionGate;
import com.refinement_copilot.service.gate.ThresholdDecision;
import com.refinement_copilot.service.gate.ThresholdGate;
import com.refinement_copilot.service.generation.GenerationResult;
import com.refinement_copilot.service.generation.ResponseGenerator;
import com.refinement_copilot.service.observability.FailureKind;
import com.refinement_copilot.service.observability.PipelineObserver;
import com.refinement_copilot.service.observability.PipelineState;
import com.refinement_copilot.service.prompt.ComposedPrompt;
import com.refinement_copilot.service.prompt.PromptComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Answers a refinement question end to end: context and style, intent classification,
 * confidence gate, assumption gate, prompt composition, generation and the secondary-intent offer.
 * <p>
 * Always returns text. Failures surface as a clarifying question or an apology, never as an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefinementCopilotService {

    private final ContextExtractor contextExtractor;
    private final ResponseStyleDetector responseStyleDetector;
    private final IntentClassifier intentClassifier;
    private final ThresholdGate thresholdGate;
    private final AssumptionGate assumptionGate;
    private final PromptComposer promptComposer;
    private final ResponseGenerator responseGenerator;
    private final ClassifierCapability classifierCapability;
    private final GeneratorCapability generatorCapability;
    private final CopilotProperties properties;
    private final PipelineObserver observer;

    /**
     * Answers with the configured classifier and generator capabilities
     */
    public String answer(String question) {
        return answer(classifierCapability, generatorCapability, question);
    }

    public String answer(ClassifierCapability classifier, GeneratorCapability generator, String question) {
        Run run = new Run();
        try {
            String q = question == null ? "" : question;
            observer.onEvent(PipelineState.INIT, "Processing question: {}", abbreviate(q));

            QuestionContext context = contextExtractor.extract(q);
            run.moveTo(PipelineState.CONTEXT_EXTRACTED);

            ResponseStyle style = responseStyleDetector.detect(q);
            run.moveTo(PipelineState.STYLE_DETECTED);

            ClassificationResult classification = intentClassifier.classify(classifier, q);
            run.moveTo(PipelineState.INTENT_CLASSIFIED);

            ThresholdDecision decision = thresholdGate.evaluate(classification);
            if (decision.clarificationRequired()) {
                run.moveTo(PipelineState.CLARIFY_TERMINAL);
                return decision.clarifyingQuestion();
            }

            boolean needsAssumptions = assumptionGate.needsAssumptions(classification.primary(), context);
            run.moveTo(PipelineState.ASSUMPTION_GATED);

            ComposedPrompt prompt = promptComposer.compose(classification.primary(), q, context, style, needsAssumptions);
            run.moveTo(PipelineState.PROMPT_COMPOSED);

            GenerationResult generation = responseGenerator.generate(generator, prompt.render());
            run.moveTo(PipelineState.RESPONSE_GENERATED);
            if (generation.failed()) {
                run.moveTo(PipelineState.DONE);
                return generation.text();
            }

            String response = properties.isFormatForJira()
                ? JiraRichTextFormatter.format(generation.text())
                : generation.text();

            if (classification.hasSecondary()) {
                response = appendSecondaryOffer(response, classification.secondary());
            }
            run.moveTo(PipelineState.SECONDARY_ANNOTATED);

            run.moveTo(PipelineState.DONE);
            observer.onEvent(PipelineState.DONE, "Successfully generated response for {}", classification.primary());
            return response;

        } catch (Exception e) {
            try {
                observer.onFailure(FailureKind.UNEXPECTED_PIPELINE_FAILURE,
                    "Pipeline execution failed after state " + run.state, e);
                run.fail();
            } catch (RuntimeException observerFailure) {
                if (observerFailure != e) {
                    observerFailure.addSuppressed(e);
                }
                log.error("Pipeline observer failed while reporting an error", observerFailure);
            }
            return ErrorMessages.PIPELINE_FAILURE_MESSAGE;
        }
    }

    private String appendSecondaryOffer(String response, List<Intent> secondary) {
        String offered = secondary.stream()
            .map(Intent::name)
            .collect(Collectors.joining(", "));
        return response + String.format(ErrorMessages.SECONDARY_INTENTS_FORMAT, offered);
    }

    private static String abbreviate(String question) {
        return question.length() > 100 ? question.substring(0, 100) + "..." : question;
    }

    /**
     * Tracks the state of a single invocation. Terminal states are final, except that any state may fail.
     */
    private final class Run {
        private PipelineState state = PipelineState.INIT;

        void moveTo(PipelineState next) {
            if (state.isTerminal()) {
                throw new IllegalStateException("Cannot move from terminal state " + state + " to " + next);
            }
            state = next;
            observer.onTransition(next);
        }

        void fail() {
            state = PipelineState.ERROR;
            observer.onTransition(PipelineState.ERROR);
        }
    }
}
