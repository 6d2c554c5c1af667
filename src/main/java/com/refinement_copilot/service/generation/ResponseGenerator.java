package com.refinement_copilot.service.generation;

import com.refinement_copilot.common.constants.ErrorMessages;
import com.refinement_copilot.integration.ai.GeneratorCapability;
import com.refinement_copilot.service.observability.FailureKind;
import com.refinement_copilot.service.observability.PipelineObserver;
import com.refinement_copilot.service.observability.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Runs the generator capability once. Errors are reported and replaced by a fixed apology, never rethrown.
 */
@Service
@RequiredArgsConstructor
public class ResponseGenerator {

    private final PipelineObserver observer;

    public GenerationResult generate(GeneratorCapability generator, String prompt) {
        try {
            String response = generator.generate(prompt);
            if (response == null) {
                throw new IllegalStateException("Generator returned no response");
            }
            observer.onEvent(PipelineState.RESPONSE_GENERATED, "Response generated successfully ({} chars)", response.length());
            return GenerationResult.success(response.strip());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            observer.onFailure(FailureKind.GENERATION_CAPABILITY_FAILURE, "Response generation failed", e);
            return GenerationResult.failure(ErrorMessages.GENERATION_FAILURE_MESSAGE);
        }
    }
}
