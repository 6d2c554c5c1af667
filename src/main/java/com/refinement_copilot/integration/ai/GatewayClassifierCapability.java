package com.refinement_copilot.integration.ai;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Classifier capability backed by the gateway's structured output endpoint
 */
@Component
@RequiredArgsConstructor
public class GatewayClassifierCapability implements ClassifierCapability {

    private final AIService aiService;
    private final PromptTemplates promptTemplates;

    @Override
    public String classify(String prompt) throws Exception {
        return aiService.generateStructured(prompt, promptTemplates.intentClassificationSchema());
    }
}
