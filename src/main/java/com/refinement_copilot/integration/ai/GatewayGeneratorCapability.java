package com.refinement_copilot.integration.ai;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Generator capability backed by the gateway's free text endpoint
 */
@Component
@RequiredArgsConstructor
public class GatewayGeneratorCapability implements GeneratorCapability {

    private final AIService aiService;

    @Override
    public String generate(String prompt) throws Exception {
        return aiService.generate(prompt);
    }
}
