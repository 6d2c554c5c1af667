package com.refinement_copilot.integration.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.refinement_copilot.config.LlmGatewayConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class GatewayCapabilityTest {

    private final PromptTemplates templates = new PromptTemplates();

    @Test
    public void shouldClassifyThroughStructuredOutput() throws Exception {
        AIService aiService = mock(AIService.class);
        when(aiService.generateStructured(eq("prompt"), anyMap())).thenReturn("{\"confidence\": 0.9}");

        String raw = new GatewayClassifierCapability(aiService, templates).classify("prompt");

        Assertions.assertEquals("{\"confidence\": 0.9}", raw);
        verify(aiService).generateStructured("prompt", templates.intentClassificationSchema());
    }

    @Test
    public void shouldGenerateThroughFreeText() throws Exception {
        AIService aiService = mock(AIService.class);
        when(aiService.generate("prompt")).thenReturn("answer");

        Assertions.assertEquals("answer", new GatewayGeneratorCapability(aiService).generate("prompt"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldRestrictSchemaToKnownIntents() {
        Map<String, Object> schema = templates.intentClassificationSchema();
        Map<String, Object> definition = (Map<String, Object>) schema.get("schema");
        Map<String, Object> properties = (Map<String, Object>) definition.get("properties");
        Map<String, Object> primary = (Map<String, Object>) properties.get("primary_intent");

        Assertions.assertEquals("intent_classification", schema.get("name"));
        Assertions.assertEquals(10, ((List<String>) primary.get("enum")).size());
        Assertions.assertEquals(List.of("primary_intent", "secondary_intents", "confidence"), definition.get("required"));
    }

    @Test
    public void shouldRefuseToCallGatewayWithoutSettings() {
        LlmGatewayService gateway = new LlmGatewayService(new LlmGatewayConfig(), new ObjectMapper());

        IllegalArgumentException error = Assertions.assertThrows(IllegalArgumentException.class, () -> gateway.generate("prompt"));
        Assertions.assertEquals("LLM Gateway URL is required", error.getMessage());
        Assertions.assertThrows(IllegalArgumentException.class, () -> gateway.generateStructured("prompt", Map.of()));
    }
}
