package com.refinement_copilot.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LlmGatewayConfigTest {

    private LlmGatewayConfig complete() {
        LlmGatewayConfig config = new LlmGatewayConfig();
        config.setGatewayUrl("https://gateway.example.com");
        config.setOrgId("00D000000000001");
        config.setAuthToken("token");
        config.setTenantId("core/prod/00D000000000001");
        return config;
    }

    @Test
    public void shouldAcceptCompleteSettings() {
        Assertions.assertDoesNotThrow(() -> complete().validate());
    }

    @Test
    public void shouldNameTheMissingSetting() {
        LlmGatewayConfig noToken = complete();
        noToken.setAuthToken("");
        LlmGatewayConfig noTenant = complete();
        noTenant.setTenantId(null);

        Assertions.assertEquals("LLM Gateway auth token is required",
            Assertions.assertThrows(IllegalArgumentException.class, noToken::validate).getMessage());
        Assertions.assertEquals("LLM Gateway tenant ID is required",
            Assertions.assertThrows(IllegalArgumentException.class, noTenant::validate).getMessage());
    }
}
