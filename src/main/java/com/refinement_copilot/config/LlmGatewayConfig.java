package com.refinement_copilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "llm.gateway")
public class LlmGatewayConfig {

    private String gatewayUrl;
    private String orgId;
    private String llmProvider;
    private String authScheme;
    private String authToken;
    private String tenantId;
    private String clientFeatureId;
    private String model;
    private double temperature;
    // Classification wants repeatable answers
    private double classificationTemperature;
    private int maxTokens;
    private int timeoutSeconds;

    public void validate() {
        if (gatewayUrl == null || gatewayUrl.isEmpty()) {
            throw new IllegalArgumentException("LLM Gateway URL is required");
        }
        if (orgId == null || orgId.isEmpty()) {
            throw new IllegalArgumentException("LLM Gateway org ID is required");
        }
        if (authToken == null || authToken.isEmpty()) {
            throw new IllegalArgumentException("LLM Gateway auth token is required");
        }
        if (tenantId == null || tenantId.isEmpty()) {
            throw new IllegalArgumentException("LLM Gateway tenant ID is required");
        }
    }
}
