package com.refinement_copilot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Main application configuration class
 */
@Configuration
@Import({
    LlmGatewayConfig.class,
    CopilotConfig.class
})
public class ApplicationConfig {

    /**
     * Shared ObjectMapper bean for JSON processing throughout the application.
     * Gateway responses carry more fields than we read.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }
}
