package com.refinement_copilot.config;

import com.refinement_copilot.common.constants.IntentConstants;
import com.refinement_copilot.domain.intent.IntentTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the lookup tables used by the gates
 */
@Configuration
@EnableConfigurationProperties(CopilotProperties.class)
@Slf4j
public class CopilotConfig {

    /**
     * Default thresholds with any configured overrides applied
     */
    @Bean
    public IntentTable<Double> intentThresholds(CopilotProperties properties) {
        IntentTable<Double> thresholds = IntentConstants.DEFAULT_THRESHOLDS.withOverrides(properties.getThresholds());
        if (!properties.getThresholds().isEmpty()) {
            log.info("Applied confidence threshold overrides: {}", properties.getThresholds());
        }
        log.debug("Effective confidence thresholds: {}", thresholds);
        return thresholds;
    }
}
