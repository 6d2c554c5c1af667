package com.refinement_copilot.config;

import com.refinement_copilot.domain.intent.Intent;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables for the refinement pipeline
 */
@Data
@Validated
@ConfigurationProperties(prefix = "copilot")
public class CopilotProperties {

    /**
     * Per-intent overrides of the default confidence thresholds
     */
    private Map<Intent, @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double> thresholds = new EnumMap<>(Intent.class);

    /**
     * Reformat generated answers as plain text for the Jira rich text editor
     */
    private boolean formatForJira = false;
}
