package com.refinement_copilot.config;

import com.refinement_copilot.domain.intent.Intent;
import com.refinement_copilot.domain.intent.IntentTable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.ResolvableType;

import static org.assertj.core.api.Assertions.assertThat;

public class CopilotConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(CopilotConfig.class);

    @Test
    public void shouldUseDefaultThresholdsWithoutOverrides() {
        contextRunner.run(context -> {
            IntentTable<Double> thresholds = thresholds(context);
            Assertions.assertEquals(0.7, thresholds.get(Intent.OBJECTIVE_INTENT));
            Assertions.assertFalse(context.getBean(CopilotProperties.class).isFormatForJira());
        });
    }

    @Test
    public void shouldApplyConfiguredOverrides() {
        contextRunner
            .withPropertyValues("copilot.thresholds[ACCEPTANCE_CRITERIA]=0.75", "copilot.format-for-jira=true")
            .run(context -> {
                IntentTable<Double> thresholds = thresholds(context);
                Assertions.assertEquals(0.75, thresholds.get(Intent.ACCEPTANCE_CRITERIA));
                Assertions.assertEquals(0.65, thresholds.get(Intent.SCOPE_DEFINITION));
                Assertions.assertTrue(context.getBean(CopilotProperties.class).isFormatForJira());
            });
    }

    @Test
    public void shouldFailStartupOnOutOfRangeThreshold() {
        contextRunner
            .withPropertyValues("copilot.thresholds[BUSINESS_RULE]=1.5")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    public void shouldFailStartupOnUnknownIntent() {
        contextRunner
            .withPropertyValues("copilot.thresholds[SMALL_TALK]=0.5")
            .run(context -> assertThat(context).hasFailed());
    }

    @SuppressWarnings("unchecked")
    private static IntentTable<Double> thresholds(org.springframework.context.ApplicationContext context) {
        return (IntentTable<Double>) context.getBeanProvider(
            ResolvableType.forClassWithGenerics(IntentTable.class, Double.class)).getObject();
    }
}
