package com.refinement_copilot;

import com.refinement_copilot.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Main application class for the Jira Refinement Copilot
 */
@SpringBootApplication
@Import(ApplicationConfig.class)
@Slf4j
public class RefinementCopilotApplication {

	private static final String LLM_GATEWAY_URL = "LLM_GATEWAY_URL";
	private static final String LLM_GATEWAY_AUTH_TOKEN = "LLM_GATEWAY_AUTH_TOKEN";

	public static void main(String[] args) {
		log.info("Starting Jira Refinement Copilot...");

		validateGatewaySettings();

		SpringApplication.run(RefinementCopilotApplication.class, args);

		log.info("Jira Refinement Copilot started successfully. Ready to answer refinement questions!");
	}

	private static void validateGatewaySettings() {
		String gatewayUrl = System.getenv(LLM_GATEWAY_URL);
		String authToken = System.getenv(LLM_GATEWAY_AUTH_TOKEN);

		if (isMissing(gatewayUrl)) {
			log.warn("{} environment variable is not set. Every answer will fall back to a clarifying question or an apology.", LLM_GATEWAY_URL);
		}

		if (isMissing(authToken)) {
			log.warn("{} environment variable is not set. Gateway requests will be rejected.", LLM_GATEWAY_AUTH_TOKEN);
		}

		if (!isMissing(gatewayUrl) && !isMissing(authToken)) {
			log.info("LLM Gateway settings detected. Classification and generation are enabled.");
		}
	}

	private static boolean isMissing(String value) {
		return value == null || value.trim().isEmpty();
	}
}
