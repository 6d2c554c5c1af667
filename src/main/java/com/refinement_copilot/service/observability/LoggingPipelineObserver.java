package com.refinement_copilot.service.observability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes pipeline diagnostics to the application log
 */
@Component
@Slf4j
public class LoggingPipelineObserver implements PipelineObserver {

    @Override
    public void onTransition(PipelineState state) {
        log.debug("Pipeline state -> {}", state);
    }

    @Override
    public void onEvent(PipelineState stage, String message, Object... args) {
        switch (stage) {
            case INTENT_CLASSIFIED:
            case CLARIFY_TERMINAL:
            case DONE:
                log.info("[{}] " + message, prepend(stage, args));
                break;
            default:
                if (log.isDebugEnabled()) {
                    log.debug("[{}] " + message, prepend(stage, args));
                }
        }
    }

    @Override
    public void onFailure(FailureKind kind, String message, Throwable cause) {
        switch (kind) {
            case CLASSIFICATION_PARSE_FAILURE:
                log.warn("[{}] {}", kind, message);
                log.debug("Parse failure detail", cause);
                break;
            case CLASSIFICATION_CAPABILITY_FAILURE:
            case GENERATION_CAPABILITY_FAILURE:
                log.error("[{}] {}: {}", kind, message, cause != null ? cause.getMessage() : "no cause");
                break;
            default:
                log.error("[{}] {}", kind, message, cause);
        }
    }

    private static Object[] prepend(Object first, Object[] rest) {
        Object[] combined = new Object[rest.length + 1];
        combined[0] = first;
        System.arraycopy(rest, 0, combined, 1, rest.length);
        return combined;
    }
}
