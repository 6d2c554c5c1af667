package com.refinement_copilot.service.gate;

import com.refinement_copilot.domain.context.QuestionContext;
import com.refinement_copilot.domain.intent.Intent;
import org.springframework.stereotype.Service;

/**
 * Decides whether the answer must spell out its assumptions
 */
@Service
public class AssumptionGate {

    public boolean needsAssumptions(Intent intent, QuestionContext context) {
        if (intent == null) {
            return false;
        }
        switch (intent) {
            case ACCEPTANCE_CRITERIA:
            case DEVELOPMENT_READINESS:
                return !context.uiRelated();
            case FIGMA_ALIGNMENT:
                return !context.mentionsFigma();
            case SCOPE_DEFINITION:
                return !context.mentionsScope();
            default:
                return false;
        }
    }
}
