package com.refinement_copilot.service.gate;

import com.refinement_copilot.domain.context.QuestionContext;
import com.refinement_copilot.domain.intent.Intent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AssumptionGateTest {

    private final AssumptionGate gate = new AssumptionGate();

    private static final QuestionContext UI = new QuestionContext(true, false, false, false, false, false, false, false);
    private static final QuestionContext FIGMA = new QuestionContext(false, true, false, false, false, false, false, false);
    private static final QuestionContext SCOPE = new QuestionContext(false, false, true, false, false, false, false, false);

    @Test
    public void shouldRequireAssumptionsForAcceptanceCriteriaWithoutUiSignal() {
        Assertions.assertTrue(gate.needsAssumptions(Intent.ACCEPTANCE_CRITERIA, QuestionContext.EMPTY));
        Assertions.assertFalse(gate.needsAssumptions(Intent.ACCEPTANCE_CRITERIA, UI));
        Assertions.assertTrue(gate.needsAssumptions(Intent.DEVELOPMENT_READINESS, FIGMA));
        Assertions.assertFalse(gate.needsAssumptions(Intent.DEVELOPMENT_READINESS, UI));
    }

    @Test
    public void shouldRequireAssumptionsForFigmaAlignmentWithoutFigmaMention() {
        Assertions.assertTrue(gate.needsAssumptions(Intent.FIGMA_ALIGNMENT, UI));
        Assertions.assertFalse(gate.needsAssumptions(Intent.FIGMA_ALIGNMENT, FIGMA));
    }

    @Test
    public void shouldRequireAssumptionsForScopeWithoutScopeMention() {
        Assertions.assertTrue(gate.needsAssumptions(Intent.SCOPE_DEFINITION, UI));
        Assertions.assertFalse(gate.needsAssumptions(Intent.SCOPE_DEFINITION, SCOPE));
    }

    @Test
    public void shouldNeverRequireAssumptionsForOtherIntents() {
        for (Intent intent : new Intent[] {Intent.OBJECTIVE_INTENT, Intent.UI_UX_BEHAVIOUR, Intent.EDGE_CASE_RISK_ANALYSIS,
                Intent.BUSINESS_RULE, Intent.DEPENDENCY_IMPACT, Intent.STORY_REFINEMENT}) {
            Assertions.assertFalse(gate.needsAssumptions(intent, QuestionContext.EMPTY), intent.name());
        }
    }
}
