package com.refinement_copilot.service.analysis;

import com.refinement_copilot.domain.context.ResponseStyle;
import com.refinement_copilot.service.observability.PipelineObserver;
import com.refinement_copilot.service.observability.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.refinement_copilot.common.constants.KeywordConstants.CONVERSATIONAL_KEYWORDS;
import static com.refinement_copilot.common.constants.KeywordConstants.STRUCTURED_KEYWORDS;

/**
 * Picks the response style for a question.
 * Conversational cues win over structured ones when both are present.
 */
@Service
@RequiredArgsConstructor
public class ResponseStyleDetector {

    private final PipelineObserver observer;

    public ResponseStyle detect(String question) {
        String q = ContextExtractor.normalize(question);

        ResponseStyle style;
        if (ContextExtractor.containsAny(q, CONVERSATIONAL_KEYWORDS)) {
            style = ResponseStyle.CONVERSATIONAL;
        } else if (ContextExtractor.containsAny(q, STRUCTURED_KEYWORDS)) {
            style = ResponseStyle.STRUCTURED;
        } else {
            style = ResponseStyle.HYBRID;
        }

        observer.onEvent(PipelineState.STYLE_DETECTED, "Detected response style: {}", style);
        return style;
    }
}
