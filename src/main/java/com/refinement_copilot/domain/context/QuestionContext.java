package com.refinement_copilot.domain.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Keyword signals extracted from a single refinement question
 */
public record QuestionContext(
    boolean uiRelated,
    boolean mentionsFigma,
    boolean mentionsScope,
    boolean mentionsAc,
    boolean mentionsReady,
    boolean mentionsEdgeCases,
    boolean mentionsBusinessRules,
    boolean hasQuestionWords
) {

    public static final QuestionContext EMPTY =
        new QuestionContext(false, false, false, false, false, false, false, false);

    /**
     * Flags keyed by their wire names, in declaration order
     */
    public Map<String, Boolean> asFlags() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        flags.put("ui_related", uiRelated);
        flags.put("mentions_figma", mentionsFigma);
        flags.put("mentions_scope", mentionsScope);
        flags.put("mentions_ac", mentionsAc);
        flags.put("mentions_ready", mentionsReady);
        flags.put("mentions_edge_cases", mentionsEdgeCases);
        flags.put("mentions_business_rules", mentionsBusinessRules);
        flags.put("has_question_words", hasQuestionWords);
        return Collections.unmodifiableMap(flags);
    }

    /**
     * One {@code name: value} line per flag
     */
    public String describe() {
        return asFlags().entrySet().stream()
            .map(e -> e.getKey() + ": " + e.getValue())
            .collect(Collectors.joining("\n"));
    }
}
