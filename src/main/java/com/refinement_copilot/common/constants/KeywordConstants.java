package com.refinement_copilot.common.constants;

import java.util.List;

/**
 * Keyword sets used for context extraction and response style detection.
 * All entries are lower case and matched as substrings of the lower-cased question.
 */
public final class KeywordConstants {

    // Prevent instantiation
    private KeywordConstants() {}

    // Context Signals
    public static final List<String> UI_KEYWORDS = List.of("button", "screen", "click", "field", "page", "form", "input", "modal", "popup");
    public static final List<String> FIGMA_KEYWORDS = List.of("figma", "mockup", "design mockup", "ui design");
    public static final List<String> SCOPE_KEYWORDS = List.of("scope", "in-scope", "out of scope");
    public static final List<String> ACCEPTANCE_KEYWORDS = List.of("acceptance", "ac", "criteria");
    public static final List<String> READINESS_KEYWORDS = List.of("ready", "sprint", "development");
    public static final List<String> EDGE_CASE_KEYWORDS = List.of("edge", "risk", "error", "failure", "exception");
    public static final List<String> BUSINESS_RULE_KEYWORDS = List.of("rule", "validation", "condition", "if then", "if-then");
    public static final List<String> QUESTION_WORDS = List.of("what", "why", "how", "when", "where", "who");

    // Response Styles
    public static final List<String> CONVERSATIONAL_KEYWORDS = List.of("just explain", "in simple terms", "what is", "why", "help me understand");
    public static final List<String> STRUCTURED_KEYWORDS = List.of("acceptance", "scope", "ready", "criteria", "list", "define");
}
