package com.refinement_copilot.domain.context;

/**
 * How much structure the generated answer should carry
 */
public enum ResponseStyle {
    CONVERSATIONAL,
    STRUCTURED,
    HYBRID
}
