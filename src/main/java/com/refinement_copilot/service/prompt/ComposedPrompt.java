package com.refinement_copilot.service.prompt;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable prompt made of named sections. Rendering always follows {@link PromptSection} order.
 */
public final class ComposedPrompt {

    private static final String SECTION_SEPARATOR = "\n\n";

    private final Map<PromptSection, String> sections;

    ComposedPrompt(EnumMap<PromptSection, String> sections) {
        this.sections = Collections.unmodifiableMap(new EnumMap<>(sections));
    }

    public boolean has(PromptSection section) {
        return sections.containsKey(section);
    }

    public String section(PromptSection section) {
        return sections.get(section);
    }

    public Set<PromptSection> presentSections() {
        return sections.keySet();
    }

    public String render() {
        return String.join(SECTION_SEPARATOR, sections.values());
    }

    @Override
    public String toString() {
        return render();
    }
}
