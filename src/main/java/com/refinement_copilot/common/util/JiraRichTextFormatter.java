package com.refinement_copilot.common.util;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for turning generated answers into plain text for the Jira rich text editor.
 * Markdown and wiki markup are dropped; headings, bullets and paragraphs stay readable.
 */
public class JiraRichTextFormatter {

    // Numbered headings such as "1. **Understanding the Feature**:"
    private static final Pattern SECTION_HEADING = Pattern.compile("^\\d+\\.\\s+\\*{0,2}(.+?)\\*{0,2}:");
    private static final Pattern REPEATED_WHITESPACE = Pattern.compile("\\s{2,}");
    private static final String BULLET_PREFIX = "-";

    private JiraRichTextFormatter() {}

    public static String format(@NotNull String text) {
        String normalized = text.replace("\r", "").trim();

        List<String> output = new ArrayList<>();
        StringBuilder paragraph = new StringBuilder();

        for (String rawLine : normalized.split("\n", -1)) {
            String line = rawLine.trim();

            if (line.isEmpty()) {
                flush(paragraph, output);
                continue;
            }

            Matcher heading = SECTION_HEADING.matcher(line);
            if (heading.lookingAt()) {
                flush(paragraph, output);
                output.add(heading.group(1) + ":");
                continue;
            }

            if (line.startsWith(BULLET_PREFIX)) {
                flush(paragraph, output);
                output.add(line);
                continue;
            }

            // Wrapped text joins the current paragraph
            paragraph.append(' ').append(line);
        }
        flush(paragraph, output);

        return REPEATED_WHITESPACE.matcher(String.join("\n", output)).replaceAll(" ");
    }

    private static void flush(@NotNull StringBuilder paragraph, @NotNull List<String> output) {
        if (paragraph.length() > 0) {
            output.add(paragraph.toString().trim());
            paragraph.setLength(0);
        }
    }
}
