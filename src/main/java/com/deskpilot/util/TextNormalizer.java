package com.deskpilot.util;

import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern TRAILING_SPACES = Pattern.compile("(?m)[ \\t]+$");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private TextNormalizer() {
    }

    /**
     * Canonical form for extracted text: unix newlines, no control characters, no trailing
     * spaces, at most one blank line in a row. Chunk offsets refer to this form.
     */
    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (!normalized.isEmpty() && normalized.charAt(0) == '\uFEFF') {
            normalized = normalized.substring(1);
        }
        normalized = CONTROL_CHARS.matcher(normalized).replaceAll("");
        normalized = TRAILING_SPACES.matcher(normalized).replaceAll("");
        normalized = EXCESS_BLANK_LINES.matcher(normalized).replaceAll("\n\n");
        return normalized.strip();
    }
}
