package com.deskpilot.util;

import com.deskpilot.constant.StopWords;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public final class KeywordExtractor {
    private static final int MIN_KEYWORD_LENGTH = 3;

    private KeywordExtractor() {
    }

    /**
     * Lower-cased, de-duplicated content words in first-seen order.
     */
    public static Set<String> extract(String text) {
        LinkedHashSet<String> keywords = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return keywords;
        }
        for (String word : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            String cleaned = word.replaceAll("[^a-z0-9]", "");
            if (cleaned.length() < MIN_KEYWORD_LENGTH || StopWords.KEYWORDS.contains(cleaned)) {
                continue;
            }
            keywords.add(cleaned);
        }
        return keywords;
    }

    public static boolean containsTerm(String lowerText, String keyword) {
        if (lowerText.contains(keyword)) {
            return true;
        }
        // "printers" should still match "printer" and vice versa
        if (keyword.length() > 4 && keyword.endsWith("s")) {
            return lowerText.contains(keyword.substring(0, keyword.length() - 1));
        }
        return false;
    }
}
