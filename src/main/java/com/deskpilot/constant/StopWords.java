package com.deskpilot.constant;

import java.util.Set;

public final class StopWords {
    public static final Set<String> KEYWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "from", "as", "is", "was", "are",
            "were", "been", "be", "have", "has", "had", "what", "where",
            "when", "who", "how", "why", "tell", "me", "about", "describe",
            "find", "show", "give", "also", "does", "it", "my", "can",
            "do", "i", "we", "our", "this", "that", "there", "please"
    );

    /**
     * Words that mark a question as a problem report rather than a how-to.
     */
    public static final Set<String> PROBLEM_TERMS = Set.of(
            "help", "problem", "issue", "error", "broken", "fail", "failed",
            "failing", "failure", "cannot", "can't", "unable", "crash", "down"
    );

    private StopWords() {
    }
}
