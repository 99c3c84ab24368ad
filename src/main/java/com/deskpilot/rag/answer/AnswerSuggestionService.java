package com.deskpilot.rag.answer;

import com.deskpilot.constant.StopWords;
import com.deskpilot.model.HitSource;
import com.deskpilot.model.RecordKind;
import com.deskpilot.model.RetrievalHit;
import com.deskpilot.util.KeywordExtractor;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Follow-up actions and ticket category suggestions derived from the question and the
 * cited sources.
 */
@Component
public class AnswerSuggestionService {
    private static final Logger log = LoggerFactory.getLogger(AnswerSuggestionService.class);
    static final String CREATE_TICKET = "Create a support ticket if the suggested solutions don't resolve your issue";
    static final String REVIEW_KB = "Review the cited knowledge-base articles for detailed procedures";
    static final String CHECK_TICKETS = "Check the resolution steps from similar tickets";
    static final String OPEN_DOCUMENT = "Open the source document for the full context";
    private static final List<String> PROBLEM_PHRASES = List.of("not working", "doesn't work", "does not work", "can't", "won't");

    @Value("${deskpilot.answer.category-min-score:0.5}")
    private double categoryMinScore = 0.5;

    // "Category=kw1|kw2; Other=kw3"
    @Value("${deskpilot.answer.category-keywords:Hardware=printer|monitor|keyboard|mouse|laptop|scanner; Network=vpn|wifi|network|internet|dns; Access=password|login|account|locked|mfa; Software=install|license|update|outlook|excel}")
    private String categoryKeywords = "Hardware=printer|monitor|keyboard|mouse|laptop|scanner; Network=vpn|wifi|network|internet|dns; Access=password|login|account|locked|mfa; Software=install|license|update|outlook|excel";

    private Map<String, List<String>> categoryRules = Map.of();

    @PostConstruct
    public void init() {
        this.categoryRules = parseRules(this.categoryKeywords);
        log.info("Loaded {} category keyword rules", this.categoryRules.size());
    }

    public List<String> suggestedActions(String question, List<RetrievalHit> cited) {
        ArrayList<String> actions = new ArrayList<>();
        if (mentionsProblem(question)) {
            actions.add(CREATE_TICKET);
        }
        if (cited.stream().anyMatch(hit -> hit.kind() == RecordKind.KB_ARTICLE)) {
            actions.add(REVIEW_KB);
        }
        if (cited.stream().anyMatch(hit -> hit.kind() == RecordKind.TICKET)) {
            actions.add(CHECK_TICKETS);
        }
        if (cited.stream().anyMatch(hit -> hit.source() == HitSource.VECTOR)) {
            actions.add(OPEN_DOCUMENT);
        }
        return actions;
    }

    /**
     * A cited structured record's category wins when its score reaches the configured
     * minimum; below that, a keyword rule matching the question is preferred, and the
     * record's category is the last resort.
     */
    public Optional<String> suggestCategory(String question, List<RetrievalHit> cited) {
        Optional<RetrievalHit> topStructured = cited.stream()
                .filter(hit -> hit.source() == HitSource.STRUCTURED && hit.category() != null && !hit.category().isBlank())
                .max(Comparator.comparingDouble(RetrievalHit::score));
        if (topStructured.isPresent() && topStructured.get().score() >= this.categoryMinScore) {
            return Optional.of(topStructured.get().category());
        }
        Optional<String> byKeyword = this.categoryByKeyword(question);
        if (byKeyword.isPresent()) {
            return byKeyword;
        }
        return topStructured.map(RetrievalHit::category);
    }

    Optional<String> categoryByKeyword(String question) {
        if (question == null || question.isBlank()) {
            return Optional.empty();
        }
        String lower = question.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> rule : this.rules().entrySet()) {
            for (String keyword : rule.getValue()) {
                if (KeywordExtractor.containsTerm(lower, keyword)) {
                    return Optional.of(rule.getKey());
                }
            }
        }
        return Optional.empty();
    }

    static boolean mentionsProblem(String question) {
        if (question == null) {
            return false;
        }
        String lower = question.toLowerCase(Locale.ROOT).replace('\u2019', '\'');
        if (PROBLEM_PHRASES.stream().anyMatch(lower::contains)) {
            return true;
        }
        for (String word : lower.split("[^a-z']+")) {
            if (StopWords.PROBLEM_TERMS.contains(word)) {
                return true;
            }
        }
        return false;
    }

    static Map<String, List<String>> parseRules(String ruleText) {
        LinkedHashMap<String, List<String>> rules = new LinkedHashMap<>();
        if (ruleText == null || ruleText.isBlank()) {
            return rules;
        }
        for (String entry : ruleText.split(";")) {
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                if (!entry.isBlank()) {
                    log.warn("Ignoring malformed category rule '{}'", entry.trim());
                }
                continue;
            }
            String category = entry.substring(0, eq).trim();
            List<String> keywords = new ArrayList<>();
            for (String keyword : entry.substring(eq + 1).split("[|,]")) {
                String cleaned = keyword.trim().toLowerCase(Locale.ROOT);
                if (!cleaned.isEmpty()) {
                    keywords.add(cleaned);
                }
            }
            if (!category.isEmpty() && !keywords.isEmpty()) {
                rules.put(category, List.copyOf(keywords));
            }
        }
        return rules;
    }

    private Map<String, List<String>> rules() {
        if (this.categoryRules.isEmpty() && this.categoryKeywords != null && !this.categoryKeywords.isBlank()) {
            this.categoryRules = parseRules(this.categoryKeywords);
        }
        return this.categoryRules;
    }
}
