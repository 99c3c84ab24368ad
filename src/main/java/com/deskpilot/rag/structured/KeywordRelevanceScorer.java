package com.deskpilot.rag.structured;

import com.deskpilot.model.StructuredRecord;
import com.deskpilot.util.KeywordExtractor;
import java.util.Locale;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Scores a structured record by how many distinct query keywords it contains. A keyword
 * found in the title counts fully, one found only in the body counts {@code bodyWeight}.
 */
@Component
public class KeywordRelevanceScorer {

    @Value("${deskpilot.structured.body-match-weight:0.7}")
    private double bodyWeight = 0.7;

    public double score(String query, StructuredRecord record) {
        return this.score(KeywordExtractor.extract(query), record);
    }

    public double score(Set<String> keywords, StructuredRecord record) {
        if (keywords.isEmpty() || record == null) {
            return 0.0;
        }
        String title = record.title().toLowerCase(Locale.ROOT);
        String body = record.text().toLowerCase(Locale.ROOT);
        double total = 0.0;
        for (String keyword : keywords) {
            if (KeywordExtractor.containsTerm(title, keyword)) {
                total += 1.0;
            } else if (KeywordExtractor.containsTerm(body, keyword)) {
                total += this.bodyWeight;
            }
        }
        return Math.max(0.0, Math.min(1.0, total / keywords.size()));
    }
}
