package com.deskpilot.rag.answer;

import com.deskpilot.model.AssembledContext;
import com.deskpilot.model.RecordKind;
import com.deskpilot.model.RetrievalHit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.lang.Nullable;

/**
 * Builds the grounded generation prompt. Each context hit is numbered as {@code [S1]},
 * {@code [S2]}, ... followed by its provenance so answers can cite by label.
 */
public final class PromptBuilder {
    public static final String INSUFFICIENT_CONTEXT = "INSUFFICIENT_CONTEXT";
    private static final Pattern SOURCE_LABEL = Pattern.compile("\\[S(\\d{1,4})]");

    private PromptBuilder() {
    }

    public static String build(String question, AssembledContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an IT support assistant. Answer the question using only the numbered context below.\n")
                .append("Cite every source you use by its bracket label, for example [S1].\n")
                .append("Give step-by-step instructions when the context contains them.\n")
                .append("If the context does not contain enough information to answer, reply with exactly ")
                .append(INSUFFICIENT_CONTEXT).append(" and nothing else.\n\n")
                .append("CONTEXT:\n");
        List<RetrievalHit> hits = context.hits();
        for (int i = 0; i < hits.size(); i++) {
            RetrievalHit hit = hits.get(i);
            prompt.append(sourceLabel(i)).append(" (").append(provenance(hit)).append(")\n")
                    .append(hit.text()).append("\n\n");
        }
        prompt.append("QUESTION: ").append(question.trim()).append("\n");
        return prompt.toString();
    }

    public static String sourceLabel(int index) {
        return "[S" + (index + 1) + "]";
    }

    /**
     * Zero-based indexes of the {@code [Sn]} labels the answer refers to, in first-cited order.
     */
    public static List<Integer> citedIndexes(@Nullable String answer, int hitCount) {
        if (answer == null || answer.isBlank()) {
            return List.of();
        }
        LinkedHashSet<Integer> indexes = new LinkedHashSet<>();
        Matcher matcher = SOURCE_LABEL.matcher(answer);
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1)) - 1;
            if (index >= 0 && index < hitCount) {
                indexes.add(index);
            }
        }
        return List.copyOf(indexes);
    }

    public static String provenance(RetrievalHit hit) {
        String title = normalize(hit.title());
        String kind = hit.kind() == RecordKind.TICKET ? "ticket"
                : hit.kind() == RecordKind.KB_ARTICLE ? "kb article" : "document";
        StringBuilder line = new StringBuilder(kind).append(' ');
        if (hit.kind() == RecordKind.DOCUMENT) {
            line.append(title.isBlank() ? hit.provenanceId() : title);
            if (hit.label() != null && !hit.label().isBlank()) {
                line.append(", ").append(hit.label());
            }
        } else {
            line.append(hit.provenanceId());
            if (!title.isBlank()) {
                line.append(": ").append(title);
            }
        }
        return line.toString();
    }

    private static String normalize(@Nullable String value) {
        return value == null ? "" : value.trim();
    }
}
