package com.deskpilot.ingest;

import com.deskpilot.model.Chunk;
import com.deskpilot.model.ExtractedUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Splits extracted text into overlapping passages for embedding.
 *
 * <p>Every chunk except the last of a unit is between {@code minChars} and {@code maxChars}
 * long; the last one is non-empty and at most {@code maxChars}. A chunk is cut after the
 * last sentence end or line break that keeps it at least {@code minChars} long, failing
 * that at the last word boundary, and only when the window contains no boundary at all is
 * it hard-split at {@code maxChars}. The next chunk restarts {@code overlapChars} before the
 * previous end, moved forward to the first word start so it never opens mid-word.</p>
 */
@Component
public class TextChunker {

    @Value("${deskpilot.chunking.min-chars:200}")
    private int minChars = 200;

    @Value("${deskpilot.chunking.max-chars:1000}")
    private int maxChars = 1000;

    @Value("${deskpilot.chunking.overlap-chars:100}")
    private int overlapChars = 100;

    /**
     * Chunks with the configured sizes, tagging every chunk with the document-level metadata.
     */
    public List<Chunk> chunk(ExtractedUnit unit, Map<String, Object> documentMetadata) {
        return this.chunk(unit, documentMetadata, this.minChars, this.maxChars, this.overlapChars);
    }

    public List<Chunk> chunk(ExtractedUnit unit, int minChars, int maxChars, int overlapChars) {
        return this.chunk(unit, Map.of(), minChars, maxChars, overlapChars);
    }

    public List<Chunk> chunk(ExtractedUnit unit, Map<String, Object> documentMetadata, int minChars, int maxChars, int overlapChars) {
        validate(minChars, maxChars, overlapChars);
        String text = unit.text();
        int length = text.length();
        int start = skipWhitespace(text, 0);
        if (start >= length) {
            return List.of();
        }
        Map<String, Object> metadata = inheritedMetadata(unit, documentMetadata);
        ArrayList<Chunk> chunks = new ArrayList<>();
        int ordinal = 0;
        while (start < length) {
            if (length - start <= maxChars) {
                int end = trimTrailingWhitespace(text, start, length);
                chunks.add(new Chunk(unit.documentId(), unit.label(), ordinal, text.substring(start, end), start, end, metadata));
                break;
            }
            int end = findCut(text, start, minChars, maxChars);
            chunks.add(new Chunk(unit.documentId(), unit.label(), ordinal++, text.substring(start, end), start, end, metadata));
            start = nextStart(text, start, end, overlapChars);
        }
        return chunks;
    }

    public int getMinChars() {
        return this.minChars;
    }

    public int getMaxChars() {
        return this.maxChars;
    }

    public int getOverlapChars() {
        return this.overlapChars;
    }

    private static void validate(int minChars, int maxChars, int overlapChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
        }
        if (minChars < 0 || minChars > maxChars) {
            throw new IllegalArgumentException("minChars must be within [0, maxChars]: " + minChars);
        }
        int overlapLimit = minChars > 0 ? minChars : maxChars;
        if (overlapChars < 0 || overlapChars >= overlapLimit) {
            throw new IllegalArgumentException("overlapChars must be within [0, " + overlapLimit + "): " + overlapChars);
        }
    }

    /**
     * Exclusive end of the chunk starting at {@code start}; always within
     * {@code [start + max(minChars, 1), start + maxChars]}.
     */
    private static int findCut(String text, int start, int minChars, int maxChars) {
        int lowest = start + Math.max(1, minChars);
        int highest = start + maxChars;
        int wordBoundary = -1;
        for (int end = highest; end >= lowest; end--) {
            if (isSentenceBoundary(text, end)) {
                return end;
            }
            if (wordBoundary < 0 && isWordBoundary(text, end)) {
                wordBoundary = end;
            }
        }
        return wordBoundary > 0 ? wordBoundary : highest;
    }

    private static int nextStart(String text, int start, int end, int overlapChars) {
        int next = end - overlapChars;
        while (next < end && !isWordStart(text, next)) {
            next++;
        }
        if (next <= start || next >= end) {
            next = end;
        }
        return skipWhitespace(text, next);
    }

    // a cut at `end` keeps text[end - 1] and drops the whitespace at text[end]
    private static boolean isWordBoundary(String text, int end) {
        return end > 0 && end < text.length()
                && Character.isWhitespace(text.charAt(end))
                && !Character.isWhitespace(text.charAt(end - 1));
    }

    private static boolean isSentenceBoundary(String text, int end) {
        if (!isWordBoundary(text, end)) {
            return false;
        }
        char last = text.charAt(end - 1);
        return last == '.' || last == '!' || last == '?' || text.charAt(end) == '\n';
    }

    private static boolean isWordStart(String text, int index) {
        return !Character.isWhitespace(text.charAt(index))
                && (index == 0 || Character.isWhitespace(text.charAt(index - 1)));
    }

    private static int skipWhitespace(String text, int from) {
        int index = from;
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private static int trimTrailingWhitespace(String text, int start, int end) {
        int trimmed = end;
        while (trimmed > start && Character.isWhitespace(text.charAt(trimmed - 1))) {
            trimmed--;
        }
        return trimmed;
    }

    private static Map<String, Object> inheritedMetadata(ExtractedUnit unit, Map<String, Object> documentMetadata) {
        HashMap<String, Object> metadata = new HashMap<>();
        if (documentMetadata != null) {
            metadata.putAll(documentMetadata);
        }
        metadata.putAll(unit.attributes());
        metadata.put("document_id", unit.documentId());
        metadata.put("label", unit.label());
        metadata.put("extraction_confidence", unit.extractionConfidence());
        return metadata;
    }
}
