package com.deskpilot.ingest.extract;

import java.util.List;
import java.util.stream.Collectors;

public record OcrResult(List<OcrBlock> blocks) {

    public OcrResult {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static OcrResult empty() {
        return new OcrResult(List.of());
    }

    public String text() {
        return this.blocks.stream()
                .map(OcrBlock::text)
                .filter(t -> t != null && !t.isBlank())
                .map(String::strip)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Mean recognizer confidence over blocks that produced text, on a 0..1 scale. Recognizers
     * reporting percentages (0..100) are rescaled.
     */
    public double meanConfidence() {
        return this.blocks.stream()
                .filter(b -> b.text() != null && !b.text().isBlank())
                .mapToDouble(b -> b.confidence() > 1.0 ? b.confidence() / 100.0 : b.confidence())
                .map(c -> Math.max(0.0, Math.min(1.0, c)))
                .average()
                .orElse(0.0);
    }
}
