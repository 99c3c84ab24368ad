package com.deskpilot.rag.assembly;

import static org.junit.jupiter.api.Assertions.*;

import com.deskpilot.model.AssembledContext;
import com.deskpilot.model.DropReason;
import com.deskpilot.model.HitSource;
import com.deskpilot.model.RecordKind;
import com.deskpilot.model.RetrievalHit;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

    private final ContextAssembler assembler = new ContextAssembler();

    private static RetrievalHit vector(String docId, double score, String text, int start) {
        return new RetrievalHit(HitSource.VECTOR, score, text, docId, docId + ".pdf", null, "page:1", RecordKind.DOCUMENT,
                null, start, start + text.length(), 1.0, null);
    }

    private static RetrievalHit structured(String id, double score, String text, Instant updatedAt) {
        return new RetrievalHit(HitSource.STRUCTURED, score, text, id, "Ticket " + id, null, null, RecordKind.TICKET,
                "Hardware", RetrievalHit.NO_OFFSET, RetrievalHit.NO_OFFSET, 1.0, updatedAt);
    }

    private static List<String> ids(AssembledContext context) {
        return context.hits().stream().map(RetrievalHit::provenanceId).toList();
    }

    @Nested
    class Budget {

        @Test
        void shouldKeepHitsThatFitTheBudget() {
            AssembledContext context = assembler.assemble(
                    List.of(vector("a", 0.9, "x".repeat(40), 0), vector("b", 0.8, "y".repeat(40), 0), vector("c", 0.7, "z".repeat(40), 0)),
                    List.of(), 100);

            assertEquals(List.of("a", "b"), ids(context));
            assertEquals(80, context.usedChars());
            assertEquals(1, context.droppedCount(DropReason.BUDGET));
        }

        @Test
        void shouldExcludeOversizedHitWholeAndStopThere() {
            AssembledContext context = assembler.assemble(
                    List.of(vector("a", 0.9, "x".repeat(50), 0), vector("b", 0.8, "y".repeat(200), 0), vector("c", 0.7, "z".repeat(10), 0)),
                    List.of(), 100);

            assertEquals(List.of("a"), ids(context));
            assertEquals(2, context.droppedCount(DropReason.BUDGET));
            assertTrue(context.hits().stream().allMatch(h -> h.text().length() <= 100));
        }

        @Test
        void shouldKeepNothingWithZeroBudget() {
            AssembledContext context = assembler.assemble(List.of(vector("a", 0.9, "text", 0)), List.of(), 0);

            assertTrue(context.isEmpty());
            assertEquals(1, context.droppedCount(DropReason.BUDGET));
        }

        @Test
        void shouldRejectNegativeBudget() {
            assertThrows(IllegalArgumentException.class, () -> assembler.assemble(List.of(), List.of(), -1));
        }
    }

    @Test
    void shouldRankByScoreAcrossSources() {
        AssembledContext context = assembler.assemble(
                List.of(vector("doc", 0.6, "Restart the spooler", 0)),
                List.of(structured("T-1", 0.9, "Replace toner", null)), 1000);

        assertEquals(List.of("T-1", "doc"), ids(context));
    }

    @Test
    void shouldBreakTiesWithStructuredThenMostRecentFirst() {
        Instant older = Instant.parse("2023-01-01T00:00:00Z");
        Instant newer = Instant.parse("2024-01-01T00:00:00Z");
        AssembledContext context = assembler.assemble(
                List.of(vector("doc", 0.8, "Vector passage", 0)),
                List.of(structured("T-old", 0.8, "Old ticket", older), structured("T-undated", 0.8, "Undated ticket", null),
                        structured("T-new", 0.8, "New ticket", newer)), 1000);

        assertEquals(List.of("T-new", "T-old", "T-undated", "doc"), ids(context));
    }

    @Test
    void shouldKeepInputOrderForFullTies() {
        AssembledContext context = assembler.assemble(
                List.of(vector("first", 0.5, "one", 0), vector("second", 0.5, "two", 0)), List.of(), 1000);

        assertEquals(List.of("first", "second"), ids(context));
    }

    @Test
    void shouldDropOverlappingPassagesOfSameDocument() {
        AssembledContext context = assembler.assemble(
                List.of(vector("doc", 0.9, "The printer queue must be cleared", 0),
                        vector("doc", 0.8, "must be cleared before restarting", 20),
                        vector("doc", 0.7, "An unrelated later passage", 300)),
                List.of(), 1000);

        assertEquals(2, context.hits().size());
        assertEquals(1, context.droppedCount(DropReason.DUPLICATE));
        assertEquals(0.8, context.dropped().get(0).hit().score(), 1e-9);
    }

    @Test
    void shouldDropRepeatedStructuredText() {
        AssembledContext context = assembler.assemble(List.of(),
                List.of(structured("T-1", 0.9, "Printer offline. Resolution: power cycle", null),
                        structured("T-1", 0.5, "printer   offline.", null),
                        structured("T-2", 0.4, "Printer offline. Resolution: power cycle", null)), 1000);

        assertEquals(List.of("T-1", "T-2"), ids(context));
        assertEquals(1, context.droppedCount(DropReason.DUPLICATE));
    }

    @Test
    void shouldSkipBlankHits() {
        AssembledContext context = assembler.assemble(List.of(vector("doc", 0.9, "   ", 0)), null, 1000);

        assertTrue(context.isEmpty());
        assertTrue(context.dropped().isEmpty());
    }
}
