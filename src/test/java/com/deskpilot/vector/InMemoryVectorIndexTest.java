package com.deskpilot.vector;

import static org.junit.jupiter.api.Assertions.*;

import com.deskpilot.model.Chunk;
import com.deskpilot.model.EmbeddedChunk;
import com.deskpilot.model.HitSource;
import com.deskpilot.model.RecordKind;
import com.deskpilot.model.RetrievalHit;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryVectorIndexTest {
    private static final String MODEL = "nomic-embed-text";

    private InMemoryVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex();
    }

    private static EmbeddedChunk chunk(String documentId, int ordinal, String text, float... vector) {
        Map<String, Object> metadata = Map.of("filename", documentId + ".txt", "extraction_confidence", 0.9,
                "ingested_at", "2024-05-01T10:15:30Z");
        return new EmbeddedChunk(new Chunk(documentId, "document", ordinal, text, 0, text.length(), metadata), vector, MODEL);
    }

    @Test
    void shouldReturnAllEntriesWhenFewerThanK() {
        index.upsert(chunk("a", 0, "printer queue", 1.0f, 0.0f));
        index.upsert(chunk("b", 0, "vpn client", 0.6f, 0.8f));

        List<RetrievalHit> hits = index.search(new float[] {1.0f, 0.0f}, 5, MODEL);

        assertEquals(2, hits.size());
        assertEquals("a", hits.get(0).provenanceId());
        assertEquals(1.0, hits.get(0).score(), 1e-9);
        assertEquals(0.6, hits.get(1).score(), 1e-6);
    }

    @Test
    void shouldMapChunkMetadataToHit() {
        index.upsert(chunk("a", 0, "printer queue", 1.0f, 0.0f));

        RetrievalHit hit = index.search(new float[] {1.0f, 0.0f}, 1, MODEL).get(0);

        assertEquals(HitSource.VECTOR, hit.source());
        assertEquals(RecordKind.DOCUMENT, hit.kind());
        assertEquals("a.txt", hit.title());
        assertEquals("document", hit.label());
        assertEquals(0.9, hit.extractionConfidence(), 1e-9);
        assertEquals(Instant.parse("2024-05-01T10:15:30Z"), hit.updatedAt());
        assertEquals(13, hit.endOffset());
    }

    @Test
    void shouldLimitToTopK() {
        for (int i = 0; i < 10; i++) {
            index.upsert(chunk("doc-" + i, 0, "passage " + i, 1.0f, i / 10.0f));
        }

        List<RetrievalHit> hits = index.search(new float[] {1.0f, 0.0f}, 3, MODEL);

        assertEquals(List.of("doc-0", "doc-1", "doc-2"), hits.stream().map(RetrievalHit::provenanceId).toList());
    }

    @Test
    void shouldClampNegativeSimilarityToZero() {
        index.upsert(chunk("a", 0, "opposite", -1.0f, 0.0f));

        List<RetrievalHit> hits = index.search(new float[] {1.0f, 0.0f}, 1, MODEL);

        assertEquals(0.0, hits.get(0).score());
    }

    @Test
    void shouldIgnoreVectorsOfOtherModels() {
        index.upsert(chunk("a", 0, "printer", 1.0f, 0.0f));

        assertTrue(index.search(new float[] {1.0f, 0.0f}, 5, "other-model").isEmpty());
    }

    @Test
    void shouldReturnNothingForInvalidQuery() {
        index.upsert(chunk("a", 0, "printer", 1.0f, 0.0f));

        assertTrue(index.search(new float[0], 5, MODEL).isEmpty());
        assertTrue(index.search(new float[] {1.0f, 0.0f}, 0, MODEL).isEmpty());
    }

    @Test
    void shouldReplaceDocumentWithoutStaleEntries() {
        index.replaceDocument("a", List.of(chunk("a", 0, "old one", 1.0f, 0.0f), chunk("a", 1, "old two", 1.0f, 0.1f),
                chunk("a", 2, "old three", 1.0f, 0.2f)));

        index.replaceDocument("a", List.of(chunk("a", 0, "new one", 1.0f, 0.0f)));

        assertEquals(1, index.count("a"));
        List<RetrievalHit> hits = index.search(new float[] {1.0f, 0.0f}, 10, MODEL);
        assertEquals(List.of("new one"), hits.stream().map(RetrievalHit::text).toList());
    }

    @Test
    void shouldRemoveDocumentWhenReplacedWithNothing() {
        index.replaceDocument("a", List.of(chunk("a", 0, "text", 1.0f, 0.0f)));

        index.replaceDocument("a", List.of());

        assertEquals(0, index.count("a"));
        assertFalse(index.documentIds().contains("a"));
    }

    @Test
    void shouldRejectChunksOfAnotherDocument() {
        assertThrows(IllegalArgumentException.class,
                () -> index.replaceDocument("a", List.of(chunk("b", 0, "text", 1.0f, 0.0f))));
    }

    @Test
    void shouldDeleteOnlyTheGivenDocument() {
        index.upsert(chunk("a", 0, "text", 1.0f, 0.0f));
        index.upsert(chunk("b", 0, "text", 1.0f, 0.0f));

        index.delete("a");

        assertEquals(0, index.count("a"));
        assertEquals(1, index.count("b"));
    }

    @Test
    void shouldNeverExposeMixedVersionsToConcurrentReaders() throws Exception {
        List<EmbeddedChunk> versionA = new ArrayList<>();
        List<EmbeddedChunk> versionB = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            versionA.add(chunk("doc", i, "A", 1.0f, 0.0f));
            versionB.add(chunk("doc", i, "B", 1.0f, 0.0f));
        }
        index.replaceDocument("doc", versionA);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> writer = pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    index.replaceDocument("doc", i % 2 == 0 ? versionB : versionA);
                }
                return null;
            });
            Future<Boolean> reader = pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    long distinct = index.search(new float[] {1.0f, 0.0f}, 20, MODEL).stream()
                            .map(RetrievalHit::text).distinct().count();
                    if (distinct != 1) {
                        return false;
                    }
                }
                return true;
            });
            start.countDown();
            writer.get(10, TimeUnit.SECONDS);
            assertTrue(reader.get(10, TimeUnit.SECONDS));
        }
        finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRejectStaleVersionedReplace() {
        assertTrue(index.replaceDocument("a", 2, List.of(chunk("a", 0, "newer", 1.0f, 0.0f))));

        assertFalse(index.replaceDocument("a", 1, List.of(chunk("a", 0, "older", 1.0f, 0.0f))));
        assertFalse(index.replaceDocument("a", 2, List.of(chunk("a", 0, "same", 1.0f, 0.0f))));

        assertEquals(2, index.activeVersion("a"));
        assertEquals(List.of("newer"), index.search(new float[] {1.0f, 0.0f}, 5, MODEL).stream().map(RetrievalHit::text).toList());
    }

    @Test
    void shouldAdvanceVersionOnUnversionedReplace() {
        assertEquals(0, index.activeVersion("a"));

        index.replaceDocument("a", List.of(chunk("a", 0, "one", 1.0f, 0.0f)));
        index.replaceDocument("a", List.of(chunk("a", 0, "two", 1.0f, 0.0f)));

        assertEquals(2, index.activeVersion("a"));
        index.delete("a");
        assertEquals(0, index.activeVersion("a"));
    }
}
