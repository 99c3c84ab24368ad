package com.deskpilot.vector;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.deskpilot.model.Chunk;
import com.deskpilot.model.EmbeddedChunk;
import com.deskpilot.model.RetrievalHit;
import com.deskpilot.vector.MongoVectorIndex.ChunkRecord;
import com.deskpilot.vector.MongoVectorIndex.DocumentRecord;
import com.mongodb.client.result.DeleteResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

class MongoVectorIndexTest {
    private static final String MODEL = "nomic-embed-text";

    private MongoTemplate mongoTemplate;
    private MongoVectorIndex index;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        when(mongoTemplate.remove(any(Query.class), any(String.class))).thenReturn(DeleteResult.acknowledged(0));
        index = new MongoVectorIndex(mongoTemplate);
    }

    private static EmbeddedChunk chunk(String documentId, int ordinal, float... vector) {
        return new EmbeddedChunk(new Chunk(documentId, "document", ordinal, "text " + ordinal, 0, 6, Map.of("filename", "f.txt")),
                vector, MODEL);
    }

    private static DocumentRecord document(String id, int version) {
        DocumentRecord record = new DocumentRecord();
        record.setId(id);
        record.setActiveVersion(version);
        return record;
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldWriteNewVersionBeforeFlippingActiveVersion() {
        when(mongoTemplate.findById("doc", DocumentRecord.class, MongoVectorIndex.DOCUMENT_COLLECTION)).thenReturn(document("doc", 3));

        index.replaceDocument("doc", List.of(chunk("doc", 0, 1.0f), chunk("doc", 1, 0.5f)));

        InOrder order = inOrder(mongoTemplate);
        ArgumentCaptor<List<ChunkRecord>> inserted = ArgumentCaptor.forClass(List.class);
        order.verify(mongoTemplate).insert(inserted.capture(), eq(MongoVectorIndex.CHUNK_COLLECTION));
        ArgumentCaptor<DocumentRecord> flipped = ArgumentCaptor.forClass(DocumentRecord.class);
        order.verify(mongoTemplate).save(flipped.capture(), eq(MongoVectorIndex.DOCUMENT_COLLECTION));
        order.verify(mongoTemplate).remove(any(Query.class), eq(MongoVectorIndex.CHUNK_COLLECTION));

        assertEquals(2, inserted.getValue().size());
        assertTrue(inserted.getValue().stream().allMatch(r -> r.getVersion() == 4));
        assertEquals("doc::document::0@v4", inserted.getValue().get(0).getId());
        assertEquals(4, flipped.getValue().getActiveVersion());
    }

    @Test
    void shouldKeepPreviousVersionActiveWhenWriteFails() {
        when(mongoTemplate.findById("doc", DocumentRecord.class, MongoVectorIndex.DOCUMENT_COLLECTION)).thenReturn(document("doc", 1));
        when(mongoTemplate.insert(anyCollection(), eq(MongoVectorIndex.CHUNK_COLLECTION)))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThrows(IndexUnavailableException.class, () -> index.replaceDocument("doc", List.of(chunk("doc", 0, 1.0f))));

        verify(mongoTemplate, never()).save(any(DocumentRecord.class), eq(MongoVectorIndex.DOCUMENT_COLLECTION));
    }

    @Test
    void shouldSearchOnlyActiveVersionOfMatchingModel() {
        when(mongoTemplate.findAll(DocumentRecord.class, MongoVectorIndex.DOCUMENT_COLLECTION)).thenReturn(List.of(document("doc", 2)));
        ChunkRecord stale = ChunkRecord.of(chunk("doc", 0, 1.0f, 0.0f), 1);
        ChunkRecord active = ChunkRecord.of(chunk("doc", 1, 0.0f, 1.0f), 2);
        when(mongoTemplate.find(any(Query.class), eq(ChunkRecord.class), eq(MongoVectorIndex.CHUNK_COLLECTION)))
                .thenReturn(List.of(stale, active));

        List<RetrievalHit> hits = index.search(new float[] {1.0f, 0.0f}, 5, MODEL);

        assertEquals(1, hits.size());
        assertEquals("text 1", hits.get(0).text());
        assertEquals(0.0, hits.get(0).score());
    }

    @Test
    void shouldReportStoreFailureAsIndexUnavailable() {
        when(mongoTemplate.findAll(DocumentRecord.class, MongoVectorIndex.DOCUMENT_COLLECTION))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThrows(IndexUnavailableException.class, () -> index.search(new float[] {1.0f}, 5, MODEL));
    }

    @Test
    void shouldCountOnlyActiveVersion() {
        when(mongoTemplate.findById("doc", DocumentRecord.class, MongoVectorIndex.DOCUMENT_COLLECTION)).thenReturn(document("doc", 2));
        when(mongoTemplate.count(any(Query.class), eq(MongoVectorIndex.CHUNK_COLLECTION))).thenReturn(7L);

        assertEquals(7, index.count("doc"));
        assertEquals(0, index.count("missing"));
    }

    @Test
    void shouldSkipVersionedWriteThatIsNotNewer() {
        when(mongoTemplate.findById("doc", DocumentRecord.class, MongoVectorIndex.DOCUMENT_COLLECTION)).thenReturn(document("doc", 5));

        assertFalse(index.replaceDocument("doc", 5, List.of(chunk("doc", 0, 1.0f))));

        verify(mongoTemplate, never()).insert(anyCollection(), eq(MongoVectorIndex.CHUNK_COLLECTION));
        verify(mongoTemplate, never()).save(any(DocumentRecord.class), eq(MongoVectorIndex.DOCUMENT_COLLECTION));
    }

    @Test
    void shouldWriteRequestedVersion() {
        when(mongoTemplate.findById("doc", DocumentRecord.class, MongoVectorIndex.DOCUMENT_COLLECTION)).thenReturn(document("doc", 2));

        assertTrue(index.replaceDocument("doc", 7, List.of(chunk("doc", 0, 1.0f))));

        ArgumentCaptor<DocumentRecord> flipped = ArgumentCaptor.forClass(DocumentRecord.class);
        verify(mongoTemplate).save(flipped.capture(), eq(MongoVectorIndex.DOCUMENT_COLLECTION));
        assertEquals(7, flipped.getValue().getActiveVersion());
    }

    @Test
    void shouldServeFlippedVersionWhenReplaceCompletesDuringSearch() {
        // active version read as 2, but version 2 was removed before the chunks were read
        when(mongoTemplate.findAll(DocumentRecord.class, MongoVectorIndex.DOCUMENT_COLLECTION)).thenReturn(List.of(document("doc", 2)));
        ChunkRecord flipped = ChunkRecord.of(chunk("doc", 0, 1.0f, 0.0f), 3);
        ChunkRecord unannounced = ChunkRecord.of(chunk("other", 0, 1.0f, 0.0f), 1);
        when(mongoTemplate.find(any(Query.class), eq(ChunkRecord.class), eq(MongoVectorIndex.CHUNK_COLLECTION)))
                .thenReturn(List.of(flipped, unannounced));

        List<RetrievalHit> hits = index.search(new float[] {1.0f, 0.0f}, 5, MODEL);

        assertEquals(List.of("doc"), hits.stream().map(RetrievalHit::provenanceId).toList());
    }

    @Test
    void shouldPreferLowestNewerVersionOverPartialWrite() {
        List<ChunkRecord> candidates = List.of(
                ChunkRecord.of(chunk("doc", 0, 1.0f), 3),
                ChunkRecord.of(chunk("doc", 0, 1.0f), 4));

        assertEquals(Map.of("doc", 3), MongoVectorIndex.visibleVersions(Map.of("doc", 2), candidates));
        assertEquals(Map.of("doc", 4), MongoVectorIndex.visibleVersions(Map.of("doc", 4), candidates));
        assertEquals(Map.of(), MongoVectorIndex.visibleVersions(Map.of("doc", 5), candidates));
    }
}
