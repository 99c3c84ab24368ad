package com.deskpilot.rag.hybrid;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.deskpilot.embedding.EmbeddingClient;
import com.deskpilot.embedding.EmbeddingException;
import com.deskpilot.model.HitSource;
import com.deskpilot.model.QueryOptions;
import com.deskpilot.model.RecordKind;
import com.deskpilot.model.RetrievalHit;
import com.deskpilot.model.StructuredRecord;
import com.deskpilot.rag.hybrid.RetrievalResult.SourceStatus;
import com.deskpilot.rag.structured.KeywordRelevanceScorer;
import com.deskpilot.rag.structured.StructuredSearchAdapter;
import com.deskpilot.vector.IndexUnavailableException;
import com.deskpilot.vector.VectorIndex;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

class HybridRetrievalServiceTest {

    private EmbeddingClient embeddingClient;
    private VectorIndex vectorIndex;
    private StructuredSearchAdapter structuredSearch;
    private ExecutorService executor;
    private HybridRetrievalService service;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        vectorIndex = mock(VectorIndex.class);
        structuredSearch = mock(StructuredSearchAdapter.class);
        executor = Executors.newFixedThreadPool(4);
        service = new HybridRetrievalService(embeddingClient, vectorIndex, structuredSearch, new KeywordRelevanceScorer(), executor);
        when(embeddingClient.modelId()).thenReturn("test-model");
        when(embeddingClient.embedQuery(anyString())).thenReturn(new float[] {1.0f});
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static RetrievalHit vectorHit(String text, double score) {
        return new RetrievalHit(HitSource.VECTOR, score, text, "doc-1", "guide.pdf", null, "page:1", RecordKind.DOCUMENT,
                null, 0, text.length(), 1.0, null);
    }

    private static StructuredRecord ticket(String id, String title, String text) {
        return new StructuredRecord(id, title, text, RecordKind.TICKET, null, "Hardware", null);
    }

    @Test
    void shouldCombineBothSources() {
        when(vectorIndex.search(any(float[].class), eq(5), eq("test-model"))).thenReturn(List.of(vectorHit("Restart the spooler", 0.8)));
        when(structuredSearch.searchRelevant(anyString(), anyInt(), any())).thenReturn(List.of(
                ticket("T-1", "Paper jam", "printer tray"),
                ticket("T-2", "Printer offline", "")));

        RetrievalResult result = service.retrieve("printer offline");

        assertEquals(1, result.vectorHits().size());
        assertEquals(List.of("T-2", "T-1"), result.structuredHits().stream().map(RetrievalHit::provenanceId).toList());
        assertEquals(1.0, result.structuredHits().get(0).score(), 1e-9);
        assertEquals(0.35, result.structuredHits().get(1).score(), 1e-9);
        assertFalse(result.isPartial());
    }

    @Test
    void shouldReturnPartialResultWhenOneSourceTimesOut() {
        ReflectionTestUtils.setField(service, "timeoutMillis", 200L);
        when(vectorIndex.search(any(float[].class), anyInt(), anyString())).thenReturn(List.of(vectorHit("Restart the spooler", 0.8)));
        when(structuredSearch.searchRelevant(anyString(), anyInt(), any())).thenAnswer(invocation -> {
            Thread.sleep(3_000);
            return List.of(ticket("T-1", "Printer", ""));
        });

        long start = System.currentTimeMillis();
        RetrievalResult result = service.retrieve("printer offline");

        assertTrue(System.currentTimeMillis() - start < 2_000);
        assertEquals(SourceStatus.OK, result.vectorStatus());
        assertEquals(SourceStatus.TIMED_OUT, result.structuredStatus());
        assertEquals(1, result.vectorHits().size());
        assertTrue(result.structuredHits().isEmpty());
        assertTrue(result.isPartial());
    }

    @Test
    void shouldReturnPartialResultWhenOneSourceFails() {
        when(embeddingClient.embedQuery(anyString())).thenThrow(new EmbeddingException("model down", true));
        when(structuredSearch.searchRelevant(anyString(), anyInt(), any())).thenReturn(List.of(ticket("T-1", "Printer offline", "")));

        RetrievalResult result = service.retrieve("printer offline");

        assertEquals(SourceStatus.FAILED, result.vectorStatus());
        assertEquals(1, result.structuredHits().size());
    }

    @Test
    void shouldFailWhenBothSourcesFail() {
        when(embeddingClient.embedQuery(anyString())).thenThrow(new EmbeddingException("model down", true));
        when(structuredSearch.searchRelevant(anyString(), anyInt(), any())).thenThrow(new DataAccessResourceFailureException("mongo down"));

        IndexUnavailableException ex = assertThrows(IndexUnavailableException.class, () -> service.retrieve("printer offline"));

        assertInstanceOf(EmbeddingException.class, ex.getCause());
        assertEquals(1, ex.getSuppressed().length);
    }

    @Test
    void shouldReturnEmptyResultForBlankQuestion() {
        RetrievalResult result = service.retrieve("   ");

        assertEquals(0, result.totalHits());
        verifyNoInteractions(vectorIndex, structuredSearch);
    }

    @Test
    void shouldSkipStructuredSearchWhenTicketsAndArticlesExcluded() {
        when(vectorIndex.search(any(float[].class), anyInt(), anyString())).thenReturn(List.of(vectorHit("Restart the spooler", 0.8)));

        RetrievalResult result = service.retrieve("printer offline", new QueryOptions(false, false, null));

        assertEquals(SourceStatus.SKIPPED, result.structuredStatus());
        assertEquals(1, result.vectorHits().size());
        assertFalse(result.isPartial());
        verify(structuredSearch, never()).searchRelevant(anyString(), anyInt(), any());
    }

    @Test
    void shouldFailWhenTheOnlyRequestedSourceFails() {
        when(embeddingClient.embedQuery(anyString())).thenThrow(new EmbeddingException("model down", true));

        assertThrows(IndexUnavailableException.class,
                () -> service.retrieve("printer offline", new QueryOptions(false, false, null)));
    }

    @Test
    void shouldKeepOnlyRecordsOfTheRequestedCategory() {
        QueryOptions networkOnly = new QueryOptions(true, true, "network");
        when(structuredSearch.searchRelevant(anyString(), anyInt(), eq(networkOnly))).thenReturn(List.of(
                ticket("T-1", "Printer offline", ""),
                new StructuredRecord("KB-7", "VPN offline", "Reconnect the client", RecordKind.KB_ARTICLE, null, "Network", null)));

        RetrievalResult result = service.retrieve("vpn offline", networkOnly);

        assertEquals(List.of("KB-7"), result.structuredHits().stream().map(RetrievalHit::provenanceId).toList());
    }

    @Test
    void shouldInterruptEmbeddingCallWhenQueryThreadIsInterrupted() throws Exception {
        CountDownLatch modelStarted = new CountDownLatch(1);
        CountDownLatch modelInterrupted = new CountDownLatch(1);
        AtomicBoolean modelCompleted = new AtomicBoolean();
        EmbeddingModel slowModel = mock(EmbeddingModel.class);
        when(slowModel.embed(anyString())).thenAnswer(invocation -> {
            modelStarted.countDown();
            try {
                Thread.sleep(3_000);
            }
            catch (InterruptedException e) {
                modelInterrupted.countDown();
                throw e;
            }
            modelCompleted.set(true);
            return new float[] {1.0f};
        });
        ExecutorService modelExecutor = Executors.newFixedThreadPool(2);
        try {
            EmbeddingClient realClient = new EmbeddingClient(slowModel, modelExecutor, Caffeine.newBuilder().build());
            realClient.init();
            HybridRetrievalService cancellable = new HybridRetrievalService(realClient, vectorIndex, structuredSearch,
                    new KeywordRelevanceScorer(), executor);
            AtomicReference<RetrievalResult> result = new AtomicReference<>();
            Thread query = new Thread(() -> result.set(cancellable.retrieve("printer offline")));
            query.start();

            assertTrue(modelStarted.await(2, TimeUnit.SECONDS));
            query.interrupt();
            query.join(2_000);

            assertTrue(modelInterrupted.await(2, TimeUnit.SECONDS));
            assertFalse(modelCompleted.get());
            assertEquals(SourceStatus.CANCELLED, result.get().vectorStatus());
        }
        finally {
            modelExecutor.shutdownNow();
        }
    }
}
