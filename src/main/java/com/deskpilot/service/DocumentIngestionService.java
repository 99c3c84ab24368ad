package com.deskpilot.service;

import com.deskpilot.embedding.EmbeddingClient;
import com.deskpilot.embedding.EmbeddingException;
import com.deskpilot.ingest.TextChunker;
import com.deskpilot.ingest.extract.ExtractionException;
import com.deskpilot.ingest.extract.ExtractorRegistry;
import com.deskpilot.ingest.extract.FormatFamily;
import com.deskpilot.ingest.extract.UnsupportedFormatException;
import com.deskpilot.model.Chunk;
import com.deskpilot.model.EmbeddedChunk;
import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.IngestionOutcome;
import com.deskpilot.model.IngestionRequest;
import com.deskpilot.model.IngestionResult;
import com.deskpilot.model.SourceDocument;
import com.deskpilot.util.LogSanitizer;
import com.deskpilot.vector.IndexUnavailableException;
import com.deskpilot.vector.VectorIndex;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.time.Instant;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Ingestion entry point: format resolution, extraction, chunking, embedding and indexing
 * of one document. Re-ingesting an id replaces everything indexed for it before.
 *
 * <p>Ingestions of the same id run one at a time, from version assignment to the index
 * write, so versions reach the index in the order they were assigned. The index owns the
 * active version; the next ingestion gets the active version plus one.</p>
 */
@Service
public class DocumentIngestionService {
    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);
    private final ExtractorRegistry extractorRegistry;
    private final TextChunker chunker;
    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final ExecutorService ingestExecutor;
    // weak values: an idle lock is collected, a held one is strongly reachable from its holder
    private final LoadingCache<String, ReentrantLock> documentLocks = Caffeine.newBuilder()
            .weakValues()
            .build(id -> new ReentrantLock());

    @Value("${deskpilot.ingest.max-bytes:52428800}")
    private long maxBytes = 52_428_800L;

    public DocumentIngestionService(ExtractorRegistry extractorRegistry, TextChunker chunker, EmbeddingClient embeddingClient,
                                    VectorIndex vectorIndex, @Qualifier("ingestExecutor") ExecutorService ingestExecutor) {
        this.extractorRegistry = extractorRegistry;
        this.chunker = chunker;
        this.embeddingClient = embeddingClient;
        this.vectorIndex = vectorIndex;
        this.ingestExecutor = ingestExecutor;
    }

    public IngestionResult ingestDocument(String filename, byte[] payload, String declaredFormat) {
        return this.ingestDocument(filename, payload, declaredFormat, null);
    }

    /**
     * @param documentId id to (re)ingest under; a new id is assigned when null or blank
     * @throws DocumentIngestionException wrapping the format, extraction, embedding or index failure
     */
    public IngestionResult ingestDocument(String filename, byte[] payload, String declaredFormat, String documentId) {
        String id = documentId == null || documentId.isBlank() ? UUID.randomUUID().toString() : documentId.trim();
        String safeFilename = LogSanitizer.sanitize(filename);
        long start = System.currentTimeMillis();
        try {
            validatePayload(payload);
            String format = this.extractorRegistry.resolveFormat(declaredFormat, filename, payload);
            // unsupported formats fail here, before the document lock is taken
            this.extractorRegistry.extractorFor(format);
            ReentrantLock lock = this.documentLocks.get(id);
            lock.lock();
            try {
                return this.ingestLocked(id, filename, payload, format, start);
            }
            finally {
                lock.unlock();
            }
        }
        catch (UnsupportedFormatException | ExtractionException | EmbeddingException | IndexUnavailableException
               | IllegalArgumentException | ConcurrentModificationException e) {
            log.warn("Ingestion of {} ({}) failed: {}", safeFilename, id, e.getMessage());
            throw new DocumentIngestionException(id, filename, "Ingestion failed for " + safeFilename + ": " + e.getMessage(), e);
        }
    }

    private IngestionResult ingestLocked(String id, String filename, byte[] payload, String format, long start) {
        String safeFilename = LogSanitizer.sanitize(filename);
        int version = this.vectorIndex.activeVersion(id) + 1;
        SourceDocument document = new SourceDocument(id, filename, format, payload, Instant.now(), version);
        log.info("Ingesting {} as {} (format={}, {} bytes, version {})", safeFilename, id, format, document.sizeBytes(), version);

        List<ExtractedUnit> units = this.extractorRegistry.extract(document);
        Map<String, Object> documentMetadata = documentMetadata(document);
        ArrayList<EmbeddedChunk> embedded = new ArrayList<>();
        for (ExtractedUnit unit : units) {
            for (Chunk chunk : this.chunker.chunk(unit, documentMetadata)) {
                embedded.add(new EmbeddedChunk(chunk, this.embeddingClient.embed(chunk.text()), this.embeddingClient.modelId()));
            }
        }
        if (!this.vectorIndex.replaceDocument(id, version, embedded)) {
            throw new ConcurrentModificationException("Version " + version + " of " + id + " was superseded by another writer");
        }
        log.info("Ingested {}: {} units, {} chunks in {}ms", safeFilename, units.size(), embedded.size(), System.currentTimeMillis() - start);
        if (embedded.isEmpty()) {
            log.warn("No indexable text extracted from {} ({})", safeFilename, format);
        }
        return new IngestionResult(id, document.filename(), format, version, units.size(), embedded.size());
    }

    /**
     * Ingests several documents concurrently; a failing document does not affect the others.
     */
    public CompletableFuture<List<IngestionOutcome>> ingestDocumentsAsync(List<IngestionRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<CompletableFuture<IngestionOutcome>> futures = new ArrayList<>(requests.size());
        for (IngestionRequest request : requests) {
            CompletableFuture<IngestionOutcome> future;
            try {
                future = CompletableFuture.supplyAsync(() -> this.ingestQuietly(request), this.ingestExecutor);
            }
            catch (RejectedExecutionException e) {
                log.warn("Ingest pool overloaded; rejecting {}", LogSanitizer.sanitize(request.filename()));
                future = CompletableFuture.completedFuture(IngestionOutcome.failure(request.filename(), request.documentId(), e.getMessage()));
            }
            futures.add(future);
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    public void deleteDocument(String documentId) {
        this.vectorIndex.delete(documentId);
        log.info("Deleted document {}", LogSanitizer.sanitize(documentId));
    }

    public Map<FormatFamily, List<String>> supportedFormats() {
        return this.extractorRegistry.supportedFormats();
    }

    private IngestionOutcome ingestQuietly(IngestionRequest request) {
        try {
            return IngestionOutcome.success(this.ingestDocument(request.filename(), request.payload(), request.declaredFormat(), request.documentId()));
        }
        catch (DocumentIngestionException e) {
            return IngestionOutcome.failure(request.filename(), e.getDocumentId(), e.getMessage());
        }
    }

    private void validatePayload(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("Empty file payload provided for ingestion");
        }
        if (payload.length > this.maxBytes) {
            throw new IllegalArgumentException("File of " + payload.length + " bytes exceeds the limit of " + this.maxBytes);
        }
    }

    private static Map<String, Object> documentMetadata(SourceDocument document) {
        HashMap<String, Object> metadata = new HashMap<>();
        metadata.put("filename", document.filename());
        metadata.put("format", document.format());
        metadata.put("version", document.version());
        metadata.put("ingested_at", document.ingestedAt().toString());
        return metadata;
    }
}
