package com.deskpilot.vector;

import com.deskpilot.model.Chunk;
import com.deskpilot.model.EmbeddedChunk;
import com.deskpilot.model.HitSource;
import com.deskpilot.model.RecordKind;
import com.deskpilot.model.RetrievalHit;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes mutations per document id, rejects stale versioned writes and maps stored
 * chunks to hits. Subclasses only implement the storage operations, which are always
 * invoked while the document's lock is held.
 */
public abstract class AbstractVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(AbstractVectorIndex.class);

    // weak values: an idle lock is collected, a held one is strongly reachable from its holder
    private final LoadingCache<String, ReentrantLock> documentLocks = Caffeine.newBuilder()
            .weakValues()
            .build(id -> new ReentrantLock());

    @Override
    public final void upsert(EmbeddedChunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        this.withDocumentLock(chunk.documentId(), () -> {
            this.doUpsert(chunk);
            return null;
        });
    }

    @Override
    public final void replaceDocument(String documentId, List<EmbeddedChunk> chunks) {
        List<EmbeddedChunk> replacement = checkedReplacement(documentId, chunks);
        this.withDocumentLock(documentId, () -> {
            this.doReplace(documentId, this.activeVersion(documentId) + 1, replacement);
            return null;
        });
    }

    @Override
    public final boolean replaceDocument(String documentId, int version, List<EmbeddedChunk> chunks) {
        List<EmbeddedChunk> replacement = checkedReplacement(documentId, chunks);
        return this.withDocumentLock(documentId, () -> {
            int active = this.activeVersion(documentId);
            if (version <= active) {
                log.warn("Skipping stale write of {} version {}; version {} is already active", documentId, version, active);
                return false;
            }
            this.doReplace(documentId, version, replacement);
            return true;
        });
    }

    @Override
    public final void delete(String documentId) {
        requireId(documentId);
        this.withDocumentLock(documentId, () -> {
            this.doDelete(documentId);
            return null;
        });
    }

    @Override
    public final List<RetrievalHit> search(float[] queryVector, int k, String modelId) {
        if (queryVector == null || queryVector.length == 0 || k <= 0 || modelId == null) {
            return List.of();
        }
        return this.doSearch(queryVector, k, modelId);
    }

    protected abstract void doUpsert(EmbeddedChunk chunk);

    protected abstract void doReplace(String documentId, int version, List<EmbeddedChunk> chunks);

    protected abstract void doDelete(String documentId);

    protected abstract List<RetrievalHit> doSearch(float[] queryVector, int k, String modelId);

    protected <T> T withDocumentLock(String documentId, Supplier<T> action) {
        ReentrantLock lock = this.documentLocks.get(documentId);
        lock.lock();
        try {
            return action.get();
        }
        finally {
            lock.unlock();
        }
    }

    protected static RetrievalHit toHit(Chunk chunk, double score) {
        Map<String, Object> metadata = chunk.metadata();
        Object filename = metadata.get("filename");
        return new RetrievalHit(HitSource.VECTOR, score, chunk.text(), chunk.documentId(),
                filename != null ? filename.toString() : chunk.documentId(), null, chunk.label(),
                RecordKind.DOCUMENT, null, chunk.startOffset(), chunk.endOffset(),
                asDouble(metadata.get("extraction_confidence"), 1.0), asInstant(metadata.get("ingested_at")));
    }

    private static double asDouble(Object value, double fallback) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            }
            catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static Instant asInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof java.util.Date date) {
            return date.toInstant();
        }
        if (value != null) {
            try {
                return Instant.parse(value.toString());
            }
            catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static List<EmbeddedChunk> checkedReplacement(String documentId, List<EmbeddedChunk> chunks) {
        requireId(documentId);
        List<EmbeddedChunk> replacement = chunks == null ? List.of() : List.copyOf(chunks);
        for (EmbeddedChunk chunk : replacement) {
            if (!documentId.equals(chunk.documentId())) {
                throw new IllegalArgumentException("Chunk " + chunk.key() + " does not belong to document " + documentId);
            }
        }
        return replacement;
    }

    private static void requireId(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId is required");
        }
    }
}
