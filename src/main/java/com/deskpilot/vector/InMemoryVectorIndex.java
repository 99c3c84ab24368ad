package com.deskpilot.vector;

import com.deskpilot.model.EmbeddedChunk;
import com.deskpilot.model.RetrievalHit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap-backed index for local runs and tests. Each document's entries live in an immutable
 * versioned entry that is swapped whole, which makes replacement atomic for readers.
 */
public class InMemoryVectorIndex extends AbstractVectorIndex {
    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);
    private final Map<String, DocumentEntry> documents = new ConcurrentHashMap<>();

    public InMemoryVectorIndex() {
        log.info("Initialized InMemoryVectorIndex (entries are lost on restart)");
    }

    @Override
    protected void doUpsert(EmbeddedChunk chunk) {
        DocumentEntry current = this.documents.get(chunk.documentId());
        LinkedHashMap<String, StoredVector> updated = new LinkedHashMap<>(current != null ? current.vectors() : Map.of());
        updated.put(chunk.key(), new StoredVector(chunk, VectorMath.squaredNorm(chunk.vector())));
        this.documents.put(chunk.documentId(), new DocumentEntry(current != null ? current.version() : 1, Map.copyOf(updated)));
    }

    @Override
    protected void doReplace(String documentId, int version, List<EmbeddedChunk> chunks) {
        if (chunks.isEmpty()) {
            this.documents.remove(documentId);
            return;
        }
        LinkedHashMap<String, StoredVector> replacement = new LinkedHashMap<>();
        for (EmbeddedChunk chunk : chunks) {
            replacement.put(chunk.key(), new StoredVector(chunk, VectorMath.squaredNorm(chunk.vector())));
        }
        this.documents.put(documentId, new DocumentEntry(version, Map.copyOf(replacement)));
        log.debug("Replaced document {} with {} entries (version {})", documentId, replacement.size(), version);
    }

    @Override
    protected void doDelete(String documentId) {
        this.documents.remove(documentId);
    }

    @Override
    protected List<RetrievalHit> doSearch(float[] queryVector, int k, String modelId) {
        double queryNorm = VectorMath.squaredNorm(queryVector);
        return this.documents.values().stream()
                .flatMap(entry -> entry.vectors().values().stream())
                .filter(stored -> modelId.equals(stored.chunk().modelId()))
                .map(stored -> new Scored(stored, VectorMath.cosine(queryVector, queryNorm, stored.chunk().vector(), stored.squaredNorm())))
                .sorted(Comparator.comparingDouble(Scored::similarity).reversed())
                .limit(k)
                .map(scored -> toHit(scored.stored().chunk().chunk(), VectorMath.toScore(scored.similarity())))
                .collect(Collectors.toList());
    }

    @Override
    public int count(String documentId) {
        DocumentEntry entry = this.documents.get(documentId);
        return entry != null ? entry.vectors().size() : 0;
    }

    @Override
    public int activeVersion(String documentId) {
        DocumentEntry entry = this.documents.get(documentId);
        return entry != null ? entry.version() : 0;
    }

    @Override
    public Set<String> documentIds() {
        return Set.copyOf(this.documents.keySet());
    }

    public void clear() {
        this.documents.clear();
    }

    private record DocumentEntry(int version, Map<String, StoredVector> vectors) {
    }

    private record StoredVector(EmbeddedChunk chunk, double squaredNorm) {
    }

    private record Scored(StoredVector stored, double similarity) {
    }
}
