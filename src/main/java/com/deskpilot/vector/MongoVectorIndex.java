package com.deskpilot.vector;

import com.deskpilot.model.Chunk;
import com.deskpilot.model.EmbeddedChunk;
import com.deskpilot.model.RetrievalHit;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.annotation.Id;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

/**
 * MongoDB-backed index. Vectors are scanned and scored in process (no Atlas vector search),
 * with squared norms persisted next to each vector.
 *
 * <p>Every chunk carries the document version it was written for, and
 * {@code knowledge_documents} records the active version per document. Replacement writes
 * the new version's chunks, flips the active version with one single-document write and
 * only then removes older versions, so searches never observe a half-written document.</p>
 */
public class MongoVectorIndex extends AbstractVectorIndex {
    private static final Logger log = LoggerFactory.getLogger(MongoVectorIndex.class);
    static final String CHUNK_COLLECTION = "knowledge_chunks";
    static final String DOCUMENT_COLLECTION = "knowledge_documents";
    private final MongoTemplate mongoTemplate;

    public MongoVectorIndex(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
        log.info("Initialized MongoVectorIndex (collections: {}, {})", CHUNK_COLLECTION, DOCUMENT_COLLECTION);
    }

    public void ensureIndexes() {
        try {
            this.mongoTemplate.indexOps(CHUNK_COLLECTION).ensureIndex(new Index()
                    .on("documentId", Sort.Direction.ASC).on("version", Sort.Direction.ASC));
            this.mongoTemplate.indexOps(CHUNK_COLLECTION).ensureIndex(new Index().on("modelId", Sort.Direction.ASC));
        }
        catch (DataAccessException e) {
            log.warn("Could not create indexes on {}: {}", CHUNK_COLLECTION, e.getMessage());
        }
    }

    @Override
    protected void doUpsert(EmbeddedChunk chunk) {
        try {
            DocumentRecord document = this.mongoTemplate.findById(chunk.documentId(), DocumentRecord.class, DOCUMENT_COLLECTION);
            int version = document != null ? document.getActiveVersion() : 1;
            this.mongoTemplate.save(ChunkRecord.of(chunk, version), CHUNK_COLLECTION);
            if (document == null) {
                this.mongoTemplate.save(DocumentRecord.of(chunk.documentId(), version), DOCUMENT_COLLECTION);
            }
        }
        catch (DataAccessException e) {
            throw new IndexUnavailableException("Failed to upsert chunk " + chunk.key() + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected void doReplace(String documentId, int version, List<EmbeddedChunk> chunks) {
        if (chunks.isEmpty()) {
            this.doDelete(documentId);
            return;
        }
        try {
            // leftovers of an earlier crashed attempt at the same version
            this.mongoTemplate.remove(versionQuery(documentId, version), CHUNK_COLLECTION);
            ArrayList<ChunkRecord> records = new ArrayList<>(chunks.size());
            for (EmbeddedChunk chunk : chunks) {
                records.add(ChunkRecord.of(chunk, version));
            }
            this.mongoTemplate.insert(records, CHUNK_COLLECTION);
            this.mongoTemplate.save(DocumentRecord.of(documentId, version), DOCUMENT_COLLECTION);
        }
        catch (DataAccessException e) {
            this.discardVersion(documentId, version, e);
            throw new IndexUnavailableException("Failed to replace document " + documentId + ": " + e.getMessage(), e);
        }
        try {
            this.mongoTemplate.remove(new Query(Criteria.where("documentId").is(documentId).and("version").ne(version)), CHUNK_COLLECTION);
        }
        catch (DataAccessException e) {
            // superseded chunks are invisible to readers; the next replace or delete removes them
            log.warn("Could not remove superseded chunks of {}: {}", documentId, e.getMessage());
        }
        log.info("Indexed {} chunks for document {} (version {})", chunks.size(), documentId, version);
    }

    @Override
    public int activeVersion(String documentId) {
        try {
            DocumentRecord document = this.mongoTemplate.findById(documentId, DocumentRecord.class, DOCUMENT_COLLECTION);
            return document != null ? document.getActiveVersion() : 0;
        }
        catch (DataAccessException e) {
            throw new IndexUnavailableException("Failed to read active version of " + documentId + ": " + e.getMessage(), e);
        }
    }

    private void discardVersion(String documentId, int version, DataAccessException failure) {
        try {
            this.mongoTemplate.remove(versionQuery(documentId, version), CHUNK_COLLECTION);
        }
        catch (DataAccessException cleanupError) {
            failure.addSuppressed(cleanupError);
            log.error("Could not discard partially written version {} of {}", version, documentId, cleanupError);
        }
    }

    @Override
    protected void doDelete(String documentId) {
        try {
            this.mongoTemplate.remove(new Query(Criteria.where("_id").is(documentId)), DOCUMENT_COLLECTION);
            long removed = this.mongoTemplate.remove(new Query(Criteria.where("documentId").is(documentId)), CHUNK_COLLECTION).getDeletedCount();
            log.info("Deleted {} chunks of document {}", removed, documentId);
        }
        catch (DataAccessException e) {
            throw new IndexUnavailableException("Failed to delete document " + documentId + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected List<RetrievalHit> doSearch(float[] queryVector, int k, String modelId) {
        List<ChunkRecord> candidates;
        Map<String, Integer> activeVersions;
        try {
            activeVersions = this.activeVersions();
            candidates = this.mongoTemplate.find(new Query(Criteria.where("modelId").is(modelId)), ChunkRecord.class, CHUNK_COLLECTION);
        }
        catch (DataAccessException e) {
            throw new IndexUnavailableException("Vector search failed: " + e.getMessage(), e);
        }
        Map<String, Integer> visible = visibleVersions(activeVersions, candidates);
        double queryNorm = VectorMath.squaredNorm(queryVector);
        log.debug("Scoring {} candidate chunks for model {}", candidates.size(), modelId);
        return candidates.stream()
                .filter(record -> record.getVersion() == visible.getOrDefault(record.getDocumentId(), -1))
                .map(record -> new Scored(record, VectorMath.cosine(queryVector, queryNorm, record.getEmbedding(), record.getEmbeddingNorm())))
                .sorted(Comparator.comparingDouble(Scored::similarity).reversed())
                .limit(k)
                .map(scored -> toHit(scored.record().toChunk(), VectorMath.toScore(scored.similarity())))
                .collect(Collectors.toList());
    }

    /**
     * The version to serve per document. A replace that completes between reading the
     * active versions and reading the chunks removes the version read as active; the
     * lowest newer version found is then the one it flipped to, which is fully written.
     * Documents with no active version yet stay hidden.
     */
    static Map<String, Integer> visibleVersions(Map<String, Integer> activeVersions, List<ChunkRecord> candidates) {
        Map<String, TreeSet<Integer>> found = new HashMap<>();
        for (ChunkRecord record : candidates) {
            found.computeIfAbsent(record.getDocumentId(), id -> new TreeSet<>()).add(record.getVersion());
        }
        HashMap<String, Integer> visible = new HashMap<>();
        activeVersions.forEach((documentId, active) -> {
            TreeSet<Integer> versions = found.get(documentId);
            if (versions == null) {
                return;
            }
            Integer chosen = versions.contains(active) ? active : versions.higher(active);
            if (chosen != null) {
                visible.put(documentId, chosen);
            }
        });
        return visible;
    }

    @Override
    public int count(String documentId) {
        try {
            DocumentRecord document = this.mongoTemplate.findById(documentId, DocumentRecord.class, DOCUMENT_COLLECTION);
            if (document == null) {
                return 0;
            }
            return (int) this.mongoTemplate.count(versionQuery(documentId, document.getActiveVersion()), CHUNK_COLLECTION);
        }
        catch (DataAccessException e) {
            throw new IndexUnavailableException("Failed to count chunks of " + documentId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> documentIds() {
        try {
            return this.mongoTemplate.findAll(DocumentRecord.class, DOCUMENT_COLLECTION).stream()
                    .map(DocumentRecord::getId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
        catch (DataAccessException e) {
            throw new IndexUnavailableException("Failed to list documents: " + e.getMessage(), e);
        }
    }

    private Map<String, Integer> activeVersions() {
        HashMap<String, Integer> versions = new HashMap<>();
        for (DocumentRecord document : this.mongoTemplate.findAll(DocumentRecord.class, DOCUMENT_COLLECTION)) {
            versions.put(document.getId(), document.getActiveVersion());
        }
        return versions;
    }

    private static Query versionQuery(String documentId, int version) {
        return new Query(Criteria.where("documentId").is(documentId).and("version").is(version));
    }

    public static class ChunkRecord {
        @Id
        private String id;
        private String documentId;
        private int version;
        private String modelId;
        private String label;
        private int ordinal;
        private String text;
        private int startOffset;
        private int endOffset;
        private Map<String, Object> metadata;
        private List<Double> embedding;
        private Double embeddingNorm;

        static ChunkRecord of(EmbeddedChunk embedded, int version) {
            Chunk chunk = embedded.chunk();
            ChunkRecord record = new ChunkRecord();
            record.setId(chunk.key() + "@v" + version);
            record.setDocumentId(chunk.documentId());
            record.setVersion(version);
            record.setModelId(embedded.modelId());
            record.setLabel(chunk.label());
            record.setOrdinal(chunk.ordinal());
            record.setText(chunk.text());
            record.setStartOffset(chunk.startOffset());
            record.setEndOffset(chunk.endOffset());
            record.setMetadata(new HashMap<>(chunk.metadata()));
            record.setEmbedding(VectorMath.toList(embedded.vector()));
            record.setEmbeddingNorm(VectorMath.squaredNorm(embedded.vector()));
            return record;
        }

        Chunk toChunk() {
            return new Chunk(this.documentId, this.label, this.ordinal, this.text, this.startOffset, this.endOffset, this.metadata);
        }

        public String getId() {
            return this.id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getDocumentId() {
            return this.documentId;
        }

        public void setDocumentId(String documentId) {
            this.documentId = documentId;
        }

        public int getVersion() {
            return this.version;
        }

        public void setVersion(int version) {
            this.version = version;
        }

        public String getModelId() {
            return this.modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public String getLabel() {
            return this.label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public int getOrdinal() {
            return this.ordinal;
        }

        public void setOrdinal(int ordinal) {
            this.ordinal = ordinal;
        }

        public String getText() {
            return this.text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public int getStartOffset() {
            return this.startOffset;
        }

        public void setStartOffset(int startOffset) {
            this.startOffset = startOffset;
        }

        public int getEndOffset() {
            return this.endOffset;
        }

        public void setEndOffset(int endOffset) {
            this.endOffset = endOffset;
        }

        public Map<String, Object> getMetadata() {
            return this.metadata;
        }

        public void setMetadata(Map<String, Object> metadata) {
            this.metadata = metadata;
        }

        public List<Double> getEmbedding() {
            return this.embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }

        public Double getEmbeddingNorm() {
            return this.embeddingNorm;
        }

        public void setEmbeddingNorm(Double embeddingNorm) {
            this.embeddingNorm = embeddingNorm;
        }
    }

    public static class DocumentRecord {
        @Id
        private String id;
        private int activeVersion;
        private Instant updatedAt;

        static DocumentRecord of(String documentId, int activeVersion) {
            DocumentRecord record = new DocumentRecord();
            record.setId(documentId);
            record.setActiveVersion(activeVersion);
            record.setUpdatedAt(Instant.now());
            return record;
        }

        public String getId() {
            return this.id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public int getActiveVersion() {
            return this.activeVersion;
        }

        public void setActiveVersion(int activeVersion) {
            this.activeVersion = activeVersion;
        }

        public Instant getUpdatedAt() {
            return this.updatedAt;
        }

        public void setUpdatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
        }
    }

    private record Scored(ChunkRecord record, double similarity) {
    }
}
