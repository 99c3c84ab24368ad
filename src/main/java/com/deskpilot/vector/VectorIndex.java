package com.deskpilot.vector;

import com.deskpilot.model.EmbeddedChunk;
import com.deskpilot.model.RetrievalHit;
import java.util.List;
import java.util.Set;

/**
 * Stores embedded chunks and answers cosine nearest-neighbour queries.
 *
 * <p>Mutations for one document id never interleave; queries only compare vectors produced
 * by the same embedding model. Storage failures surface as {@link IndexUnavailableException}.</p>
 */
public interface VectorIndex {

    /**
     * Inserts or overwrites the entry keyed by (document id, unit label, chunk ordinal).
     */
    void upsert(EmbeddedChunk chunk);

    /**
     * Replaces every entry of the document with {@code chunks}. Readers see either the old
     * set or the new one, never a mix; if the write fails the old set stays visible.
     */
    void replaceDocument(String documentId, List<EmbeddedChunk> chunks);

    /**
     * Replaces every entry of the document with {@code chunks} written as {@code version}.
     * A version that is not newer than the active one is stale: nothing is written and
     * {@code false} is returned. Replacing with no chunks removes the document.
     */
    boolean replaceDocument(String documentId, int version, List<EmbeddedChunk> chunks);

    /**
     * Version of the document's visible entries, or 0 when nothing is indexed for it.
     */
    int activeVersion(String documentId);

    /**
     * Up to {@code k} hits by descending similarity, scores mapped into [0,1].
     */
    List<RetrievalHit> search(float[] queryVector, int k, String modelId);

    void delete(String documentId);

    int count(String documentId);

    Set<String> documentIds();
}
