package com.deskpilot.rag.structured;

import com.deskpilot.model.QueryOptions;
import com.deskpilot.model.StructuredRecord;
import java.util.List;

/**
 * Read-only keyword search over the ticket and knowledge-base record store.
 */
public interface StructuredSearchAdapter {

    default List<StructuredRecord> searchRelevant(String query, int limit) {
        return this.searchRelevant(query, limit, QueryOptions.DEFAULT);
    }

    /**
     * Searches only the record kinds {@code options} includes, restricted to its category
     * filter when one is set.
     */
    List<StructuredRecord> searchRelevant(String query, int limit, QueryOptions options);
}
