package com.deskpilot.model;

import java.util.Locale;

/**
 * Per-query retrieval switches. {@code categoryFilter} restricts ticket and knowledge-base
 * records to one category (case-insensitive); uploaded documents carry no category and are
 * never filtered by it.
 */
public record QueryOptions(boolean includeTickets, boolean includeKb, String categoryFilter) {

    public static final QueryOptions DEFAULT = new QueryOptions(true, true, null);

    public QueryOptions {
        categoryFilter = categoryFilter == null || categoryFilter.isBlank() ? null : categoryFilter.trim();
    }

    public boolean includesStructured() {
        return this.includeTickets || this.includeKb;
    }

    public boolean hasCategoryFilter() {
        return this.categoryFilter != null;
    }

    public boolean matchesCategory(String category) {
        return this.categoryFilter == null
                || category != null && category.trim().toLowerCase(Locale.ROOT).equals(this.categoryFilter.toLowerCase(Locale.ROOT));
    }
}
