package org.radixsearch.core.model;

import com.google.gson.annotations.SerializedName;

/**
 * Corpus-wide counters persisted in the {@code # GLOBAL_STATS} section of the index file.
 */
public record GlobalStats(
        @SerializedName("total_documents") int totalDocuments,
        @SerializedName("total_tokens") long totalTokens,
        @SerializedName("distinct_terms") int distinctTerms
) {
    public static GlobalStats empty() {
        return new GlobalStats(0, 0L, 0);
    }
}
