package org.radixsearch.indexing.model;

public record IndexStatusResponse(
		int documentsIndexed,
		long totalTokens,
		int distinctTerms,
		String lastUpdate,
		double indexSizeMB
) {}
