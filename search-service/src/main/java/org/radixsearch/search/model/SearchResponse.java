package org.radixsearch.search.model;

import java.util.List;

public record SearchResponse(
		String query,
		int totalResults,
		int page,
		int limit,
		int returnedResults,
		List<SearchResult> results
) {}
