package org.radixsearch.search.model;

import org.radixsearch.search.query.SearchHit;

import java.util.List;

public record SearchResult(
		String documentId,
		String title,
		double relevance,
		List<Double> zScores,
		String snippet
) {
	public static SearchResult fromHit(SearchHit hit, String title) {
		return new SearchResult(
				hit.documentId(),
				title,
				hit.relevance(),
				hit.zScores(),
				hit.snippet()
		);
	}
}
