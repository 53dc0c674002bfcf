package org.radixsearch.search.query;

import java.util.List;

public record SearchHit(
		String documentId,
		double relevance,
		List<Double> zScores,
		String snippet
) {}
