package org.radixsearch.search.query;

import org.radixsearch.core.index.InvertedIndex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Scores candidate documents by the mean of the non-zero z-scores of the query terms.
 *
 * <p>A z-score of exactly zero (term absent from the corpus, or present at exactly the average frequency) is
 * left out of the mean rather than counted. Candidates are visited in identifier order and then stably sorted by
 * relevance, so equal scores keep identifier order.</p>
 */
public class RelevanceRanker {
	private final InvertedIndex index;

	public RelevanceRanker(InvertedIndex index) {
		this.index = index;
	}

	public List<RankedDocument> rank(Collection<String> candidates, List<String> terms) {
		List<RankedDocument> ranked = new ArrayList<>(candidates.size());

		for (String documentId : candidates.stream().sorted().toList()) {
			List<Double> zScores = new ArrayList<>(terms.size());
			double sum = 0.0;
			int counted = 0;

			for (String term : terms) {
				double z = index.zscore(term, documentId);
				zScores.add(z);
				if (z != 0.0) {
					sum += z;
					counted++;
				}
			}

			double relevance = counted > 0 ? sum / counted : 0.0;
			ranked.add(new RankedDocument(documentId, relevance, zScores));
		}

		ranked.sort(Comparator.comparingDouble(RankedDocument::relevance).reversed());
		return ranked;
	}

	public record RankedDocument(String documentId, double relevance, List<Double> zScores) {}
}
