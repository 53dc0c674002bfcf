package org.radixsearch.search.query;

import org.radixsearch.core.index.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Runs a free-text boolean query against an {@link InvertedIndex}: tokenize, insert implicit conjunctions,
 * compile to postfix, evaluate over postings, rank by z-score and attach snippets.
 *
 * <p>Holds no state beyond a read-only reference to the index. Any failure inside the pipeline yields an empty
 * result list.</p>
 */
public class QueryEngine {
	private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

	private final InvertedIndex index;
	private final RelevanceRanker ranker;
	private final SnippetGenerator snippets;

	public QueryEngine(InvertedIndex index) {
		this(index, SnippetGenerator.DEFAULT_WINDOW);
	}

	public QueryEngine(InvertedIndex index, int snippetWindow) {
		this.index = index;
		this.ranker = new RelevanceRanker(index);
		this.snippets = new SnippetGenerator(snippetWindow);
	}

	public List<SearchHit> search(String query) {
		if (!index.isLoaded()) {
			logger.warn("Index not loaded, returning empty results");
			return Collections.emptyList();
		}

		try {
			List<QueryToken> tokens = QueryTokenizer.tokenize(query);
			List<String> terms = QueryTokenizer.terms(tokens);
			Set<String> candidates = matchingDocuments(tokens);

			List<SearchHit> hits = new ArrayList<>(candidates.size());
			for (RelevanceRanker.RankedDocument ranked : ranker.rank(candidates, terms)) {
				String snippet = snippets.generate(index.documentText(ranked.documentId()), terms);
				hits.add(new SearchHit(ranked.documentId(), ranked.relevance(), ranked.zScores(), snippet));
			}
			return hits;
		} catch (RuntimeException e) {
			logger.error("Failed to process query '{}'", query, e);
			return Collections.emptyList();
		}
	}

	/**
	 * Unranked set of documents satisfying the boolean query.
	 */
	public Set<String> matchingDocuments(String query) {
		if (!index.isLoaded()) {
			return Collections.emptySet();
		}
		return matchingDocuments(QueryTokenizer.tokenize(query));
	}

	public String title(String documentId) {
		return index.title(documentId);
	}

	private Set<String> matchingDocuments(List<QueryToken> tokens) {
		List<QueryToken> postfix = PostfixCompiler.compile(ImplicitAndRewriter.rewrite(tokens));
		logger.debug("Compiled query to postfix {}", postfix);
		return PostfixEvaluator.evaluate(postfix, term -> index.postings(term).keySet());
	}
}
