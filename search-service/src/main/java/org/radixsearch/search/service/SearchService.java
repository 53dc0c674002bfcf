package org.radixsearch.search.service;

import org.radixsearch.core.index.InvertedIndex;
import org.radixsearch.core.model.GlobalStats;
import org.radixsearch.search.model.DocumentView;
import org.radixsearch.search.model.SearchResponse;
import org.radixsearch.search.model.SearchResult;
import org.radixsearch.search.query.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class SearchService {
	private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

	private final SearchContext context;
	private final int maxResults;

	public SearchService(SearchContext context, int maxResults) {
		this.context = context;
		this.maxResults = maxResults;
	}

	/**
	 * Run a query and return one page of the ranked results.
	 *
	 * @param page 1-based page number
	 * @param limit page size, capped at the configured maximum
	 */
	public SearchResponse search(String query, int page, int limit) {
		SearchContext.Snapshot snapshot = context.current();
		List<SearchHit> hits = snapshot.engine().search(query);

		int pageSize = limit > 0 ? Math.min(limit, maxResults) : maxResults;
		int pageNumber = Math.max(1, page);
		long offset = (long) (pageNumber - 1) * pageSize;

		List<SearchResult> results = Collections.emptyList();
		if (offset < hits.size()) {
			int from = (int) offset;
			int to = Math.min(hits.size(), from + pageSize);
			results = hits.subList(from, to).stream()
					.map(hit -> SearchResult.fromHit(hit, snapshot.index().title(hit.documentId())))
					.toList();
		}

		logger.debug("Query '{}' matched {} documents, returning page {} ({} results)",
				query, hits.size(), pageNumber, results.size());
		return new SearchResponse(query, hits.size(), pageNumber, pageSize, results.size(), results);
	}

	public Optional<DocumentView> getDocument(String documentId) {
		InvertedIndex index = context.current().index();
		if (documentId == null || !index.containsDocument(documentId)) {
			return Optional.empty();
		}

		return Optional.of(new DocumentView(
				documentId,
				index.title(documentId),
				index.documentText(documentId),
				index.metadata(documentId)
		));
	}

	/**
	 * Indexed terms starting with a prefix, answered from the prefix tree.
	 */
	public List<String> suggest(String prefix, int limit) {
		if (prefix == null || prefix.isBlank()) {
			return Collections.emptyList();
		}
		int resultLimit = limit > 0 ? Math.min(limit, maxResults) : maxResults;
		return context.current().index().prefixTree().termsWithPrefix(prefix.strip().toLowerCase(Locale.ROOT), resultLimit);
	}

	public int reload() throws IOException {
		SearchContext.Snapshot snapshot = context.reload();
		return snapshot.index().globalStats().totalDocuments();
	}

	public SearchStats getStats() {
		InvertedIndex index = context.current().index();
		GlobalStats stats = index.globalStats();
		return new SearchStats(
				stats.totalDocuments(),
				stats.totalTokens(),
				stats.distinctTerms(),
				index.isLoaded(),
				indexSizeMB(context.getIndexFile())
		);
	}

	private static double indexSizeMB(Path indexFile) {
		try {
			if (Files.exists(indexFile)) {
				return Files.size(indexFile) / (1024.0 * 1024.0);
			}
		} catch (IOException e) {
			logger.warn("Failed to get index file size", e);
		}
		return 0.0;
	}

	public record SearchStats(
			int totalDocuments,
			long totalTokens,
			int distinctTerms,
			boolean indexLoaded,
			double indexSizeMB
	) {}
}
