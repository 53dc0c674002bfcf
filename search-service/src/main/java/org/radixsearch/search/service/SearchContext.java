package org.radixsearch.search.service;

import org.radixsearch.core.index.InvertedIndex;
import org.radixsearch.search.query.QueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Owns the index and query engine shared by every request handler.
 *
 * <p>{@link #ensureLoaded()} is called once before serving traffic: it loads the persisted index, or builds
 * one from the corpus and saves it when the file is missing or unreadable. {@link #reload()} prepares a fresh
 * snapshot and swaps it in. Both run under a single writer lock; readers only ever see a completed snapshot.</p>
 */
public class SearchContext {
	private static final Logger logger = LoggerFactory.getLogger(SearchContext.class);

	private final Path indexFile;
	private final Path corpusRoot;
	private final List<String> categories;
	private final int snippetWindow;
	private final Object writeLock = new Object();

	private volatile Snapshot snapshot;

	public SearchContext(Path indexFile, Path corpusRoot, List<String> categories, int snippetWindow) {
		this.indexFile = indexFile;
		this.corpusRoot = corpusRoot;
		this.categories = List.copyOf(categories);
		this.snippetWindow = snippetWindow;
	}

	public Snapshot ensureLoaded() throws IOException {
		Snapshot current = snapshot;
		if (current != null) {
			return current;
		}

		synchronized (writeLock) {
			if (snapshot == null) {
				snapshot = openSnapshot();
			}
			return snapshot;
		}
	}

	/**
	 * Re-read the persisted index. The previous snapshot keeps serving until the new one is complete.
	 */
	public Snapshot reload() throws IOException {
		synchronized (writeLock) {
			snapshot = openSnapshot();
			return snapshot;
		}
	}

	/**
	 * Current snapshot. Before {@link #ensureLoaded()} completes this is an empty, unloaded index, so queries
	 * return nothing.
	 */
	public Snapshot current() {
		Snapshot current = snapshot;
		if (current != null) {
			return current;
		}
		InvertedIndex empty = new InvertedIndex(categories);
		return new Snapshot(empty, new QueryEngine(empty, snippetWindow));
	}

	public boolean isReady() {
		return snapshot != null;
	}

	public Path getIndexFile() {
		return indexFile;
	}

	private Snapshot openSnapshot() throws IOException {
		InvertedIndex index = new InvertedIndex(categories);
		if (index.load(indexFile, corpusRoot)) {
			logger.info("Search index ready from {}", indexFile);
		} else {
			logger.info("No usable index at {}, building from corpus {}", indexFile, corpusRoot);
			index.ingestCorpus(corpusRoot);
			index.save(indexFile);
		}
		return new Snapshot(index, new QueryEngine(index, snippetWindow));
	}

	public record Snapshot(InvertedIndex index, QueryEngine engine) {}
}
