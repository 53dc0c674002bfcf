package org.radixsearch.core.index;

import org.radixsearch.core.model.DocumentMetadata;
import org.radixsearch.core.model.GlobalStats;
import org.radixsearch.core.text.TextAnalyzer;
import org.radixsearch.core.trie.PrefixTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory inverted index over a flat text corpus.
 *
 * <p>Holds the term to (document to frequency) postings, a {@link PrefixTree} recording term presence,
 * the raw text of every readable document and per-document metadata. The index is filled once, either by
 * {@link #ingestCorpus(Path)} or by {@link #load(Path, Path)}, and is read-only afterwards.</p>
 */
public class InvertedIndex {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);
	private static final int PROGRESS_INTERVAL = 100;

	private final List<String> categories;
	private final IndexFileCodec codec = new IndexFileCodec();

	private PrefixTree tree;
	private Map<String, Map<String, Integer>> postings;
	private Set<String> documentIds;
	private Map<String, String> documentTexts;
	private Map<String, DocumentMetadata> metadata;
	private int totalDocuments;
	private long totalTokens;
	private int distinctTerms;
	private boolean loaded;

	public InvertedIndex() {
		this(CorpusReader.DEFAULT_CATEGORIES);
	}

	public InvertedIndex(List<String> categories) {
		this.categories = List.copyOf(categories);
		reset();
	}

	/**
	 * Index one document. Frequencies accumulate, so ingesting the same identifier twice counts it twice.
	 */
	public void ingestDocument(String documentId, String rawText) {
		List<String> tokens = TextAnalyzer.tokenize(rawText);
		Map<String, Integer> frequencies = TextAnalyzer.termFrequencies(tokens);

		documentIds.add(documentId);
		documentTexts.put(documentId, rawText);
		metadata.put(documentId, new DocumentMetadata(rawText.length(), tokens.size(), frequencies.size()));

		for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
			tree.insert(entry.getKey(), documentId);
			postings.computeIfAbsent(entry.getKey(), k -> new HashMap<>())
					.merge(documentId, entry.getValue(), Integer::sum);
		}

		totalDocuments++;
		totalTokens += tokens.size();
		logger.debug("Indexed {} with {} tokens, {} distinct", documentId, tokens.size(), frequencies.size());
	}

	/**
	 * Index every text file found under the category folders of {@code corpusRoot}.
	 *
	 * @return number of documents indexed by this call
	 * @throws CorpusNotFoundException if the corpus root does not exist
	 */
	public int ingestCorpus(Path corpusRoot) throws IOException {
		CorpusReader reader = new CorpusReader(corpusRoot, categories);
		List<CorpusReader.CorpusFile> files = reader.listDocuments();

		logger.info("Starting corpus ingestion from {}", corpusRoot);
		int count = 0;
		for (CorpusReader.CorpusFile file : files) {
			if (documentIds.contains(file.documentId())) {
				logger.warn("Skipping {}: already indexed", file.documentId());
				continue;
			}
			if (!IndexFileCodec.isStorableDocumentId(file.documentId())) {
				logger.warn("Skipping {}: file name cannot be stored in the index file", file.documentId());
				continue;
			}

			try {
				String content = CorpusReader.read(file.path()).strip();
				if (content.isEmpty()) {
					continue;
				}
				ingestDocument(file.documentId(), content);
				count++;
				if (count % PROGRESS_INTERVAL == 0) {
					logger.info("Documents processed: {}", count);
				}
			} catch (IOException e) {
				logger.warn("Failed to read {}: {}", file.path(), e.getMessage());
			}
		}

		finishIngestion();
		logger.info("Ingestion complete: {} documents, {} distinct terms", count, distinctTerms);
		return count;
	}

	/**
	 * Recompute the distinct-term count and mark the index ready for queries.
	 */
	public void finishIngestion() {
		distinctTerms = postings.size();
		loaded = true;
	}

	/**
	 * Document frequencies for a term, empty for unknown terms.
	 */
	public Map<String, Integer> postings(String term) {
		Map<String, Integer> documents = postings.get(term);
		if (documents == null) {
			return Collections.emptyMap();
		}
		return Collections.unmodifiableMap(documents);
	}

	/**
	 * Standardized frequency of {@code term} in {@code documentId}, measured against the frequencies of the
	 * documents that contain the term. Zero when the term is unknown or every frequency is equal.
	 */
	public double zscore(String term, String documentId) {
		Map<String, Integer> documents = postings.get(term);
		if (documents == null || documents.isEmpty()) {
			return 0.0;
		}

		double sum = 0.0;
		for (int frequency : documents.values()) {
			sum += frequency;
		}
		double mean = sum / documents.size();

		double squares = 0.0;
		for (int frequency : documents.values()) {
			squares += (frequency - mean) * (frequency - mean);
		}
		double variance = squares / documents.size();
		if (variance <= 0.0) {
			return 0.0;
		}

		int frequency = documents.getOrDefault(documentId, 0);
		return (frequency - mean) / Math.sqrt(variance);
	}

	/**
	 * First non-blank line of the document, or its file name when no text is available.
	 */
	public String title(String documentId) {
		String text = documentTexts.get(documentId);
		if (text != null) {
			for (String line : text.split("\\R")) {
				if (!line.isBlank()) {
					return line.strip();
				}
			}
		}
		return fileName(documentId);
	}

	/**
	 * Raw text of a document, empty when it was never read or has disappeared from disk.
	 */
	public String documentText(String documentId) {
		return documentTexts.getOrDefault(documentId, "");
	}

	public boolean containsDocument(String documentId) {
		return documentIds.contains(documentId);
	}

	public DocumentMetadata metadata(String documentId) {
		return metadata.get(documentId);
	}

	/**
	 * Document identifiers in ingestion order.
	 */
	public List<String> documentIds() {
		return List.copyOf(documentIds);
	}

	public GlobalStats globalStats() {
		return new GlobalStats(totalDocuments, totalTokens, distinctTerms);
	}

	public PrefixTree prefixTree() {
		return tree;
	}

	public boolean isLoaded() {
		return loaded;
	}

	/**
	 * Write the index next to {@code indexFile} and move it into place, so readers never see a partial file.
	 */
	public void save(Path indexFile) throws IOException {
		Path target = indexFile.toAbsolutePath();
		Path parent = target.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Path temp = target.resolveSibling(target.getFileName() + ".tmp");

		IndexFileCodec.IndexData data = new IndexFileCodec.IndexData(
				globalStats(),
				metadata,
				new ArrayList<>(documentIds),
				postings
		);

		try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
			codec.write(data, writer);
		} catch (IOException e) {
			Files.deleteIfExists(temp);
			throw e;
		}
		moveIntoPlace(temp, target);
		logger.info("Saved index to {} ({} documents, {} terms)", indexFile, documentIds.size(), postings.size());
	}

	private static void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, replacing in place", target);
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	/**
	 * Replace the contents of this index with a persisted one and re-read document text from
	 * {@code corpusRoot}.
	 *
	 * @return false when the file is missing or malformed; a malformed file leaves the index empty
	 */
	public boolean load(Path indexFile, Path corpusRoot) {
		if (!Files.exists(indexFile)) {
			logger.warn("Index file does not exist: {}", indexFile);
			return false;
		}

		reset();
		IndexFileCodec.IndexData data;
		try (BufferedReader reader = Files.newBufferedReader(indexFile, StandardCharsets.UTF_8)) {
			data = codec.read(reader);
		} catch (IOException e) {
			logger.error("Failed to load index from {}", indexFile, e);
			reset();
			return false;
		}

		try {
			restore(data, new CorpusReader(corpusRoot, categories));
		} catch (RuntimeException e) {
			logger.error("Index file {} holds unusable entries", indexFile, e);
			reset();
			return false;
		}

		logger.info("Loaded index from {} ({} documents, {} terms, {} texts available)",
				indexFile, documentIds.size(), distinctTerms, documentTexts.size());
		return true;
	}

	private void restore(IndexFileCodec.IndexData data, CorpusReader reader) {
		for (Map.Entry<String, Map<String, Integer>> entry : data.postings().entrySet()) {
			Map<String, Integer> documents = new HashMap<>(entry.getValue());
			postings.put(entry.getKey(), documents);
			for (String documentId : documents.keySet()) {
				tree.insert(entry.getKey(), documentId);
			}
		}

		metadata.putAll(data.metadata());
		documentIds.addAll(data.documents());
		readDocumentTexts(reader);

		int knownDocuments = !metadata.isEmpty() ? metadata.size() : documentIds.size();
		totalDocuments = Math.max(data.stats().totalDocuments(), knownDocuments);
		totalTokens = data.stats().totalTokens();
		distinctTerms = postings.size();
		loaded = true;
	}

	private void readDocumentTexts(CorpusReader reader) {
		for (String documentId : documentIds) {
			try {
				documentTexts.put(documentId, CorpusReader.read(reader.resolve(documentId)).strip());
			} catch (IOException e) {
				logger.warn("Could not read document {}: {}", documentId, e.getMessage());
			}
		}
	}

	/**
	 * Drop every structure and return to the freshly constructed state.
	 */
	public void reset() {
		tree = new PrefixTree();
		postings = new HashMap<>();
		documentIds = new LinkedHashSet<>();
		documentTexts = new HashMap<>();
		metadata = new LinkedHashMap<>();
		totalDocuments = 0;
		totalTokens = 0L;
		distinctTerms = 0;
		loaded = false;
	}

	private static String fileName(String documentId) {
		String normalized = documentId.replace('\\', '/');
		int slash = normalized.lastIndexOf('/');
		return slash >= 0 ? normalized.substring(slash + 1) : normalized;
	}
}
