package org.radixsearch.indexing.service;

import org.radixsearch.core.index.InvertedIndex;
import org.radixsearch.core.model.GlobalStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Builds the inverted index from the corpus and persists it for the Search Service.
 *
 * <p>Every rebuild starts from an empty index; rebuilds are serialized.</p>
 */
public class IndexingService {
    private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

    private final Path corpusRoot;
    private final List<String> categories;
    private final Path indexFile;

    private volatile InvertedIndex index;
    private volatile LocalDateTime lastUpdate;

    public IndexingService(Path corpusRoot, List<String> categories, Path indexFile) {
        this.corpusRoot = corpusRoot;
        this.categories = List.copyOf(categories);
        this.indexFile = indexFile;
        this.index = new InvertedIndex(this.categories);
    }

    /**
     * Load the index already on disk, if there is a readable one.
     *
     * @return true when an index was loaded
     */
    public synchronized boolean loadExisting() {
        InvertedIndex loaded = new InvertedIndex(categories);
        if (!loaded.load(indexFile, corpusRoot)) {
            return false;
        }
        index = loaded;
        lastUpdate = LocalDateTime.now();
        return true;
    }

    /**
     * Index the whole corpus from scratch and overwrite the index file.
     *
     * @return number of documents indexed
     */
    public synchronized int rebuildIndex() throws IOException {
        logger.info("Starting full index rebuild from {}", corpusRoot);

        InvertedIndex fresh = new InvertedIndex(categories);
        int documents = fresh.ingestCorpus(corpusRoot);
        fresh.save(indexFile);

        index = fresh;
        lastUpdate = LocalDateTime.now();
        logger.info("Index rebuild complete: {} documents indexed into {}", documents, indexFile);
        return documents;
    }

    public boolean isIndexEmpty() {
        return !index.isLoaded() || index.globalStats().totalDocuments() == 0;
    }

    public IndexStats getStats() {
        GlobalStats stats = index.globalStats();
        return new IndexStats(
                stats.totalDocuments(),
                stats.totalTokens(),
                stats.distinctTerms(),
                getSizeInMB(),
                lastUpdate
        );
    }

    private double getSizeInMB() {
        try {
            if (Files.exists(indexFile)) {
                long bytes = Files.size(indexFile);
                return bytes / (1024.0 * 1024.0);
            }
        } catch (IOException e) {
            logger.warn("Failed to get index file size", e);
        }
        return 0.0;
    }

    public record IndexStats(
            int documentsIndexed,
            long totalTokens,
            int distinctTerms,
            double indexSizeMB,
            LocalDateTime lastUpdate
    ) {}
}
