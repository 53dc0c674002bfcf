package org.radixsearch.indexing.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.radixsearch.core.index.CorpusNotFoundException;
import org.radixsearch.core.index.CorpusReader;
import org.radixsearch.core.index.InvertedIndex;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingServiceTest {

	@TempDir
	Path tempDir;

	private Path writeCorpus() throws Exception {
		Path corpus = tempDir.resolve("corpus");
		Files.createDirectories(corpus.resolve("politics"));
		Files.createDirectories(corpus.resolve("tech"));
		Files.writeString(corpus.resolve("politics/001.txt"), "Election results announced\nVoters turned out early.");
		Files.writeString(corpus.resolve("tech/001.txt"), "Phone sales slow");
		Files.writeString(corpus.resolve("tech/002.txt"), "   ");
		return corpus;
	}

	@Test
	public void testRebuildWritesIndexFile() throws Exception {
		Path indexFile = tempDir.resolve("datamart/index.txt");
		IndexingService service = new IndexingService(writeCorpus(), CorpusReader.DEFAULT_CATEGORIES, indexFile);

		assertTrue(service.isIndexEmpty());
		assertNull(service.getStats().lastUpdate());

		int documents = service.rebuildIndex();

		assertEquals(2, documents);
		assertTrue(Files.exists(indexFile));
		assertFalse(service.isIndexEmpty());

		IndexingService.IndexStats stats = service.getStats();
		assertEquals(2, stats.documentsIndexed());
		assertEquals(10, stats.totalTokens());
		assertTrue(stats.indexSizeMB() > 0);
		assertNotNull(stats.lastUpdate());

		InvertedIndex persisted = new InvertedIndex();
		assertTrue(persisted.load(indexFile, tempDir.resolve("corpus")));
		assertEquals(stats.distinctTerms(), persisted.globalStats().distinctTerms());
		assertEquals(1, persisted.postings("election").get("politics/001.txt").intValue());
	}

	@Test
	public void testRebuildStartsFromScratch() throws Exception {
		Path corpus = writeCorpus();
		IndexingService service = new IndexingService(corpus, CorpusReader.DEFAULT_CATEGORIES, tempDir.resolve("index.txt"));
		service.rebuildIndex();

		Files.delete(corpus.resolve("tech/001.txt"));

		assertEquals(1, service.rebuildIndex());
		assertEquals(1, service.getStats().documentsIndexed());
	}

	@Test
	public void testLoadExisting() throws Exception {
		Path corpus = writeCorpus();
		Path indexFile = tempDir.resolve("index.txt");

		IndexingService first = new IndexingService(corpus, CorpusReader.DEFAULT_CATEGORIES, indexFile);
		assertFalse(first.loadExisting());
		first.rebuildIndex();

		IndexingService second = new IndexingService(corpus, CorpusReader.DEFAULT_CATEGORIES, indexFile);
		assertTrue(second.loadExisting());
		assertEquals(2, second.getStats().documentsIndexed());
		assertFalse(second.isIndexEmpty());
	}

	@Test
	public void testMissingCorpusFails() {
		IndexingService service = new IndexingService(tempDir.resolve("missing"), CorpusReader.DEFAULT_CATEGORIES,
				tempDir.resolve("index.txt"));

		assertThrows(CorpusNotFoundException.class, service::rebuildIndex);
		assertFalse(Files.exists(tempDir.resolve("index.txt")));
	}
}
