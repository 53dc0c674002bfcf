package org.radixsearch.search.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.radixsearch.core.index.CorpusReader;
import org.radixsearch.search.model.DocumentView;
import org.radixsearch.search.model.SearchResponse;
import org.radixsearch.search.model.SearchResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SearchServiceTest {

	@TempDir
	Path tempDir;

	private SearchService service;

	@BeforeEach
	public void setUp() throws Exception {
		Path corpus = tempDir.resolve("corpus");
		Files.createDirectories(corpus.resolve("sport"));
		Files.createDirectories(corpus.resolve("tech"));
		for (int i = 1; i <= 5; i++) {
			Files.writeString(corpus.resolve("sport/00" + i + ".txt"), "Match " + i + "\nA match report");
		}
		Files.writeString(corpus.resolve("tech/010.txt"), "Matches abroad");

		SearchContext context = new SearchContext(tempDir.resolve("index.txt"), corpus, CorpusReader.DEFAULT_CATEGORIES, 80);
		context.ensureLoaded();
		service = new SearchService(context, 3);
	}

	private static List<String> ids(SearchResponse response) {
		return response.results().stream().map(SearchResult::documentId).toList();
	}

	@Test
	public void testPagination() {
		SearchResponse second = service.search("match", 2, 2);

		assertEquals(5, second.totalResults());
		assertEquals(2, second.page());
		assertEquals(2, second.returnedResults());
		assertEquals(List.of("sport/003.txt", "sport/004.txt"), ids(second));

		assertEquals(List.of("sport/005.txt"), ids(service.search("match", 3, 2)));
		assertTrue(service.search("match", 4, 2).results().isEmpty());
		assertEquals(5, service.search("match", 4, 2).totalResults());
	}

	@Test
	public void testLimitIsCappedAndPageClamped() {
		SearchResponse response = service.search("match", 0, 50);

		assertEquals(1, response.page());
		assertEquals(3, response.limit());
		assertEquals(3, response.returnedResults());
		assertEquals(3, service.search("match", 1, 0).limit());
	}

	@Test
	public void testResultsCarryTitleAndSnippet() {
		SearchResult first = service.search("match", 1, 1).results().get(0);

		assertEquals("sport/001.txt", first.documentId());
		assertEquals("Match 1", first.title());
		assertTrue(first.snippet().contains("<mark>Match</mark>"));
	}

	@Test
	public void testGetDocument() {
		Optional<DocumentView> document = service.getDocument("tech/010.txt");

		assertTrue(document.isPresent());
		assertEquals("Matches abroad", document.get().title());
		assertEquals("Matches abroad", document.get().text());
		assertEquals(2, document.get().metadata().wordCount());

		assertTrue(service.getDocument("tech/999.txt").isEmpty());
		assertTrue(service.getDocument(null).isEmpty());
	}

	@Test
	public void testSuggest() {
		assertEquals(List.of("match", "matches"), service.suggest(" MAT", 10));
		assertEquals(List.of("match"), service.suggest("mat", 1));
		assertTrue(service.suggest("", 10).isEmpty());
		assertTrue(service.suggest("qqq", 10).isEmpty());
	}

	@Test
	public void testStats() {
		SearchService.SearchStats stats = service.getStats();

		assertEquals(6, stats.totalDocuments());
		assertTrue(stats.indexLoaded());
		assertTrue(stats.indexSizeMB() > 0);
		assertEquals(4, stats.distinctTerms());
	}
}
