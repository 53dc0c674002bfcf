package org.radixsearch.core.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

public class CorpusReader {
	private static final Logger logger = LoggerFactory.getLogger(CorpusReader.class);

	public static final List<String> DEFAULT_CATEGORIES =
			List.of("business", "entertainment", "politics", "sport", "tech");

	private final Path corpusRoot;
	private final List<String> categories;

	public CorpusReader(Path corpusRoot, List<String> categories) {
		this.corpusRoot = corpusRoot;
		this.categories = List.copyOf(categories);
	}

	/**
	 * List every {@code .txt} file under the configured category folders, sorted by name within a category
	 */
	public List<CorpusFile> listDocuments() throws IOException {
		if (!Files.exists(corpusRoot)) {
			throw new CorpusNotFoundException("Corpus directory not found: " + corpusRoot);
		}

		List<CorpusFile> files = new ArrayList<>();
		for (String category : categories) {
			Path folder = corpusRoot.resolve(category);
			if (!Files.isDirectory(folder)) {
				logger.warn("Category folder missing: {}", category);
				continue;
			}

			try (Stream<Path> paths = Files.list(folder)) {
				paths.filter(Files::isRegularFile)
						.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt"))
						.sorted()
						.forEach(p -> files.add(new CorpusFile(documentId(p), p)));
			}
		}

		logger.info("Found {} text files in {} categories under {}", files.size(), categories.size(), corpusRoot);
		return files;
	}

	/**
	 * Read a document as UTF-8, dropping undecodable bytes
	 */
	public static String read(Path file) throws IOException {
		byte[] bytes = Files.readAllBytes(file);
		return StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.IGNORE)
				.onUnmappableCharacter(CodingErrorAction.IGNORE)
				.decode(ByteBuffer.wrap(bytes))
				.toString();
	}

	/**
	 * Corpus-relative identifier of a file, always '/'-separated
	 */
	public String documentId(Path file) {
		return corpusRoot.relativize(file).toString().replace('\\', '/');
	}

	public Path resolve(String documentId) {
		return corpusRoot.resolve(documentId);
	}

	public record CorpusFile(String documentId, Path path) {}
}
