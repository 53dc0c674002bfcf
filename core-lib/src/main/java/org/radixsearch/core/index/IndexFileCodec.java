package org.radixsearch.core.index;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.radixsearch.core.model.DocumentMetadata;
import org.radixsearch.core.model.GlobalStats;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes the line-oriented index file.
 *
 * <pre>
 * # GLOBAL_STATS
 * {"total_documents":N,"total_tokens":N,"distinct_terms":N}
 * # DOCUMENT_METADATA
 * {"business/001.txt":{"size":N,"word_count":N,"unique_words":N},...}
 * # DOCUMENTS
 * ["business/001.txt",...]
 * # POSTINGS
 * term|doc1:tf1;doc2:tf2
 * </pre>
 *
 * Postings lines are sorted by term, and the documents inside a line by identifier.
 */
public class IndexFileCodec {
	public static final String GLOBAL_STATS_HEADER = "# GLOBAL_STATS";
	public static final String METADATA_HEADER = "# DOCUMENT_METADATA";
	public static final String DOCUMENTS_HEADER = "# DOCUMENTS";
	public static final String POSTINGS_HEADER = "# POSTINGS";

	private static final Type METADATA_TYPE = new TypeToken<LinkedHashMap<String, DocumentMetadata>>(){}.getType();
	private static final Type DOCUMENTS_TYPE = new TypeToken<ArrayList<String>>(){}.getType();

	private final Gson gson;

	public IndexFileCodec() {
		this.gson = new GsonBuilder().disableHtmlEscaping().create();
	}

	/**
	 * Whether a document identifier survives the postings line format. Identifiers containing {@code ;},
	 * {@code |} or a line break would be split apart on read.
	 */
	public static boolean isStorableDocumentId(String documentId) {
		if (documentId == null || documentId.isBlank()) {
			return false;
		}
		for (int i = 0; i < documentId.length(); i++) {
			char ch = documentId.charAt(i);
			if (ch == ';' || ch == '|' || ch == '\n' || ch == '\r') {
				return false;
			}
		}
		return true;
	}

	/**
	 * @throws IndexFormatException if a document identifier cannot be stored in the postings format
	 */
	public void write(IndexData data, Writer out) throws IOException {
		for (String documentId : data.documents()) {
			if (!isStorableDocumentId(documentId)) {
				throw new IndexFormatException("Document identifier cannot be stored: " + documentId);
			}
		}

		out.write(GLOBAL_STATS_HEADER + "\n");
		out.write(gson.toJson(data.stats()) + "\n");

		out.write(METADATA_HEADER + "\n");
		out.write(gson.toJson(data.metadata()) + "\n");

		out.write(DOCUMENTS_HEADER + "\n");
		out.write(gson.toJson(data.documents()) + "\n");

		out.write(POSTINGS_HEADER + "\n");
		for (Map.Entry<String, Map<String, Integer>> entry : new TreeMap<>(data.postings()).entrySet()) {
			out.write(formatPostings(entry.getKey(), entry.getValue()));
			out.write("\n");
		}
	}

	public IndexData read(BufferedReader in) throws IOException {
		Section section = Section.NONE;
		GlobalStats stats = GlobalStats.empty();
		Map<String, DocumentMetadata> metadata = new LinkedHashMap<>();
		List<String> documents = new ArrayList<>();
		Map<String, Map<String, Integer>> postings = new HashMap<>();

		String line;
		int lineNumber = 0;
		while ((line = in.readLine()) != null) {
			lineNumber++;
			if (line.isEmpty() || line.startsWith("#")) {
				section = Section.fromHeader(line, section);
				continue;
			}

			try {
				switch (section) {
					case GLOBAL_STATS -> stats = requireJson(gson.fromJson(line, GlobalStats.class), lineNumber);
					case METADATA -> metadata = requireJson(gson.fromJson(line, METADATA_TYPE), lineNumber);
					case DOCUMENTS -> documents = requireJson(gson.fromJson(line, DOCUMENTS_TYPE), lineNumber);
					case POSTINGS -> parsePostings(line, lineNumber, postings);
					case NONE -> {
						// content before the first section header carries no meaning
					}
				}
			} catch (JsonParseException e) {
				throw new IndexFormatException("Invalid JSON on line " + lineNumber, e);
			}
		}

		validateDocuments(documents, metadata);
		return new IndexData(stats, metadata, documents, postings);
	}

	private static void validateDocuments(List<String> documents, Map<String, DocumentMetadata> metadata)
			throws IndexFormatException {
		for (String documentId : documents) {
			if (documentId == null || documentId.isBlank()) {
				throw new IndexFormatException("Blank document identifier in " + DOCUMENTS_HEADER);
			}
		}
		for (Map.Entry<String, DocumentMetadata> entry : metadata.entrySet()) {
			if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
				throw new IndexFormatException("Incomplete metadata entry for document '" + entry.getKey() + "'");
			}
		}
	}

	static String formatPostings(String term, Map<String, Integer> documents) {
		StringBuilder sb = new StringBuilder(term).append('|');
		boolean first = true;
		for (Map.Entry<String, Integer> entry : new TreeMap<>(documents).entrySet()) {
			if (!first) {
				sb.append(';');
			}
			sb.append(entry.getKey()).append(':').append(entry.getValue());
			first = false;
		}
		return sb.toString();
	}

	private static void parsePostings(String line, int lineNumber, Map<String, Map<String, Integer>> postings)
			throws IndexFormatException {
		int bar = line.indexOf('|');
		if (bar <= 0) {
			throw new IndexFormatException("Malformed postings line " + lineNumber + ": " + line);
		}

		String term = line.substring(0, bar);
		String serialized = line.substring(bar + 1);
		if (serialized.isEmpty()) {
			return;
		}

		Map<String, Integer> documents = postings.computeIfAbsent(term, k -> new HashMap<>());
		for (String pair : serialized.split(";")) {
			int colon = pair.lastIndexOf(':');
			if (colon <= 0) {
				throw new IndexFormatException("Malformed posting '" + pair + "' on line " + lineNumber);
			}

			int frequency;
			try {
				frequency = Integer.parseInt(pair.substring(colon + 1));
			} catch (NumberFormatException e) {
				throw new IndexFormatException("Invalid term frequency on line " + lineNumber + ": " + pair, e);
			}
			if (frequency < 1) {
				throw new IndexFormatException("Non-positive term frequency on line " + lineNumber + ": " + pair);
			}
			documents.put(pair.substring(0, colon), frequency);
		}
	}

	private static <T> T requireJson(T value, int lineNumber) throws IndexFormatException {
		if (value == null) {
			throw new IndexFormatException("Empty JSON value on line " + lineNumber);
		}
		return value;
	}

	private enum Section {
		NONE, GLOBAL_STATS, METADATA, DOCUMENTS, POSTINGS;

		static Section fromHeader(String line, Section current) {
			return switch (line) {
				case GLOBAL_STATS_HEADER -> GLOBAL_STATS;
				case METADATA_HEADER -> METADATA;
				case DOCUMENTS_HEADER -> DOCUMENTS;
				case POSTINGS_HEADER -> POSTINGS;
				default -> current;
			};
		}
	}

	/**
	 * Everything the index file carries, in section order.
	 */
	public record IndexData(
			GlobalStats stats,
			Map<String, DocumentMetadata> metadata,
			List<String> documents,
			Map<String, Map<String, Integer>> postings
	) {}
}
