package org.radixsearch.search.query;

import org.jsoup.nodes.Entities;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds an HTML excerpt around the earliest occurrence of any query term.
 *
 * <p>The excerpt spans {@code window} characters on each side of the match, clamped to the document, with
 * {@code ...} marking a cut at either end. Every occurrence of every term inside the excerpt is wrapped in
 * {@code <mark>}; terms are matched in a single pass, longest first, so overlapping terms never nest. All other
 * text is HTML-escaped. Without a match the first {@code 2 * window} characters are returned.</p>
 */
public class SnippetGenerator {
	public static final int DEFAULT_WINDOW = 80;
	private static final String ELLIPSIS = "...";

	private final int window;

	public SnippetGenerator() {
		this(DEFAULT_WINDOW);
	}

	public SnippetGenerator(int window) {
		if (window <= 0) {
			throw new IllegalArgumentException("window must be positive: " + window);
		}
		this.window = window;
	}

	public String generate(String text, List<String> terms) {
		if (text == null || text.isEmpty()) {
			return "";
		}

		int bestPosition = -1;
		int bestLength = 0;
		for (String term : terms) {
			if (term.isEmpty()) {
				continue;
			}
			Matcher matcher = compile(List.of(term)).matcher(text);
			if (matcher.find() && (bestPosition == -1 || matcher.start() < bestPosition)) {
				bestPosition = matcher.start();
				bestLength = matcher.end() - matcher.start();
			}
		}

		if (bestPosition == -1) {
			int end = Math.min(text.length(), 2 * window);
			String lead = Entities.escape(text.substring(0, end));
			return end < text.length() ? lead + ELLIPSIS : lead;
		}

		int start = Math.max(0, bestPosition - window);
		int end = Math.min(text.length(), bestPosition + bestLength + window);
		String excerpt = highlight(text.substring(start, end), terms);

		StringBuilder snippet = new StringBuilder();
		if (start > 0) {
			snippet.append(ELLIPSIS);
		}
		snippet.append(excerpt);
		if (end < text.length()) {
			snippet.append(ELLIPSIS);
		}
		return snippet.toString();
	}

	private static String highlight(String excerpt, List<String> terms) {
		List<String> nonEmpty = terms.stream().filter(t -> !t.isEmpty()).distinct().toList();
		if (nonEmpty.isEmpty()) {
			return Entities.escape(excerpt);
		}

		Matcher matcher = compile(nonEmpty).matcher(excerpt);
		StringBuilder out = new StringBuilder(excerpt.length() + 32);
		int last = 0;
		while (matcher.find()) {
			out.append(Entities.escape(excerpt.substring(last, matcher.start())));
			out.append("<mark>").append(Entities.escape(matcher.group())).append("</mark>");
			last = matcher.end();
		}
		out.append(Entities.escape(excerpt.substring(last)));
		return out.toString();
	}

	private static Pattern compile(List<String> terms) {
		String alternation = terms.stream()
				.sorted(Comparator.comparingInt(String::length).reversed())
				.map(Pattern::quote)
				.collect(Collectors.joining("|"));
		return Pattern.compile(alternation, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
	}
}
