package org.radixsearch.core.text;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw document text into index terms.
 *
 * <p>Text is lowercased, punctuation is replaced by spaces and the remaining runs of ASCII letters and digits
 * are kept when longer than {@link #MIN_TERM_LENGTH} - 1 characters.</p>
 */
public final class TextAnalyzer {
	public static final int MIN_TERM_LENGTH = 3;

	private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern WORD_PATTERN = Pattern.compile("[a-z0-9]+");

	private TextAnalyzer() {}

	/**
	 * Tokenize text in reading order, duplicates included.
	 */
	public static List<String> tokenize(String text) {
		List<String> tokens = new ArrayList<>();
		if (text == null || text.isEmpty()) {
			return tokens;
		}

		String normalized = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
		Matcher matcher = WORD_PATTERN.matcher(normalized);
		while (matcher.find()) {
			String word = matcher.group();
			if (isValidTerm(word)) {
				tokens.add(word);
			}
		}
		return tokens;
	}

	/**
	 * Count how often each term occurs, keyed in first-occurrence order.
	 */
	public static Map<String, Integer> termFrequencies(List<String> tokens) {
		Map<String, Integer> frequencies = new LinkedHashMap<>();
		for (String token : tokens) {
			frequencies.merge(token, 1, Integer::sum);
		}
		return frequencies;
	}

	public static boolean isValidTerm(String word) {
		return word != null && word.length() >= MIN_TERM_LENGTH;
	}
}
