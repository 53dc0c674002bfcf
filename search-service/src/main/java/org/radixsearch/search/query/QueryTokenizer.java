package org.radixsearch.search.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a free-text query into terms, {@code AND}/{@code OR} operators and parentheses.
 *
 * <p>Double quotes switch to a mode where whitespace and parentheses are ordinary characters, so a quoted
 * segment becomes a single token. Terms are lowercased and stripped of punctuation; tokens left empty are
 * dropped.</p>
 */
public final class QueryTokenizer {
	private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

	private QueryTokenizer() {}

	public static List<QueryToken> tokenize(String query) {
		List<QueryToken> tokens = new ArrayList<>();
		if (query == null) {
			return tokens;
		}

		StringBuilder current = new StringBuilder();
		boolean quoted = false;

		for (int i = 0; i < query.length(); i++) {
			char ch = query.charAt(i);
			if (ch == '"') {
				quoted = !quoted;
				flush(current, tokens);
			} else if ((ch == '(' || ch == ')') && !quoted) {
				flush(current, tokens);
				tokens.add(ch == '(' ? QueryToken.LEFT_PAREN : QueryToken.RIGHT_PAREN);
			} else if (Character.isWhitespace(ch) && !quoted) {
				flush(current, tokens);
			} else {
				current.append(ch);
			}
		}
		flush(current, tokens);

		return tokens;
	}

	/**
	 * The non-operator terms of a token list, in query order.
	 */
	public static List<String> terms(List<QueryToken> tokens) {
		List<String> terms = new ArrayList<>();
		for (QueryToken token : tokens) {
			if (token.isTerm()) {
				terms.add(token.text());
			}
		}
		return terms;
	}

	private static void flush(StringBuilder current, List<QueryToken> tokens) {
		String raw = current.toString().strip();
		current.setLength(0);
		if (raw.isEmpty()) {
			return;
		}

		if (raw.equalsIgnoreCase("and")) {
			tokens.add(QueryToken.AND);
		} else if (raw.equalsIgnoreCase("or")) {
			tokens.add(QueryToken.OR);
		} else {
			String term = NON_WORD.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("");
			if (!term.isEmpty()) {
				tokens.add(QueryToken.term(term));
			}
		}
	}
}
