package org.radixsearch.search.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts {@code AND} between adjacent operands, so {@code climate change} reads as
 * {@code climate AND change} and {@code (a) (b)} as {@code (a) AND (b)}.
 */
public final class ImplicitAndRewriter {
	private ImplicitAndRewriter() {}

	public static List<QueryToken> rewrite(List<QueryToken> tokens) {
		List<QueryToken> rewritten = new ArrayList<>(tokens.size() * 2);
		QueryToken previous = null;

		for (QueryToken token : tokens) {
			if (previous != null && endsOperand(previous) && startsOperand(token)) {
				rewritten.add(QueryToken.AND);
			}
			rewritten.add(token);
			previous = token;
		}
		return rewritten;
	}

	private static boolean endsOperand(QueryToken token) {
		return token.isTerm() || token.type() == QueryToken.Type.RIGHT_PAREN;
	}

	private static boolean startsOperand(QueryToken token) {
		return token.isTerm() || token.type() == QueryToken.Type.LEFT_PAREN;
	}
}
