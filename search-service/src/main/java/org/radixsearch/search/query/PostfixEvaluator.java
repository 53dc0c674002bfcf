package org.radixsearch.search.query;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Evaluates a postfix query over document-identifier sets.
 *
 * <p>An operator that finds fewer than two operands on the stack is skipped, so dangling operators degrade
 * to the best available result instead of failing the query.</p>
 */
public final class PostfixEvaluator {
	private PostfixEvaluator() {}

	/**
	 * @param postfix compiled query
	 * @param documentsForTerm identifiers of the documents containing a term
	 * @return the set on top of the stack, or an empty set for an empty query
	 */
	public static Set<String> evaluate(List<QueryToken> postfix, Function<String, Set<String>> documentsForTerm) {
		Deque<Set<String>> stack = new ArrayDeque<>();

		for (QueryToken token : postfix) {
			switch (token.type()) {
				case TERM -> stack.push(new HashSet<>(documentsForTerm.apply(token.text())));
				case AND -> {
					if (stack.size() >= 2) {
						Set<String> right = stack.pop();
						Set<String> left = stack.pop();
						left.retainAll(right);
						stack.push(left);
					}
				}
				case OR -> {
					if (stack.size() >= 2) {
						Set<String> right = stack.pop();
						Set<String> left = stack.pop();
						left.addAll(right);
						stack.push(left);
					}
				}
				default -> {
					// parentheses never reach postfix form
				}
			}
		}

		return stack.isEmpty() ? Collections.emptySet() : stack.peek();
	}
}
