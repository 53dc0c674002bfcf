package org.radixsearch.search.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Shunting-yard conversion of an infix token list to postfix order.
 *
 * <p>Lenient with unbalanced input: a closing parenthesis without a match drains the operator stack, and
 * opening parentheses still open at the end are discarded. Never throws.</p>
 */
public final class PostfixCompiler {
	private PostfixCompiler() {}

	public static List<QueryToken> compile(List<QueryToken> infix) {
		List<QueryToken> output = new ArrayList<>(infix.size());
		Deque<QueryToken> operators = new ArrayDeque<>();

		for (QueryToken token : infix) {
			switch (token.type()) {
				case TERM -> output.add(token);
				case LEFT_PAREN -> operators.push(token);
				case RIGHT_PAREN -> {
					while (!operators.isEmpty() && operators.peek().type() != QueryToken.Type.LEFT_PAREN) {
						output.add(operators.pop());
					}
					if (!operators.isEmpty()) {
						operators.pop();
					}
				}
				case AND, OR -> {
					while (!operators.isEmpty()
							&& operators.peek().isOperator()
							&& operators.peek().precedence() >= token.precedence()) {
						output.add(operators.pop());
					}
					operators.push(token);
				}
			}
		}

		while (!operators.isEmpty()) {
			QueryToken token = operators.pop();
			if (token.isOperator()) {
				output.add(token);
			}
		}
		return output;
	}
}
