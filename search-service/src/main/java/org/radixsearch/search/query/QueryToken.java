package org.radixsearch.search.query;

/**
 * One lexical unit of a boolean query.
 */
public record QueryToken(Type type, String text) {
	public enum Type { TERM, AND, OR, LEFT_PAREN, RIGHT_PAREN }

	public static final QueryToken AND = new QueryToken(Type.AND, "AND");
	public static final QueryToken OR = new QueryToken(Type.OR, "OR");
	public static final QueryToken LEFT_PAREN = new QueryToken(Type.LEFT_PAREN, "(");
	public static final QueryToken RIGHT_PAREN = new QueryToken(Type.RIGHT_PAREN, ")");

	public static QueryToken term(String text) {
		return new QueryToken(Type.TERM, text);
	}

	public boolean isTerm() {
		return type == Type.TERM;
	}

	public boolean isOperator() {
		return type == Type.AND || type == Type.OR;
	}

	/**
	 * Binding strength used when compiling to postfix; AND binds tighter than OR.
	 */
	public int precedence() {
		return switch (type) {
			case AND -> 2;
			case OR -> 1;
			default -> 0;
		};
	}

	@Override
	public String toString() {
		return text;
	}
}
