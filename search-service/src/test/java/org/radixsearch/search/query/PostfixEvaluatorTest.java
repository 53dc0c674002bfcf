package org.radixsearch.search.query;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class PostfixEvaluatorTest {
	private static final Map<String, Set<String>> POSTINGS = Map.of(
			"aaa", Set.of("1", "2", "3"),
			"bbb", Set.of("2", "3", "4"),
			"ccc", Set.of("5")
	);

	private static Set<String> evaluate(List<QueryToken> postfix) {
		return PostfixEvaluator.evaluate(postfix, term -> POSTINGS.getOrDefault(term, Set.of()));
	}

	@Test
	public void testIntersectionAndUnion() {
		assertEquals(Set.of("2", "3"), evaluate(List.of(QueryToken.term("aaa"), QueryToken.term("bbb"), QueryToken.AND)));
		assertEquals(Set.of("1", "2", "3", "4"), evaluate(List.of(QueryToken.term("aaa"), QueryToken.term("bbb"), QueryToken.OR)));
		assertEquals(Set.of("2", "3", "5"), evaluate(List.of(
				QueryToken.term("aaa"), QueryToken.term("bbb"), QueryToken.AND, QueryToken.term("ccc"), QueryToken.OR)));
	}

	@Test
	public void testUnknownTermYieldsEmptySet() {
		assertTrue(evaluate(List.of(QueryToken.term("zzz"))).isEmpty());
		assertTrue(evaluate(List.of(QueryToken.term("aaa"), QueryToken.term("zzz"), QueryToken.AND)).isEmpty());
	}

	@Test
	public void testOperatorWithoutOperandsIsSkipped() {
		assertEquals(Set.of("1", "2", "3"), evaluate(List.of(QueryToken.term("aaa"), QueryToken.AND)));
		assertTrue(evaluate(List.of(QueryToken.OR)).isEmpty());
		assertTrue(evaluate(List.of()).isEmpty());
	}

	@Test
	public void testLookupResultIsNotModified() {
		evaluate(List.of(QueryToken.term("aaa"), QueryToken.term("bbb"), QueryToken.AND));
		assertEquals(3, POSTINGS.get("aaa").size());
	}
}
