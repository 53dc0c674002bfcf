package org.radixsearch.core.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TextAnalyzerTest {

	@Test
	public void testTokenizeNormalizesAndDropsShortWords() {
		List<String> tokens = TextAnalyzer.tokenize("The U.S. economy grew 3.5% in Q2, analysts said!");

		assertEquals(List.of("the", "economy", "grew", "analysts", "said"), tokens);
	}

	@Test
	public void testUnderscoreAndDigitsSplitTokens() {
		assertEquals(List.of("foo", "bar", "2024"), TextAnalyzer.tokenize("foo_bar 2024"));
	}

	@Test
	public void testTermFrequencies() {
		Map<String, Integer> frequencies = TextAnalyzer.termFrequencies(
				TextAnalyzer.tokenize("Dogs, dogs and more DOGS"));

		assertEquals(3, frequencies.get("dogs"));
		assertEquals(1, frequencies.get("and"));
		assertEquals(1, frequencies.get("more"));
	}

	@Test
	public void testEmptyText() {
		assertTrue(TextAnalyzer.tokenize("").isEmpty());
		assertTrue(TextAnalyzer.tokenize(null).isEmpty());
	}
}
