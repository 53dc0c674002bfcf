package org.radixsearch.core.trie;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class PrefixTreeTest {

	@Test
	public void testInsertAndLookup() {
		PrefixTree tree = new PrefixTree();
		tree.insert("climate", "a.txt");
		tree.insert("climate", "b.txt");
		tree.insert("change", "a.txt");

		assertTrue(tree.contains("climate"));
		assertTrue(tree.contains("change"));
		assertFalse(tree.contains("clim"));
		assertFalse(tree.contains("climates"));
		assertEquals(Set.of("a.txt", "b.txt"), tree.documents("climate"));
		assertEquals(Set.of("a.txt"), tree.documents("change"));
		assertTrue(tree.documents("missing").isEmpty());
		assertEquals(2, tree.termCount());
		assertTrue(tree.isCompact());
	}

	@Test
	public void testTermThatIsPrefixOfExistingTerm() {
		PrefixTree tree = new PrefixTree();
		tree.insert("house", "1");
		tree.insert("hou", "2");

		// root -> "hou" (terminal) -> "se" (terminal)
		assertEquals(3, tree.nodeCount());
		assertEquals(Set.of("2"), tree.documents("hou"));
		assertEquals(Set.of("1"), tree.documents("house"));
		assertTrue(tree.isCompact());
	}

	@Test
	public void testExistingTermIsPrefixOfNewTerm() {
		PrefixTree tree = new PrefixTree();
		tree.insert("hou", "2");
		tree.insert("house", "1");

		assertEquals(3, tree.nodeCount());
		assertTrue(tree.contains("hou"));
		assertTrue(tree.contains("house"));
		assertTrue(tree.isCompact());
	}

	@Test
	public void testPartialOverlapSplitsEdge() {
		PrefixTree tree = new PrefixTree();
		tree.insert("romane", "1");
		tree.insert("romanus", "2");
		tree.insert("romulus", "3");

		// root -> "rom" -> {"an" -> {"e", "us"}, "ulus"}
		assertEquals(6, tree.nodeCount());
		assertFalse(tree.contains("rom"));
		assertFalse(tree.contains("roman"));
		assertEquals(List.of("romane", "romanus", "romulus"), tree.termsWithPrefix("rom", 10));
		assertTrue(tree.isCompact());
	}

	@Test
	public void testRemovePrunesLeafAndMergesChain() {
		PrefixTree tree = new PrefixTree();
		tree.insert("romane", "1");
		tree.insert("romanus", "2");

		assertTrue(tree.remove("romanus", "2"));

		// the "roman" split node folds back into a single "romane" edge
		assertEquals(2, tree.nodeCount());
		assertTrue(tree.contains("romane"));
		assertFalse(tree.contains("romanus"));
		assertEquals(List.of("romane"), tree.termsWithPrefix("ro", 10));
		assertTrue(tree.isCompact());
	}

	@Test
	public void testRemoveKeepsTermWhileOtherDocumentsRemain() {
		PrefixTree tree = new PrefixTree();
		tree.insert("sport", "a");
		tree.insert("sport", "b");

		assertTrue(tree.remove("sport", "a"));
		assertTrue(tree.contains("sport"));
		assertEquals(Set.of("b"), tree.documents("sport"));

		assertTrue(tree.remove("sport", "b"));
		assertFalse(tree.contains("sport"));
		assertEquals(1, tree.nodeCount());
		assertTrue(tree.isEmpty());
	}

	@Test
	public void testRemoveAbsentTermOrDocumentReturnsFalse() {
		PrefixTree tree = new PrefixTree();
		tree.insert("politics", "a");

		assertFalse(tree.remove("policy", "a"));
		assertFalse(tree.remove("poli", "a"));
		assertFalse(tree.remove("politics", "b"));
		assertFalse(tree.remove("", "a"));
		assertTrue(tree.contains("politics"));
	}

	@Test
	public void testRemoveInnerTerminalKeepsChildren() {
		PrefixTree tree = new PrefixTree();
		tree.insert("tech", "a");
		tree.insert("technology", "b");
		tree.insert("technical", "c");

		assertTrue(tree.remove("tech", "a"));

		assertFalse(tree.contains("tech"));
		assertTrue(tree.contains("technology"));
		assertTrue(tree.contains("technical"));
		assertTrue(tree.isCompact());
	}

	@Test
	public void testPrefixQueries() {
		PrefixTree tree = new PrefixTree();
		for (String term : List.of("business", "busy", "bust", "entertainment")) {
			tree.insert(term, "doc");
		}

		assertTrue(tree.startsWith("bus"));
		assertTrue(tree.startsWith("busin"));
		assertFalse(tree.startsWith("bat"));
		assertEquals(List.of("business", "bust", "busy"), tree.termsWithPrefix("bus", 10));
		assertEquals(2, tree.termsWithPrefix("bus", 2).size());
		assertEquals(List.of("entertainment"), tree.termsWithPrefix("enter", 10));
		assertTrue(tree.termsWithPrefix("xyz", 10).isEmpty());
	}

	@Test
	public void testInvariantHoldsUnderRandomOperations() {
		Random random = new Random(42);
		String alphabet = "abc";
		PrefixTree tree = new PrefixTree();
		Map<String, Set<String>> expected = new HashMap<>();

		for (int i = 0; i < 2000; i++) {
			int length = 1 + random.nextInt(5);
			StringBuilder term = new StringBuilder();
			for (int j = 0; j < length; j++) {
				term.append(alphabet.charAt(random.nextInt(alphabet.length())));
			}
			String doc = "d" + random.nextInt(3);

			if (random.nextBoolean()) {
				tree.insert(term.toString(), doc);
				expected.computeIfAbsent(term.toString(), k -> new HashSet<>()).add(doc);
			} else {
				Set<String> docs = expected.get(term.toString());
				boolean present = docs != null && docs.remove(doc);
				if (docs != null && docs.isEmpty()) {
					expected.remove(term.toString());
				}
				assertEquals(present, tree.remove(term.toString(), doc));
			}
			assertTrue(tree.isCompact(), "invariant broken after operation " + i);
		}

		assertEquals(expected.size(), tree.termCount());
		for (Map.Entry<String, Set<String>> entry : expected.entrySet()) {
			assertEquals(entry.getValue(), tree.documents(entry.getKey()));
		}
	}
}
