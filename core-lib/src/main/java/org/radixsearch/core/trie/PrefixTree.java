package org.radixsearch.core.trie;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Edge-compressed prefix tree mapping terms to the documents that contain them.
 *
 * <p>Nodes live in an arena and refer to their children by slot index, so splitting an edge or merging a
 * chain back into its parent only rewrites edge records. Sibling edges never share a first character, and
 * every node below the root is either terminal or has children.</p>
 *
 * <p>Not thread-safe. The tree is mutated only while an index is being built or loaded.</p>
 */
public class PrefixTree {
	private static final int ROOT = 0;

	private final List<Node> nodes = new ArrayList<>();
	private final Deque<Integer> freeSlots = new ArrayDeque<>();
	private int termCount;

	public PrefixTree() {
		nodes.add(new Node());
	}

	/**
	 * Record that {@code documentId} contains {@code term}.
	 */
	public void insert(String term, String documentId) {
		requireTerm(term);
		Objects.requireNonNull(documentId, "documentId");

		int node = ROOT;
		String remaining = term;

		while (!remaining.isEmpty()) {
			Node current = nodes.get(node);
			Edge edge = current.edges.get(remaining.charAt(0));

			if (edge == null) {
				int leaf = allocate();
				current.edges.put(remaining.charAt(0), new Edge(remaining, leaf));
				node = leaf;
				break;
			}

			int common = commonPrefixLength(edge.label(), remaining);
			if (common == edge.label().length()) {
				node = edge.child();
				remaining = remaining.substring(common);
				continue;
			}

			// Split the edge at the shared prefix; the old subtree hangs off the new middle node.
			String shared = edge.label().substring(0, common);
			String oldRest = edge.label().substring(common);
			int middle = allocate();
			nodes.get(middle).edges.put(oldRest.charAt(0), new Edge(oldRest, edge.child()));
			current.edges.put(shared.charAt(0), new Edge(shared, middle));

			node = middle;
			remaining = remaining.substring(common);
		}

		Node arrival = nodes.get(node);
		if (!arrival.terminal) {
			arrival.terminal = true;
			termCount++;
		}
		arrival.documents.add(documentId);
	}

	/**
	 * Remove {@code documentId} from the document set of {@code term}.
	 *
	 * @return false when the term is absent or was not recorded for that document
	 */
	public boolean remove(String term, String documentId) {
		if (term == null || term.isEmpty() || documentId == null) {
			return false;
		}

		List<Integer> path = new ArrayList<>();
		path.add(ROOT);
		int node = ROOT;
		String remaining = term;

		while (!remaining.isEmpty()) {
			Edge edge = nodes.get(node).edges.get(remaining.charAt(0));
			if (edge == null || !remaining.startsWith(edge.label())) {
				return false;
			}
			node = edge.child();
			remaining = remaining.substring(edge.label().length());
			path.add(node);
		}

		Node target = nodes.get(node);
		if (!target.terminal || !target.documents.remove(documentId)) {
			return false;
		}

		if (target.documents.isEmpty()) {
			target.terminal = false;
			termCount--;
			compact(path);
		}
		return true;
	}

	public boolean contains(String term) {
		int node = locate(term);
		return node >= 0 && nodes.get(node).terminal;
	}

	/**
	 * Documents recorded for an exact term, empty when the term is absent.
	 */
	public Set<String> documents(String term) {
		int node = locate(term);
		if (node < 0 || !nodes.get(node).terminal) {
			return Collections.emptySet();
		}
		return Collections.unmodifiableSet(new HashSet<>(nodes.get(node).documents));
	}

	/**
	 * Whether any stored term starts with {@code prefix}.
	 */
	public boolean startsWith(String prefix) {
		return prefix != null && (prefix.isEmpty() ? termCount > 0 : descend(prefix) != null);
	}

	/**
	 * Stored terms beginning with {@code prefix}, in lexicographic order, at most {@code limit} of them.
	 */
	public List<String> termsWithPrefix(String prefix, int limit) {
		List<String> terms = new ArrayList<>();
		if (prefix == null || limit <= 0) {
			return terms;
		}

		Cursor cursor = prefix.isEmpty() ? new Cursor(ROOT, "") : descend(prefix);
		if (cursor != null) {
			collect(cursor.node(), new StringBuilder(cursor.path()), terms, limit);
		}
		return terms;
	}

	public int termCount() {
		return termCount;
	}

	public int nodeCount() {
		return nodes.size() - freeSlots.size();
	}

	public boolean isEmpty() {
		return termCount == 0;
	}

	/**
	 * Verify the structural invariants: sibling edges share no prefix, non-empty labels, terminal nodes carry
	 * documents, and no node below the root is a non-terminal leaf.
	 */
	boolean isCompact() {
		return isCompact(ROOT);
	}

	private boolean isCompact(int index) {
		Node node = nodes.get(index);
		if (node.terminal == node.documents.isEmpty()) {
			return false;
		}
		if (index != ROOT && !node.terminal && node.edges.isEmpty()) {
			return false;
		}

		for (Map.Entry<Character, Edge> entry : node.edges.entrySet()) {
			Edge edge = entry.getValue();
			if (edge.label().isEmpty() || edge.label().charAt(0) != entry.getKey()) {
				return false;
			}
			if (!isCompact(edge.child())) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Prune dead leaves and fold non-terminal single-child nodes into their parent edge, walking up from the
	 * end of {@code path}.
	 */
	private void compact(List<Integer> path) {
		for (int i = path.size() - 1; i > 0; i--) {
			int index = path.get(i);
			Node node = nodes.get(index);
			if (node.terminal) {
				return;
			}

			Node parent = nodes.get(path.get(i - 1));
			Edge incoming = incomingEdge(parent, index);

			if (node.edges.isEmpty()) {
				parent.edges.remove(incoming.label().charAt(0));
				release(index);
				continue;
			}

			if (node.edges.size() == 1) {
				Edge only = node.edges.values().iterator().next();
				parent.edges.put(incoming.label().charAt(0), new Edge(incoming.label() + only.label(), only.child()));
				release(index);
			}
			return;
		}
	}

	private Edge incomingEdge(Node parent, int child) {
		for (Edge edge : parent.edges.values()) {
			if (edge.child() == child) {
				return edge;
			}
		}
		throw new IllegalStateException("Node " + child + " is not linked from its recorded parent");
	}

	private int locate(String term) {
		if (term == null || term.isEmpty()) {
			return -1;
		}

		int node = ROOT;
		String remaining = term;
		while (!remaining.isEmpty()) {
			Edge edge = nodes.get(node).edges.get(remaining.charAt(0));
			if (edge == null || !remaining.startsWith(edge.label())) {
				return -1;
			}
			node = edge.child();
			remaining = remaining.substring(edge.label().length());
		}
		return node;
	}

	/**
	 * Walk {@code prefix}, allowing it to end inside an edge. Returns the node below the last edge touched
	 * together with the full path spelled to reach it.
	 */
	private Cursor descend(String prefix) {
		int node = ROOT;
		StringBuilder path = new StringBuilder();
		String remaining = prefix;

		while (!remaining.isEmpty()) {
			Edge edge = nodes.get(node).edges.get(remaining.charAt(0));
			if (edge == null) {
				return null;
			}
			if (edge.label().startsWith(remaining)) {
				path.append(edge.label());
				return new Cursor(edge.child(), path.toString());
			}
			if (!remaining.startsWith(edge.label())) {
				return null;
			}
			path.append(edge.label());
			node = edge.child();
			remaining = remaining.substring(edge.label().length());
		}
		return new Cursor(node, path.toString());
	}

	private void collect(int index, StringBuilder path, List<String> out, int limit) {
		Node node = nodes.get(index);
		if (node.terminal) {
			out.add(path.toString());
		}

		for (Edge edge : node.edges.values()) {
			if (out.size() >= limit) {
				return;
			}
			int mark = path.length();
			path.append(edge.label());
			collect(edge.child(), path, out, limit);
			path.setLength(mark);
		}
	}

	private int allocate() {
		Integer slot = freeSlots.poll();
		if (slot != null) {
			nodes.set(slot, new Node());
			return slot;
		}
		nodes.add(new Node());
		return nodes.size() - 1;
	}

	private void release(int index) {
		nodes.set(index, null);
		freeSlots.push(index);
	}

	private static int commonPrefixLength(String a, String b) {
		int limit = Math.min(a.length(), b.length());
		int i = 0;
		while (i < limit && a.charAt(i) == b.charAt(i)) {
			i++;
		}
		return i;
	}

	private static void requireTerm(String term) {
		if (term == null || term.isEmpty()) {
			throw new IllegalArgumentException("term must be non-empty");
		}
	}

	private static final class Node {
		final Map<Character, Edge> edges = new TreeMap<>();
		final Set<String> documents = new HashSet<>();
		boolean terminal;
	}

	private record Edge(String label, int child) {}

	private record Cursor(int node, String path) {}
}
