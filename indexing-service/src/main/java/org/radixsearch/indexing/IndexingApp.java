package org.radixsearch.indexing;

import org.radixsearch.indexing.bootstrap.IndexingBootstrap;

import java.util.ArrayList;
import java.util.List;

public class IndexingApp {
	private static final String REBUILD_ONLY = "--rebuild-only";

	public static void main(String[] args) {
		List<String> overrides = new ArrayList<>();
		boolean rebuildOnly = false;

		for (String arg : args) {
			if (arg.equals("-h") || arg.equals("--help")) {
				printUsage();
				return;
			} else if (arg.equals(REBUILD_ONLY)) {
				rebuildOnly = true;
			} else {
				overrides.add(arg);
			}
		}

		IndexingBootstrap.run(overrides.toArray(new String[0]), rebuildOnly);
	}

	/**
	 * Print usage information
	 */
	private static void printUsage() {
		System.out.println("\n=== Indexing Service Usage ===\n");
		System.out.println("Usage: java -jar indexing-service-1.0.0.jar [options]\n");
		System.out.println("Options:");
		System.out.println("  --server.port <port>          Server port (default: 7002)");
		System.out.println("  --corpus.path <path>          Corpus root (default: ../corpus)");
		System.out.println("  --corpus.categories <csv>     Category folders to index");
		System.out.println("                                (default: business,entertainment,politics,sport,tech)");
		System.out.println("  --index.path <path>           Index file (default: ../datamart/index.txt)");
		System.out.println("  --rebuild-only                Build and save the index, then exit");
		System.out.println("  -h, --help                    Show this help message\n");
		System.out.println("Examples:");
		System.out.println("  # Build the index once and exit");
		System.out.println("  java -jar indexing-service-1.0.0.jar --rebuild-only --corpus.path ./bbc\n");
		System.out.println("  # Serve rebuild/status endpoints on a custom port");
		System.out.println("  java -jar indexing-service-1.0.0.jar --server.port 8002\n");
	}
}
