package org.radixsearch.search;

import org.radixsearch.search.bootstrap.SearchBootstrap;

public class SearchApp {

    public static void main(String[] args) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                printUsage();
                return;
            }
        }
        SearchBootstrap.run(args);
    }

    /**
     * Print usage information
     */
    private static void printUsage() {
        System.out.println("\n=== Search Service Usage ===\n");
        System.out.println("Usage: java -jar search-service-1.0.0.jar [options]\n");
        System.out.println("Options:");
        System.out.println("  --server.port <port>          Server port (default: 7003)");
        System.out.println("  --corpus.path <path>          Corpus root (default: ../corpus)");
        System.out.println("  --corpus.categories <csv>     Category folders to index");
        System.out.println("  --index.path <path>           Index file (default: ../datamart/index.txt)");
        System.out.println("  --search.snippet.window <n>   Characters shown around a match (default: 80)");
        System.out.println("  -h, --help                    Show this help message\n");
        System.out.println("If the index file is missing, it is built from the corpus on startup.");
    }
}
