package org.radixsearch.search.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables and finally {@code --key value}
 * command-line arguments. Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int maxResults,
    int defaultLimit,
    int snippetWindow,
    Corpus corpus,
    Index index
) {
    /** Corpus root and the category folders scanned beneath it. */
    public record Corpus(String path, List<String> categories) {}

    /** Location of the persisted index file. */
    public record Index(String path) {}

    /**
     * Loads configuration from classpath properties, environment variables and arguments.
     *
     * @param args command-line arguments in {@code --key value} form
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load(String[] args) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        overlayArguments(properties, args);
        return from(properties);
    }

    public static SearchConfig from(Properties p) {
        return new SearchConfig(
            requireInt(p, "server.port"),
            requireInt(p, "search.max.results"),
            requireInt(p, "search.default.limit"),
            requireInt(p, "search.snippet.window"),
            new Corpus(requireString(p, "corpus.path"), splitCsv(requireString(p, "corpus.categories"))),
            new Index(requireString(p, "index.path"))
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    static void overlayArguments(Properties properties, String[] args) {
        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--") && i + 1 < args.length) {
                properties.setProperty(args[i].substring(2), args[i + 1]);
                i++;
            }
        }
    }

    private static List<String> splitCsv(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
