package org.radixsearch.search.bootstrap;

import org.radixsearch.search.config.SearchConfig;
import org.radixsearch.search.controller.SearchController;
import org.radixsearch.search.service.SearchContext;
import org.radixsearch.search.service.SearchService;
import org.radixsearch.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, makes the index available, starts the HTTP API and registers a JVM shutdown hook.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(String[] args) {
        try {
            start(args);
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start(String[] args) throws IOException {
        SearchConfig cfg = SearchConfig.load(args);
        logConfiguration(cfg);

        SearchContext context = buildContext(cfg);
        context.ensureLoaded();

        Javalin app = startHttp(cfg, context);
        addShutdownHook(app);
        logger.info("Search Service started on port {}", cfg.serverPort());
    }

    private static void logConfiguration(SearchConfig cfg) {
        logger.info("Starting Search Service...");
        logger.info("Configuration:");
        logger.info("  Port: {}", cfg.serverPort());
        logger.info("  Corpus Path: {}", cfg.corpus().path());
        logger.info("  Categories: {}", cfg.corpus().categories());
        logger.info("  Index Path: {}", cfg.index().path());
        logger.info("  Max Results: {}, Default Limit: {}", cfg.maxResults(), cfg.defaultLimit());
    }

    private static SearchContext buildContext(SearchConfig cfg) {
        return new SearchContext(
            Path.of(cfg.index().path()),
            Path.of(cfg.corpus().path()),
            cfg.corpus().categories(),
            cfg.snippetWindow()
        );
    }

    private static Javalin startHttp(SearchConfig cfg, SearchContext context) {
        SearchService service = new SearchService(context, cfg.maxResults());
        SearchController controller = new SearchController(service, cfg.defaultLimit());
        return SearchHttpServer.start(cfg.serverPort(), controller);
    }

    private static void addShutdownHook(Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        logger.info("Search Service stopped.");
    }
}
