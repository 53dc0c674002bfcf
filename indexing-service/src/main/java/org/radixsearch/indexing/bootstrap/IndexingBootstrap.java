package org.radixsearch.indexing.bootstrap;

import org.radixsearch.indexing.config.IndexingConfig;
import org.radixsearch.indexing.controller.IndexingController;
import org.radixsearch.indexing.service.IndexingService;
import org.radixsearch.indexing.web.IndexingHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Application bootstrapper for the Indexing Service.
 *
 * <p>Loads configuration, makes sure an index exists on disk, then either exits (rebuild-only mode) or starts
 * the HTTP API and registers a JVM shutdown hook.</p>
 */
public final class IndexingBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexingBootstrap.class);

    private IndexingBootstrap() {}

    /**
     * Starts the Indexing Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     *
     * @param args {@code --key value} configuration overrides
     * @param rebuildOnly build and save the index, then return without serving HTTP
     */
    public static void run(String[] args, boolean rebuildOnly) {
        try {
            start(args, rebuildOnly);
        } catch (Exception e) {
            logger.error("Failed to start Indexing Service", e);
            System.exit(1);
        }
    }

    private static void start(String[] args, boolean rebuildOnly) throws IOException {
        IndexingConfig cfg = IndexingConfig.load(args);
        logConfiguration(cfg);

        IndexingService service = buildService(cfg);
        if (rebuildOnly) {
            int documents = service.rebuildIndex();
            logger.info("Rebuild-only mode finished: {} documents indexed", documents);
            return;
        }

        runStartupConsistencyCheck(service);
        Javalin app = IndexingHttpServer.start(cfg.serverPort(), new IndexingController(service));
        addShutdownHook(app);
        logger.info("Indexing Service started on port {}", cfg.serverPort());
    }

    private static void logConfiguration(IndexingConfig cfg) {
        logger.info("Starting Indexing Service...");
        logger.info("Configuration:");
        logger.info("  Port: {}", cfg.serverPort());
        logger.info("  Corpus Path: {}", cfg.corpus().path());
        logger.info("  Categories: {}", cfg.corpus().categories());
        logger.info("  Index Path: {}", cfg.index().path());
    }

    private static IndexingService buildService(IndexingConfig cfg) {
        return new IndexingService(
            Path.of(cfg.corpus().path()),
            cfg.corpus().categories(),
            Path.of(cfg.index().path())
        );
    }

    private static void runStartupConsistencyCheck(IndexingService service) throws IOException {
        if (service.loadExisting() && !service.isIndexEmpty()) {
            logger.info("  Loaded existing index: {} documents", service.getStats().documentsIndexed());
            return;
        }

        logger.warn("No existing index found. Entering re-indexing mode...");
        int rebuilt = service.rebuildIndex();
        logger.info("Re-indexing mode complete. Indexed {} documents.", rebuilt);
    }

    private static void addShutdownHook(Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Indexing Service...");
        app.stop();
        logger.info("Indexing Service stopped.");
    }
}
