package br.edu.ifba.scholargraph.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import br.edu.ifba.exception.PersistenceException;
import br.edu.ifba.scholargraph.storage.EdgeStorage;
import br.edu.ifba.scholargraph.storage.ExtractionLogStorage;
import br.edu.ifba.scholargraph.storage.NodeStorage;
import br.edu.ifba.scholargraph.storage.PaperStorage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer for the SQLite-backed stores.
 *
 * <p>Opens the database, applies pending schema migrations and exposes the
 * store interfaces for injection.</p>
 *
 * <pre>
 * scholargraph.storage.sqlite.path=data/scholargraph.db
 * scholargraph.storage.sqlite.busy-timeout=30000
 * </pre>
 */
@ApplicationScoped
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @ConfigProperty(name = "scholargraph.storage.sqlite.path", defaultValue = "data/scholargraph.db")
    String databasePath;

    @ConfigProperty(name = "scholargraph.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "scholargraph.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "scholargraph.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    private SQLiteConnectionManager connectionManager;
    private SQLiteNodeStorage nodeStorage;
    private SQLiteEdgeStorage edgeStorage;
    private SQLitePaperStorage paperStorage;
    private SQLiteExtractionLogStorage extractionLogStorage;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing SQLite storage with database: %s", databasePath);

        connectionManager = new SQLiteConnectionManager(
            databasePath, Duration.ofMillis(busyTimeoutMs), walMode, readPoolSize);

        try (Connection conn = connectionManager.createConnection()) {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to run SQLite schema migrations", e);
        }

        nodeStorage = new SQLiteNodeStorage(connectionManager);
        edgeStorage = new SQLiteEdgeStorage(connectionManager);
        paperStorage = new SQLitePaperStorage(connectionManager, nodeStorage);
        extractionLogStorage = new SQLiteExtractionLogStorage(connectionManager);

        LOG.info("SQLite storage initialized successfully");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite storage");
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    public NodeStorage produceNodeStorage() {
        return nodeStorage;
    }

    @Produces
    @ApplicationScoped
    public EdgeStorage produceEdgeStorage() {
        return edgeStorage;
    }

    @Produces
    @ApplicationScoped
    public PaperStorage producePaperStorage() {
        return paperStorage;
    }

    @Produces
    @ApplicationScoped
    public ExtractionLogStorage produceExtractionLogStorage() {
        return extractionLogStorage;
    }
}
