package br.edu.ifba.scholargraph.storage.impl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import br.edu.ifba.exception.PersistenceException;

/**
 * Hands out SQLite connections for the graph store.
 *
 * <p>Reads come from a small pool. Writes go through a single connection guarded
 * by a lock, so callers must release it in a {@code finally} block:</p>
 * <pre>
 * Connection conn = manager.getWriteConnection();
 * try {
 *     // upsert
 * } finally {
 *     manager.releaseWriteConnection(conn);
 * }
 * </pre>
 *
 * <p>Every connection enforces foreign keys (edge cascades depend on it) and has
 * the {@code metadata_merge} SQL function registered.</p>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int CACHE_SIZE_KB = -2000;

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock = new ReentrantLock();

    private Connection writeConnection;
    private volatile boolean closed = false;

    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, true, DEFAULT_POOL_SIZE);
    }

    /**
     * @param databasePath path of the database file
     * @param busyTimeout how long SQLite waits on a locked database
     * @param walMode whether to switch the journal to WAL
     * @param readPoolSize idle read connections kept around
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        if (databasePath == null || databasePath.isBlank()) {
            throw new IllegalArgumentException("databasePath cannot be blank");
        }
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(Math.max(1, readPoolSize));
    }

    /**
     * Opens a new, unpooled connection. The caller owns and closes it.
     */
    public Connection createConnection() {
        ensureOpen();
        createParentDirectory();

        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setCacheSize(CACHE_SIZE_KB);

            // Bypasses DriverManager, whose registry is class-loader scoped
            Connection conn = config.createConnection("jdbc:sqlite:" + databasePath);
            applyPragmas(conn);
            MetadataMergeFunction.register(conn);

            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to create SQLite connection to " + databasePath, e);
        }
    }

    public Connection getReadConnection() {
        ensureOpen();

        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Pooled read connection is unusable, opening a new one", e);
            }
        }
        return createConnection();
    }

    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (closed || conn.isClosed() || !readPool.offer(conn)) {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Acquires the exclusive write connection. Blocks while another writer holds it.
     */
    public Connection getWriteConnection() {
        ensureOpen();

        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new PersistenceException("Failed to get write connection", e);
        }
    }

    public void releaseWriteConnection(Connection conn) {
        if (conn != null && conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    private void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    private void createParentDirectory() {
        if (databasePath.startsWith(":memory:")) {
            return;
        }
        try {
            Path parentDir = Paths.get(databasePath).toAbsolutePath().getParent();
            if (parentDir != null && !Files.exists(parentDir)) {
                Files.createDirectories(parentDir);
                LOG.infof("Created database directory: %s", parentDir);
            }
        } catch (Exception e) {
            LOG.warnf("Could not create parent directory for %s: %s", databasePath, e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public boolean isWalModeEnabled() {
        return walMode;
    }

    @Override
    public void close() {
        closed = true;

        writeLock.lock();
        try {
            if (writeConnection != null) {
                writeConnection.close();
                writeConnection = null;
            }
        } catch (SQLException e) {
            LOG.debug("Error closing write connection", e);
        } finally {
            writeLock.unlock();
        }

        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }

        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }
}
