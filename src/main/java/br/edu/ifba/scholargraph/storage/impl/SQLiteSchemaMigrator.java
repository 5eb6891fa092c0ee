package br.edu.ifba.scholargraph.storage.impl;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

/**
 * Applies the embedded schema migrations.
 *
 * <p>Migrations are SQL scripts on the classpath under {@code /db/migrations/},
 * named {@code V{version}__{description}.sql}. Applied versions are recorded in
 * {@code schema_version}; all pending migrations run in one transaction.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private static final List<Migration> MIGRATIONS = List.of(
        new Migration(1, "Knowledge graph schema", MIGRATION_PATH + "V001__initial_schema.sql")
    );

    /**
     * @return highest applied version, 0 for an empty database
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type = 'table' AND name = 'schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COALESCE(MAX(version), 0) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Applies every migration newer than the current version.
     *
     * @throws SQLException if a migration fails; nothing is applied in that case
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            ensureVersionTable(conn);
            int currentVersion = getCurrentVersion(conn);
            LOG.infof("Current schema version: %d", currentVersion);

            for (Migration migration : MIGRATIONS) {
                if (migration.version() <= currentVersion) {
                    continue;
                }
                LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                try (Statement stmt = conn.createStatement()) {
                    for (String sql : splitStatements(migration.load())) {
                        stmt.execute(sql);
                    }
                }
                recordVersion(conn, migration);
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    public List<Migration> getMigrations() {
        return MIGRATIONS;
    }

    private void ensureVersionTable(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    description TEXT NOT NULL,
                    applied_at TEXT NOT NULL DEFAULT (datetime('now'))
                )
                """);
        }
    }

    private void recordVersion(Connection conn, Migration migration) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
            ps.setInt(1, migration.version());
            ps.setString(2, migration.description());
            ps.executeUpdate();
        }
    }

    /**
     * Splits a script on semicolons outside of quoted literals and drops
     * {@code --} comment lines.
     */
    static List<String> splitStatements(String script) {
        StringBuilder withoutComments = new StringBuilder();
        for (String line : script.split("\n")) {
            if (!line.trim().startsWith("--")) {
                withoutComments.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (char c : withoutComments.toString().toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == ';') {
                addIfPresent(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfPresent(statements, current);
        return statements;
    }

    private static void addIfPresent(List<String> statements, StringBuilder sql) {
        String trimmed = sql.toString().trim();
        if (!trimmed.isEmpty()) {
            statements.add(trimmed);
        }
    }

    /**
     * A versioned script on the classpath.
     */
    public record Migration(int version, String description, String resourcePath) {

        String load() {
            try (InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath)) {
                if (is == null) {
                    throw new IllegalStateException("Migration resource not found: " + resourcePath);
                }
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }
    }
}
