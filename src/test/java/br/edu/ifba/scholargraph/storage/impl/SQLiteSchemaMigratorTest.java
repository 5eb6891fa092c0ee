package br.edu.ifba.scholargraph.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for SQLiteSchemaMigrator.
 */
class SQLiteSchemaMigratorTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteSchemaMigrator migrator;

    @BeforeEach
    void setUp() {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("schema.db").toString());
        migrator = new SQLiteSchemaMigrator();
    }

    @AfterEach
    void tearDown() {
        connectionManager.close();
    }

    @Test
    void testEmptyDatabaseHasVersionZero() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            assertEquals(0, migrator.getCurrentVersion(conn));
        }
    }

    @Test
    void testMigrateCreatesTables() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            migrator.migrateToLatest(conn);

            int latest = migrator.getMigrations().get(migrator.getMigrations().size() - 1).version();
            assertEquals(latest, migrator.getCurrentVersion(conn));
            for (String table : List.of("nodes", "edges", "papers", "extraction_records")) {
                assertTrue(tableExists(conn, table), "Missing table " + table);
            }
        }
    }

    @Test
    void testMigrateIsIdempotent() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            migrator.migrateToLatest(conn);
            migrator.migrateToLatest(conn);

            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM schema_version")) {
                rs.next();
                assertEquals(migrator.getMigrations().size(), rs.getInt(1));
            }
        }
    }

    @Test
    void testSplitStatementsIgnoresCommentsAndQuotedSemicolons() {
        String script = """
            -- header comment; not a statement
            CREATE TABLE a (x TEXT DEFAULT 'a;b');

            INSERT INTO a VALUES ('c');
            """;

        List<String> statements = SQLiteSchemaMigrator.splitStatements(script);

        assertEquals(2, statements.size());
        assertEquals("CREATE TABLE a (x TEXT DEFAULT 'a;b')", statements.get(0));
        assertEquals("INSERT INTO a VALUES ('c')", statements.get(1));
    }

    private static boolean tableExists(Connection conn, String table) throws Exception {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = '" + table + "'")) {
            return rs.next();
        }
    }
}
