package br.edu.ifba.scholargraph.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.exception.PersistenceException;
import br.edu.ifba.scholargraph.core.ExtractionRecord;
import br.edu.ifba.scholargraph.core.ExtractionStage;
import br.edu.ifba.scholargraph.storage.ExtractionLogStorage;

/**
 * SQLite implementation of {@link ExtractionLogStorage}. Rows are only ever inserted.
 */
public final class SQLiteExtractionLogStorage implements ExtractionLogStorage {

    private final SQLiteConnectionManager connectionManager;

    public SQLiteExtractionLogStorage(@NotNull SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Void> append(@NotNull ExtractionRecord record) {
        return CompletableFuture.runAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO extraction_records (paper_id, stage, input, output, success, error, duration_ms, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                ps.setString(1, record.paperId());
                ps.setString(2, record.stage().value());
                ps.setString(3, record.input());
                ps.setString(4, record.output());
                ps.setInt(5, record.success() ? 1 : 0);
                ps.setString(6, record.error());
                ps.setLong(7, record.durationMs());
                ps.setString(8, SQLiteJson.timestamp(record.timestamp()));
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new PersistenceException("Failed to append extraction record for paper " + record.paperId(), e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<ExtractionRecord>> findByPaper(@NotNull String paperId) {
        return CompletableFuture.supplyAsync(() -> {
            List<ExtractionRecord> records = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement("""
                    SELECT paper_id, stage, input, output, success, error, duration_ms, created_at
                    FROM extraction_records WHERE paper_id = ? ORDER BY id
                    """)) {
                ps.setString(1, paperId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        records.add(new ExtractionRecord(
                            rs.getString("paper_id"),
                            ExtractionStage.fromValue(rs.getString("stage")),
                            rs.getString("input"),
                            rs.getString("output"),
                            rs.getInt("success") == 1,
                            rs.getString("error"),
                            rs.getLong("duration_ms"),
                            SQLiteJson.parseTimestamp(rs.getString("created_at"))
                        ));
                    }
                }
                return records;
            } catch (SQLException e) {
                throw new PersistenceException("Failed to list extraction records for paper " + paperId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }
}
