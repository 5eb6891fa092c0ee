package br.edu.ifba.scholargraph.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;

import org.sqlite.Function;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * SQL function {@code metadata_merge(stored, incoming)} used inside
 * {@code ON CONFLICT ... DO UPDATE} clauses, so the metadata merge happens in
 * the same statement as the conflict resolution.
 */
final class MetadataMergeFunction extends Function {

    static final String NAME = "metadata_merge";

    static void register(Connection conn) throws SQLException {
        Function.create(conn, NAME, new MetadataMergeFunction());
    }

    @Override
    protected void xFunc() throws SQLException {
        if (args() != 2) {
            throw new SQLException(NAME + " expects 2 arguments, got " + args());
        }
        try {
            result(SQLiteJson.mergeMetadata(value_text(0), value_text(1)));
        } catch (JsonProcessingException e) {
            throw new SQLException("Invalid metadata JSON passed to " + NAME, e);
        }
    }
}
