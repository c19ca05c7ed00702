package com.tcrimer.db;

import com.tcrimer.db.pool.BackendInitializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SchemaMigratorTest {

    @TempDir
    Path tempDir;

    @Test
    void migrateShouldBeIdempotentAndRecordVersion() throws SQLException {
        BackendInitializer migrator = new SchemaMigrator();
        SqliteBackend backend = new SqliteBackend(tempDir.resolve("schema.db"), BackendKind.FALLBACK, false);

        try (Connection conn = backend.connect()) {
            migrator.initialize(BackendKind.FALLBACK, conn);
            migrator.initialize(BackendKind.FALLBACK, conn);

            assertEquals(SchemaMigrator.SCHEMA_VERSION, SchemaMigrator.readSchemaVersion(conn));
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM metadata WHERE meta_key='schema_version'")) {
                rs.next();
                assertEquals(1, rs.getInt(1));
            }
        }
    }

    @Test
    void allTablesShouldExistAfterMigration() throws SQLException {
        SqliteBackend backend = new SqliteBackend(tempDir.resolve("tables.db"), BackendKind.PRIMARY, false);

        try (Connection conn = backend.connect()) {
            new SchemaMigrator().initialize(BackendKind.PRIMARY, conn);
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT name FROM sqlite_master WHERE type='table' ORDER BY name")) {
                StringBuilder names = new StringBuilder();
                while (rs.next()) {
                    names.append(rs.getString(1)).append(' ');
                }
                assertEquals("backtest_results metadata ohlcv_bars ", names.toString());
            }
        }
    }
}
