package com.texsynth.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS sample_image (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "sample_hash TEXT NOT NULL UNIQUE, " +
                        "sample_rows INTEGER NOT NULL, " +
                        "sample_cols INTEGER NOT NULL, " +
                        "sample_channels INTEGER NOT NULL, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                // One row per (sample, parameter key, engine version); params_key covers output size,
                // window, rng seed and every tuning parameter
                stmt.execute("CREATE TABLE IF NOT EXISTS synthesis_result (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "sample_id INTEGER NOT NULL, " +
                        "params_key TEXT NOT NULL, " +
                        "engine_version TEXT NOT NULL, " +
                        "output_blob BLOB NOT NULL, " +
                        "window_size INTEGER NOT NULL, " +
                        "passes INTEGER NOT NULL, " +
                        "threshold_relaxations INTEGER NOT NULL, " +
                        "final_max_error_threshold REAL NOT NULL, " +
                        "match_attempts INTEGER NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (sample_id, params_key, engine_version), " +
                        "FOREIGN KEY (sample_id) REFERENCES sample_image(id) ON DELETE CASCADE" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_result_lookup " +
                        "ON synthesis_result (engine_version, params_key, sample_id);");
            }
        }
    }
}
