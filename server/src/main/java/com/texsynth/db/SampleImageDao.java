package com.texsynth.db;

import java.sql.*;
import java.util.Optional;

public class SampleImageDao {

    private final String dbPath;

    public SampleImageDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public SampleImage getOrCreateByHash(String sampleHash, int rows, int cols, int channels) throws SQLException {
        try (Connection conn = connect()) {
            Optional<SampleImage> existing = findByHashInternal(conn, sampleHash);
            if (existing.isPresent()) {
                return existing.get();
            }

            long now = System.currentTimeMillis();
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO sample_image (sample_hash, sample_rows, sample_cols, sample_channels, created_ts) " +
                            "VALUES (?, ?, ?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, sampleHash);
                ps.setInt(2, rows);
                ps.setInt(3, cols);
                ps.setInt(4, channels);
                ps.setLong(5, now);
                ps.executeUpdate();

                try (ResultSet rs = ps.getGeneratedKeys()) {
                    if (rs.next()) {
                        return new SampleImage(rs.getLong(1), sampleHash, rows, cols, channels, now);
                    } else {
                        throw new SQLException("Creating sample_image failed, no ID obtained.");
                    }
                }
            } catch (SQLException e) {
                // Another request may have inserted the same sample in between
                if (e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed")) {
                    return findByHashInternal(conn, sampleHash)
                            .orElseThrow(() -> new SQLException(
                                    "Failed to find sample after UNIQUE constraint violation", e));
                }
                throw e;
            }
        }
    }

    public Optional<SampleImage> findByHash(String sampleHash) throws SQLException {
        try (Connection conn = connect()) {
            return findByHashInternal(conn, sampleHash);
        }
    }

    private Optional<SampleImage> findByHashInternal(Connection conn, String sampleHash) throws SQLException {
        String sql = "SELECT id, sample_hash, sample_rows, sample_cols, sample_channels, created_ts " +
                "FROM sample_image WHERE sample_hash = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sampleHash);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new SampleImage(
                            rs.getLong("id"),
                            rs.getString("sample_hash"),
                            rs.getInt("sample_rows"),
                            rs.getInt("sample_cols"),
                            rs.getInt("sample_channels"),
                            rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }
}
