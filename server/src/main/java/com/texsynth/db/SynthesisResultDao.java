package com.texsynth.db;

import com.texsynth.server.synthesis.SynthesisResult;
import com.texsynth.util.PixelBufferCodec;

import java.sql.*;
import java.util.Optional;

public class SynthesisResultDao {

    private final String dbPath;

    public SynthesisResultDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<SynthesisResult> loadResult(long sampleId, String paramsKey, String engineVersion)
            throws SQLException {
        String sql = "SELECT output_blob, window_size, passes, threshold_relaxations, final_max_error_threshold, " +
                "match_attempts FROM synthesis_result " +
                "WHERE sample_id = ? AND params_key = ? AND engine_version = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, sampleId);
            ps.setString(2, paramsKey);
            ps.setString(3, engineVersion);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new SynthesisResult(
                            PixelBufferCodec.fromBytes(rs.getBytes("output_blob")),
                            rs.getInt("window_size"),
                            rs.getInt("passes"),
                            rs.getInt("threshold_relaxations"),
                            rs.getDouble("final_max_error_threshold"),
                            rs.getLong("match_attempts"),
                            true));
                }
            }
        }
        return Optional.empty();
    }

    public void upsertResult(long sampleId, String paramsKey, String engineVersion, SynthesisResult result)
            throws SQLException {
        byte[] blob = PixelBufferCodec.toBytes(result.getOutput());
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO synthesis_result (sample_id, params_key, engine_version, output_blob, window_size, " +
                "passes, threshold_relaxations, final_max_error_threshold, match_attempts, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(sample_id, params_key, engine_version) DO UPDATE SET " +
                "output_blob = excluded.output_blob, window_size = excluded.window_size, " +
                "passes = excluded.passes, threshold_relaxations = excluded.threshold_relaxations, " +
                "final_max_error_threshold = excluded.final_max_error_threshold, " +
                "match_attempts = excluded.match_attempts, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, sampleId);
            ps.setString(2, paramsKey);
            ps.setString(3, engineVersion);
            ps.setBytes(4, blob);
            ps.setInt(5, result.getWindowSize());
            ps.setInt(6, result.getPasses());
            ps.setInt(7, result.getThresholdRelaxations());
            ps.setDouble(8, result.getFinalMaxErrorThreshold());
            ps.setLong(9, result.getMatchAttempts());
            ps.setLong(10, now);
            ps.executeUpdate();
        }
    }

    public int deleteByEngineVersion(String engineVersion) throws SQLException {
        String sql = "DELETE FROM synthesis_result WHERE engine_version = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, engineVersion);
            return ps.executeUpdate();
        }
    }

    public int deleteBySample(long sampleId) throws SQLException {
        String sql = "DELETE FROM synthesis_result WHERE sample_id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, sampleId);
            return ps.executeUpdate();
        }
    }
}
