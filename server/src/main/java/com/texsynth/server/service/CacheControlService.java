package com.texsynth.server.service;

import com.texsynth.db.SqliteInitializer;
import com.texsynth.db.SynthesisResultDao;
import com.texsynth.server.synthesis.CachedTextureSynthesizer;
import com.texsynth.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;

@Service
public class CacheControlService {

    private static final Logger logger = LoggerFactory.getLogger(CacheControlService.class);

    private final String dbPath;
    private final SynthesisResultDao resultDao;

    public CacheControlService() {
        this(DataPathResolver.resolveDbPath());
    }

    public CacheControlService(String dbPath) {
        this.dbPath = dbPath;
        this.resultDao = new SynthesisResultDao(dbPath);
    }

    /**
     * Clears all cached results produced by a specific engine version.
     * Use this when the synthesis algorithm changes.
     */
    public int clearEngineVersion(String engineVersion) {
        try {
            SqliteInitializer.initialize(dbPath);
            int removed = resultDao.deleteByEngineVersion(engineVersion);
            logger.info("Cleared {} cached results for engine {}", removed, engineVersion);
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear result cache for engine " + engineVersion, e);
        }
    }

    public int clearCurrentEngine() {
        return clearEngineVersion(CachedTextureSynthesizer.ENGINE_VERSION);
    }
}
