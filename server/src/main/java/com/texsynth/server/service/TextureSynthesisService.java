package com.texsynth.server.service;

import com.texsynth.db.SampleImageDao;
import com.texsynth.db.SqliteInitializer;
import com.texsynth.db.SynthesisResultDao;
import com.texsynth.server.config.SynthesisConfig;
import com.texsynth.server.synthesis.CachedTextureSynthesizer;
import com.texsynth.server.synthesis.PassLoggingListener;
import com.texsynth.server.synthesis.PixelBuffer;
import com.texsynth.server.synthesis.SynthesisProgressListener;
import com.texsynth.server.synthesis.SynthesisResult;
import com.texsynth.server.synthesis.TextureSynthesizer;
import com.texsynth.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.Random;

@Service
public class TextureSynthesisService {

    private static final Logger logger = LoggerFactory.getLogger(TextureSynthesisService.class);

    private final SynthesisConfig.ConfigRoot config;
    private final TextureSynthesizer synthesizer;
    // null when the result cache is disabled
    private final CachedTextureSynthesizer cachedSynthesizer;

    public TextureSynthesisService() {
        this(SynthesisConfig.load());
    }

    public TextureSynthesisService(SynthesisConfig.ConfigRoot config) {
        this(config, DataPathResolver.resolveDbPath(config));
    }

    public TextureSynthesisService(SynthesisConfig.ConfigRoot config, String dbPath) {
        this.config = config;
        this.synthesizer = new TextureSynthesizer(config.parametersOrDefault());

        if (config.cacheEnabled()) {
            try {
                SqliteInitializer.initialize(dbPath);
                logger.info("Initialized SQLite result cache at {}", dbPath);
            } catch (SQLException e) {
                logger.error("Failed to initialize SQLite", e);
                throw new RuntimeException(e);
            }
            this.cachedSynthesizer = new CachedTextureSynthesizer(synthesizer, new SampleImageDao(dbPath),
                    new SynthesisResultDao(dbPath));
        } else {
            this.cachedSynthesizer = null;
        }
    }

    /**
     * @param windowSize null for the configured default
     * @param rngSeed null for a non-reproducible run; seeded runs are served from the cache when enabled
     */
    public SynthesisResult synthesize(PixelBuffer sample, int outputRows, int outputCols, Integer windowSize,
            Long rngSeed) {
        int window = windowSize != null ? windowSize : config.windowSizeOrDefault();
        SynthesisProgressListener listener = config.logEveryNPassesOrDefault() > 0
                ? new PassLoggingListener(config.logEveryNPassesOrDefault())
                : null;

        if (rngSeed == null) {
            return synthesizer.synthesize(sample, outputRows, outputCols, window, new Random(), listener);
        }
        if (cachedSynthesizer != null) {
            return cachedSynthesizer.synthesize(sample, outputRows, outputCols, window, rngSeed, listener);
        }
        return synthesizer.synthesize(sample, outputRows, outputCols, window, new Random(rngSeed), listener);
    }

    public int getDefaultWindowSize() {
        return config.windowSizeOrDefault();
    }

    public boolean isCacheEnabled() {
        return cachedSynthesizer != null;
    }
}
