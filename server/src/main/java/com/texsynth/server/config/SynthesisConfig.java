package com.texsynth.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.texsynth.server.synthesis.SynthesisParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * Settings read from synthesis_config.json on the classpath.
 */
public class SynthesisConfig {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisConfig.class);

    public static final String CONFIG_RESOURCE = "/synthesis_config.json";
    public static final int DEFAULT_WINDOW_SIZE = 11;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        public Boolean enabled;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProgressConfig {
        // 0 disables per-pass progress logging
        public Integer logEveryNPasses;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConfigRoot {
        public String texsynth_data_directory;
        public Integer defaultWindowSize;
        public SynthesisParameters synthesis;
        public CacheConfig cache;
        public ProgressConfig progress;

        public int windowSizeOrDefault() {
            return defaultWindowSize != null ? defaultWindowSize : DEFAULT_WINDOW_SIZE;
        }

        public SynthesisParameters parametersOrDefault() {
            return synthesis != null ? synthesis.copy() : SynthesisParameters.defaults();
        }

        public boolean cacheEnabled() {
            return cache != null && Boolean.TRUE.equals(cache.enabled);
        }

        public int logEveryNPassesOrDefault() {
            return progress != null && progress.logEveryNPasses != null ? progress.logEveryNPasses : 0;
        }
    }

    public static ConfigRoot defaults() {
        ConfigRoot root = new ConfigRoot();
        root.defaultWindowSize = DEFAULT_WINDOW_SIZE;
        root.synthesis = SynthesisParameters.defaults();
        root.cache = new CacheConfig();
        root.cache.enabled = false;
        root.progress = new ProgressConfig();
        root.progress.logEveryNPasses = 0;
        return root;
    }

    public static ConfigRoot parse(InputStream jsonStream) {
        try {
            ObjectMapper mapper = new ObjectMapper();
            ConfigRoot root = mapper.readValue(jsonStream, ConfigRoot.class);
            if (root.synthesis != null) {
                root.synthesis.validate();
            }
            return root;
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse synthesis config", e);
        }
    }

    /**
     * Loads the classpath config, or built-in defaults if it is missing or invalid.
     */
    public static ConfigRoot load() {
        try (InputStream is = SynthesisConfig.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using defaults", CONFIG_RESOURCE);
                return defaults();
            }
            ConfigRoot root = parse(is);
            logger.info("Loaded synthesis config: window={}, cache={}, params=[{}]", root.windowSizeOrDefault(),
                    root.cacheEnabled(), root.parametersOrDefault().fingerprint());
            return root;
        } catch (Exception e) {
            logger.warn("Failed to load {}, using defaults. Error: {}", CONFIG_RESOURCE, e.getMessage());
            return defaults();
        }
    }
}
