package com.texsynth.server.util;

import com.texsynth.server.config.SynthesisConfig;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "texsynth.data.dir";
    public static final String DB_FILE_NAME = "texsynth_cache.db";

    public static String resolveDataDirectory() {
        return resolveDataDirectory(SynthesisConfig.load());
    }

    public static String resolveDataDirectory(SynthesisConfig.ConfigRoot config) {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config
        if (config != null && config.texsynth_data_directory != null && !config.texsynth_data_directory.isEmpty()) {
            return config.texsynth_data_directory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath() {
        return resolveDbPath(SynthesisConfig.load());
    }

    public static String resolveDbPath(SynthesisConfig.ConfigRoot config) {
        return resolveDataDirectory(config) + File.separator + DB_FILE_NAME;
    }
}
