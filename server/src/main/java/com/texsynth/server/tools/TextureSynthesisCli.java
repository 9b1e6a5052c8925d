package com.texsynth.server.tools;

import com.texsynth.server.config.SynthesisConfig;
import com.texsynth.server.imaging.PixelBufferImages;
import com.texsynth.server.synthesis.PassLoggingListener;
import com.texsynth.server.synthesis.PassReport;
import com.texsynth.server.synthesis.PixelBuffer;
import com.texsynth.server.synthesis.SynthesisProgressListener;
import com.texsynth.server.synthesis.SynthesisResult;
import com.texsynth.server.synthesis.TextureSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Offline tool that grows a texture from a sample image file.
 * Usage: TextureSynthesisCli <sample.png> <output.png> <rows> <cols> [windowSize] [seed]
 * [--gray] [--preview-dir DIR] [--preview-every N]
 */
public class TextureSynthesisCli {

    private static final Logger logger = LoggerFactory.getLogger(TextureSynthesisCli.class);

    private static final String USAGE = "Usage: TextureSynthesisCli <sample.png> <output.png> <rows> <cols> "
            + "[windowSize] [seed] [--gray] [--preview-dir DIR] [--preview-every N]";

    static class Options {
        Path input;
        Path output;
        int rows;
        int cols;
        Integer windowSize;
        Long seed;
        boolean grayscale = false;
        Path previewDir;
        int previewEvery = 1;
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        try {
            run(options);
        } catch (Exception e) {
            logger.error("Synthesis failed", e);
            System.exit(1);
        }
    }

    static Options parse(String[] args) {
        List<String> positional = new ArrayList<>();
        Options options = new Options();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--gray":
                    options.grayscale = true;
                    break;
                case "--preview-dir":
                    options.previewDir = Paths.get(requireValue(args, ++i, "--preview-dir"));
                    break;
                case "--preview-every":
                    options.previewEvery = parseInt(requireValue(args, ++i, "--preview-every"), "--preview-every");
                    break;
                default:
                    positional.add(args[i]);
            }
        }
        if (positional.size() < 4 || positional.size() > 6) {
            throw new IllegalArgumentException("Expected 4 to 6 positional arguments, got " + positional.size());
        }
        options.input = Paths.get(positional.get(0));
        options.output = Paths.get(positional.get(1));
        options.rows = parseInt(positional.get(2), "rows");
        options.cols = parseInt(positional.get(3), "cols");
        if (positional.size() > 4) {
            options.windowSize = parseInt(positional.get(4), "windowSize");
        }
        if (positional.size() > 5) {
            try {
                options.seed = Long.parseLong(positional.get(5));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("seed must be an integer: " + positional.get(5));
            }
        }
        return options;
    }

    static SynthesisResult run(Options options) throws Exception {
        SynthesisConfig.ConfigRoot config = SynthesisConfig.load();
        int window = options.windowSize != null ? options.windowSize : config.windowSizeOrDefault();
        Random random = options.seed != null ? new Random(options.seed) : new Random();

        PixelBuffer sample = PixelBufferImages.read(options.input, options.grayscale);
        logger.info("Loaded sample {} from {}", sample, options.input);

        List<SynthesisProgressListener> listeners = new ArrayList<>();
        int logEvery = config.logEveryNPassesOrDefault();
        listeners.add(new PassLoggingListener(logEvery > 0 ? logEvery : 10));
        if (options.previewDir != null) {
            listeners.add(new PreviewWriter(options.previewDir, options.previewEvery));
        }

        TextureSynthesizer synthesizer = new TextureSynthesizer(config.parametersOrDefault());
        SynthesisResult result = synthesizer.synthesize(sample, options.rows, options.cols, window, random,
                (PassReport report, PixelBuffer output) -> {
                    for (SynthesisProgressListener l : listeners) {
                        l.onPassCompleted(report, output);
                    }
                });

        PixelBufferImages.writePng(result.getOutput(), options.output);
        logger.info("Wrote {} ({} passes, {} threshold relaxations)", options.output, result.getPasses(),
                result.getThresholdRelaxations());
        return result;
    }

    private static String requireValue(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[i];
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value);
        }
    }
}
