package com.texsynth.server.synthesis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Grows an output texture of any size from a small sample (Efros-Leung
 * non-parametric sampling). Each call owns its buffers; one instance can serve
 * concurrent calls.
 */
public class TextureSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(TextureSynthesizer.class);

    private final SynthesisParameters params;

    public TextureSynthesizer() {
        this(SynthesisParameters.defaults());
    }

    public TextureSynthesizer(SynthesisParameters params) {
        params.validate();
        this.params = params.copy();
    }

    /**
     * Synthesizes with default parameters and returns only the output buffer.
     */
    public static PixelBuffer synthesizeTexture(PixelBuffer sample, int outputRows, int outputCols, int windowSize,
            Random random) {
        return new TextureSynthesizer().synthesize(sample, outputRows, outputCols, windowSize, random).getOutput();
    }

    public SynthesisResult synthesize(PixelBuffer sample, int outputRows, int outputCols, int windowSize,
            Random random) {
        return synthesize(sample, outputRows, outputCols, windowSize, random, null);
    }

    public SynthesisResult synthesize(PixelBuffer sample, int outputRows, int outputCols, int windowSize,
            Random random, SynthesisProgressListener listener) {
        if (sample == null) {
            throw new IllegalArgumentException("Sample must not be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("Random source must not be null");
        }
        checkDimensions(sample, outputRows, outputCols, windowSize);
        if (!sample.allFinite()) {
            throw new IllegalArgumentException("Sample contains NaN or infinite values");
        }
        checkValueRange(sample);

        long start = System.currentTimeMillis();
        PatchIndex index = new PatchIndex(sample, windowSize, params.gaussianSigmaDivisor);
        logger.info("Synthesizing {}x{} from {} sample, window={}, candidates={}", outputRows, outputCols, sample,
                index.getWindowSize(), index.getCandidateCount());

        MatchSelector selector = new MatchSelector(index, params.errorTolerance, random);
        SynthesisSession session = new SynthesisSession(sample, index, selector, params, outputRows, outputCols,
                random, listener);
        SynthesisResult result = session.run();

        logger.info("Synthesis done in {} ms: passes={}, relaxations={}, finalThreshold={}",
                System.currentTimeMillis() - start, result.getPasses(), result.getThresholdRelaxations(),
                String.format("%.4f", result.getFinalMaxErrorThreshold()));
        return result;
    }

    /**
     * Rejects inputs that cannot be synthesized, before anything is allocated.
     */
    public void checkDimensions(PixelBuffer sample, int outputRows, int outputCols, int windowSize) {
        Seeder.checkDimensions(sample, params.seedSize, outputRows, outputCols);
        if (windowSize < 2) {
            throw new InvalidDimensionsException("Window size must be at least 2, got " + windowSize);
        }
        int adjusted = PatchIndex.adjustWindowSize(windowSize);
        if (adjusted > sample.getRows() || adjusted > sample.getCols()) {
            throw new InvalidDimensionsException("Window size " + adjusted + " does not fit in a "
                    + sample.getRows() + "x" + sample.getCols() + " sample");
        }
    }

    /**
     * A neighborhood distance is bounded by the sum over channels of the squared value range.
     * That bound must stay finite, otherwise no error can ever fall below the threshold.
     */
    static void checkValueRange(PixelBuffer sample) {
        double bound = 0.0;
        for (int ch = 0; ch < sample.getChannels(); ch++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int r = 0; r < sample.getRows(); r++) {
                for (int c = 0; c < sample.getCols(); c++) {
                    double v = sample.get(r, c, ch);
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
            double range = max - min;
            bound += range * range;
        }
        // Headroom for rounding in the renormalized weights
        if (bound > Double.MAX_VALUE / 2) {
            throw new IllegalArgumentException("Sample value range is too large: squared distances overflow");
        }
    }

    public SynthesisParameters getParameters() {
        return params.copy();
    }
}
