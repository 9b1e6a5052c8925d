package com.texsynth.server.synthesis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * All mutable state of one synthesis call: the canvas, the adaptive error
 * threshold and the run counters. SEEDING runs once, GROWING repeats one pass
 * per onion-skin layer until the canvas is complete, then the session is DONE.
 */
public class SynthesisSession {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisSession.class);

    private final PixelBuffer sample;
    private final PatchIndex index;
    private final MatchSelector selector;
    private final SynthesisParameters params;
    private final int outputRows;
    private final int outputCols;
    private final Random random;
    private final SynthesisProgressListener listener;

    private SynthesisState state = SynthesisState.SEEDING;
    private SynthesisCanvas canvas;
    private double maxErrorThreshold;
    private int passes = 0;
    private int relaxations = 0;
    private long matchAttempts = 0;

    public SynthesisSession(PixelBuffer sample, PatchIndex index, MatchSelector selector,
            SynthesisParameters params, int outputRows, int outputCols, Random random,
            SynthesisProgressListener listener) {
        this.sample = sample;
        this.index = index;
        this.selector = selector;
        this.params = params;
        this.outputRows = outputRows;
        this.outputCols = outputCols;
        this.random = random;
        this.listener = listener;
        this.maxErrorThreshold = params.initialMaxErrorThreshold;
    }

    public SynthesisResult run() {
        while (state != SynthesisState.DONE) {
            step();
        }
        return new SynthesisResult(canvas.snapshot(), index.getWindowSize(), passes, relaxations,
                maxErrorThreshold, matchAttempts, false);
    }

    /**
     * Advances the state machine by one transition (the seed, or one growth pass).
     */
    public void step() {
        switch (state) {
            case SEEDING:
                canvas = Seeder.seed(sample, params.seedSize, outputRows, outputCols, index.getHalfWindow(), random);
                state = SynthesisState.GROWING;
                break;
            case GROWING:
                List<PixelPosition> frontier = GrowthFrontier.compute(canvas.filledMask());
                if (frontier.isEmpty()) {
                    if (!canvas.isComplete()) {
                        throw new InternalInvariantViolationException(
                                "Empty frontier with " + canvas.getUnfilledCount() + " unfilled pixels");
                    }
                    state = SynthesisState.DONE;
                    break;
                }
                if (params.maxPasses > 0 && passes >= params.maxPasses) {
                    throw new SynthesisLimitExceededException(passes, canvas.getUnfilledCount());
                }
                runPass(frontier);
                break;
            case DONE:
                break;
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    private void runPass(List<PixelPosition> frontier) {
        passes++;
        boolean immediate = params.commitMode == FrontierCommitMode.IMMEDIATE;
        List<PixelPosition> stagedPositions = immediate ? null : new ArrayList<>();
        List<double[]> stagedPixels = immediate ? null : new ArrayList<>();
        int accepted = 0;

        for (PixelPosition p : frontier) {
            NeighborhoodView view = NeighborhoodView.extract(canvas, p.getRow(), p.getCol(), index.getWindowSize());
            MatchResult match = selector.select(view, maxErrorThreshold);
            matchAttempts++;
            if (!match.isAccepted()) {
                continue;
            }
            double[] pixel = sample.getPixel(match.getSourceRow(), match.getSourceCol());
            if (immediate) {
                canvas.fill(p.getRow(), p.getCol(), pixel);
            } else {
                stagedPositions.add(p);
                stagedPixels.add(pixel);
            }
            accepted++;
        }

        if (!immediate) {
            for (int i = 0; i < stagedPositions.size(); i++) {
                PixelPosition p = stagedPositions.get(i);
                canvas.fill(p.getRow(), p.getCol(), stagedPixels.get(i));
            }
        }

        boolean relaxed = false;
        if (accepted == 0) {
            maxErrorThreshold *= params.thresholdGrowthFactor;
            relaxations++;
            relaxed = true;
            logger.debug("Pass {}: no match among {} frontier pixels, max error threshold raised to {}",
                    passes, frontier.size(), maxErrorThreshold);
        }

        if (listener != null) {
            PassReport report = new PassReport(passes, frontier.size(), accepted, canvas.getFilledCount(),
                    outputRows * outputCols, maxErrorThreshold, relaxed);
            listener.onPassCompleted(report, canvas.snapshot());
        }
    }

    public SynthesisState getState() {
        return state;
    }

    public double getMaxErrorThreshold() {
        return maxErrorThreshold;
    }

    public int getPasses() {
        return passes;
    }

    public int getThresholdRelaxations() {
        return relaxations;
    }

    public long getMatchAttempts() {
        return matchAttempts;
    }

    /** The canvas being grown; null until the seed was placed. */
    public SynthesisCanvas getCanvas() {
        return canvas;
    }
}
