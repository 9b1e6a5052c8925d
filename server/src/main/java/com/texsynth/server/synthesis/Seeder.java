package com.texsynth.server.synthesis;

import java.util.Random;

/**
 * Bootstraps synthesis by copying a random seedSize x seedSize patch of the sample
 * into the centre of an otherwise blank output.
 */
public class Seeder {

    private Seeder() {
    }

    public static void checkDimensions(PixelBuffer sample, int seedSize, int outputRows, int outputCols) {
        if (seedSize < 1 || seedSize % 2 == 0) {
            throw new InvalidDimensionsException("Seed size must be a positive odd number, got " + seedSize);
        }
        if (sample.getRows() < seedSize || sample.getCols() < seedSize) {
            throw new InvalidDimensionsException("Sample " + sample.getRows() + "x" + sample.getCols()
                    + " is smaller than the " + seedSize + "x" + seedSize + " seed");
        }
        if (outputRows < seedSize || outputCols < seedSize) {
            throw new InvalidDimensionsException("Output " + outputRows + "x" + outputCols
                    + " is smaller than the " + seedSize + "x" + seedSize + " seed");
        }
    }

    /**
     * @param padding border width of the returned canvas (half the matching window)
     * @return a canvas whose only filled pixels are the seed patch
     */
    public static SynthesisCanvas seed(PixelBuffer sample, int seedSize, int outputRows, int outputCols,
            int padding, Random random) {
        checkDimensions(sample, seedSize, outputRows, outputCols);

        int srcTop = random.nextInt(sample.getRows() - seedSize + 1);
        int srcLeft = random.nextInt(sample.getCols() - seedSize + 1);

        SynthesisCanvas canvas = new SynthesisCanvas(outputRows, outputCols, sample.getChannels(), padding);
        int half = seedSize / 2;
        int dstTop = outputRows / 2 - half;
        int dstLeft = outputCols / 2 - half;
        for (int dr = 0; dr < seedSize; dr++) {
            for (int dc = 0; dc < seedSize; dc++) {
                canvas.fill(dstTop + dr, dstLeft + dc, sample.getPixel(srcTop + dr, srcLeft + dc));
            }
        }
        return canvas;
    }
}
