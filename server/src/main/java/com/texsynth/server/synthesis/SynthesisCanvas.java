package com.texsynth.server.synthesis;

/**
 * The output image and its filled mask, both stored with a zero / false border of
 * {@code padding} pixels so that neighborhoods near the output edges can be read
 * without bounds checks. Writes go straight into the padded storage, so the
 * padded view and the canonical buffers never diverge.
 */
public class SynthesisCanvas {

    private final int rows;
    private final int cols;
    private final int channels;
    private final int padding;
    private final int paddedRows;
    private final int paddedCols;

    // channel planes of the padded output
    private final double[] values;
    private final boolean[] filled;
    private int filledCount;

    public SynthesisCanvas(int rows, int cols, int channels, int padding) {
        if (rows <= 0 || cols <= 0 || channels <= 0 || padding < 0) {
            throw new IllegalArgumentException("Invalid canvas geometry " + rows + "x" + cols + "x" + channels
                    + " padding " + padding);
        }
        this.rows = rows;
        this.cols = cols;
        this.channels = channels;
        this.padding = padding;
        this.paddedRows = rows + 2 * padding;
        this.paddedCols = cols + 2 * padding;
        this.values = new double[paddedRows * paddedCols * channels];
        this.filled = new boolean[paddedRows * paddedCols];
    }

    /**
     * Writes a pixel and marks it filled. A pixel is written at most once.
     */
    public void fill(int row, int col, double[] pixel) {
        if (pixel.length != channels) {
            throw new IllegalArgumentException("Expected " + channels + " channel values, got " + pixel.length);
        }
        int cell = cell(row, col);
        if (filled[cell]) {
            throw new InternalInvariantViolationException("Pixel (" + row + ", " + col + ") written twice");
        }
        int plane = paddedRows * paddedCols;
        for (int ch = 0; ch < channels; ch++) {
            values[ch * plane + cell] = pixel[ch];
        }
        filled[cell] = true;
        filledCount++;
    }

    public boolean isFilled(int row, int col) {
        return filled[cell(row, col)];
    }

    public double get(int row, int col, int channel) {
        return values[channel * paddedRows * paddedCols + cell(row, col)];
    }

    public boolean isComplete() {
        return filledCount == rows * cols;
    }

    public int getFilledCount() {
        return filledCount;
    }

    public int getUnfilledCount() {
        return rows * cols - filledCount;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public int getChannels() {
        return channels;
    }

    public int getPadding() {
        return padding;
    }

    /**
     * Copy of the canonical (unpadded) filled mask, indexed [row][col].
     */
    public boolean[][] filledMask() {
        boolean[][] mask = new boolean[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                mask[r][c] = filled[cell(r, c)];
            }
        }
        return mask;
    }

    /**
     * Copy of the canonical output. Unfilled pixels hold zero.
     */
    public PixelBuffer snapshot() {
        PixelBuffer out = new PixelBuffer(rows, cols, channels);
        for (int ch = 0; ch < channels; ch++) {
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    out.set(r, c, ch, get(r, c, ch));
                }
            }
        }
        return out;
    }

    // Padded-coordinate accessors for neighborhood extraction
    double paddedValue(int paddedRow, int paddedCol, int channel) {
        return values[(channel * paddedRows + paddedRow) * paddedCols + paddedCol];
    }

    boolean paddedFilled(int paddedRow, int paddedCol) {
        return filled[paddedRow * paddedCols + paddedCol];
    }

    private int cell(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + rows + "x" + cols);
        }
        return (row + padding) * paddedCols + (col + padding);
    }
}
