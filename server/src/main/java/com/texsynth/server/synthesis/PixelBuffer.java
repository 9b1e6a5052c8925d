package com.texsynth.server.synthesis;

/**
 * A rows x cols x channels buffer of real-valued samples.
 * Samples are stored channel-stacked: the whole first channel plane (row-major),
 * then the second, and so on.
 */
public class PixelBuffer {

    private final int rows;
    private final int cols;
    private final int channels;
    private final double[] data;

    public PixelBuffer(int rows, int cols, int channels) {
        if (rows <= 0 || cols <= 0 || channels <= 0) {
            throw new IllegalArgumentException(
                    "Buffer dimensions must be positive, got " + rows + "x" + cols + "x" + channels);
        }
        this.rows = rows;
        this.cols = cols;
        this.channels = channels;
        this.data = new double[rows * cols * channels];
    }

    /**
     * Builds a buffer from a [row][col][channel] array. All rows must have the same
     * length and all pixels the same channel count.
     */
    public static PixelBuffer of(double[][][] pixels) {
        if (pixels == null || pixels.length == 0 || pixels[0] == null || pixels[0].length == 0
                || pixels[0][0] == null || pixels[0][0].length == 0) {
            throw new IllegalArgumentException("Pixel array must be non-empty");
        }
        int rows = pixels.length;
        int cols = pixels[0].length;
        int channels = pixels[0][0].length;
        PixelBuffer buffer = new PixelBuffer(rows, cols, channels);
        for (int r = 0; r < rows; r++) {
            if (pixels[r] == null || pixels[r].length != cols) {
                throw new IllegalArgumentException("Row " + r + " does not have " + cols + " columns");
            }
            for (int c = 0; c < cols; c++) {
                if (pixels[r][c] == null || pixels[r][c].length != channels) {
                    throw new IllegalArgumentException(
                            "Pixel (" + r + ", " + c + ") does not have " + channels + " channels");
                }
                buffer.setPixel(r, c, pixels[r][c]);
            }
        }
        return buffer;
    }

    public static PixelBuffer fromChannelPlanes(int rows, int cols, int channels, double[] planes) {
        PixelBuffer buffer = new PixelBuffer(rows, cols, channels);
        if (planes.length != buffer.data.length) {
            throw new IllegalArgumentException(
                    "Expected " + buffer.data.length + " samples, got " + planes.length);
        }
        System.arraycopy(planes, 0, buffer.data, 0, planes.length);
        return buffer;
    }

    /**
     * A buffer where every sample of every channel holds {@code value}.
     */
    public static PixelBuffer filled(int rows, int cols, int channels, double value) {
        PixelBuffer buffer = new PixelBuffer(rows, cols, channels);
        java.util.Arrays.fill(buffer.data, value);
        return buffer;
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

    public double get(int row, int col, int channel) {
        return data[index(row, col, channel)];
    }

    public void set(int row, int col, int channel, double value) {
        data[index(row, col, channel)] = value;
    }

    public double[] getPixel(int row, int col) {
        double[] values = new double[channels];
        for (int ch = 0; ch < channels; ch++) {
            values[ch] = data[index(row, col, ch)];
        }
        return values;
    }

    public void setPixel(int row, int col, double[] values) {
        if (values.length != channels) {
            throw new IllegalArgumentException("Expected " + channels + " channel values, got " + values.length);
        }
        for (int ch = 0; ch < channels; ch++) {
            data[index(row, col, ch)] = values[ch];
        }
    }

    public boolean allFinite() {
        for (double v : data) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                return false;
            }
        }
        return true;
    }

    public PixelBuffer copy() {
        return fromChannelPlanes(rows, cols, channels, data);
    }

    public double[] toChannelPlanes() {
        return data.clone();
    }

    public double[][][] toArray() {
        double[][][] pixels = new double[rows][cols][];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                pixels[r][c] = getPixel(r, c);
            }
        }
        return pixels;
    }

    private int index(int row, int col, int channel) {
        if (row < 0 || row >= rows || col < 0 || col >= cols || channel < 0 || channel >= channels) {
            throw new IndexOutOfBoundsException(
                    "(" + row + ", " + col + ", " + channel + ") outside " + rows + "x" + cols + "x" + channels);
        }
        return (channel * rows + row) * cols + col;
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + rows + "x" + cols + "x" + channels + "}";
    }
}
