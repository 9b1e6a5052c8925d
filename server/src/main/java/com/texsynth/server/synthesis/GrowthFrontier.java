package com.texsynth.server.synthesis;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the next onion-skin layer: unfilled pixels that touch at least one
 * filled pixel (8-connected, i.e. a 3x3 square dilation of the filled region
 * minus the region itself).
 */
public class GrowthFrontier {

    private GrowthFrontier() {
    }

    /**
     * @param filled filled mask indexed [row][col]
     * @return frontier pixels in row-major order; empty exactly when every pixel is filled
     *         or nothing is filled at all
     */
    public static List<PixelPosition> compute(boolean[][] filled) {
        List<PixelPosition> frontier = new ArrayList<>();
        int rows = filled.length;
        if (rows == 0) {
            return frontier;
        }
        int cols = filled[0].length;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (!filled[r][c] && touchesFilled(filled, r, c, rows, cols)) {
                    frontier.add(new PixelPosition(r, c));
                }
            }
        }
        return frontier;
    }

    private static boolean touchesFilled(boolean[][] filled, int row, int col, int rows, int cols) {
        for (int r = Math.max(0, row - 1); r <= Math.min(rows - 1, row + 1); r++) {
            for (int c = Math.max(0, col - 1); c <= Math.min(cols - 1, col + 1); c++) {
                if (filled[r][c]) {
                    return true;
                }
            }
        }
        return false;
    }
}
