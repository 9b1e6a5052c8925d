package com.texsynth.server.synthesis;

public class MatchResult {
    private final boolean accepted;
    private final int candidateIndex;
    private final int sourceRow;
    private final int sourceCol;
    private final double error;
    private final int nearOptimalCount;

    public MatchResult(boolean accepted, int candidateIndex, int sourceRow, int sourceCol, double error,
            int nearOptimalCount) {
        this.accepted = accepted;
        this.candidateIndex = candidateIndex;
        this.sourceRow = sourceRow;
        this.sourceCol = sourceCol;
        this.error = error;
        this.nearOptimalCount = nearOptimalCount;
    }

    public boolean isAccepted() {
        return accepted;
    }

    public int getCandidateIndex() {
        return candidateIndex;
    }

    /** Sample row of the matched window's centre. */
    public int getSourceRow() {
        return sourceRow;
    }

    /** Sample column of the matched window's centre. */
    public int getSourceCol() {
        return sourceCol;
    }

    public double getError() {
        return error;
    }

    public int getNearOptimalCount() {
        return nearOptimalCount;
    }

    @Override
    public String toString() {
        return "MatchResult{accepted=" + accepted + ", source=(" + sourceRow + ", " + sourceCol + "), error="
                + error + ", nearOptimal=" + nearOptimalCount + "}";
    }
}
