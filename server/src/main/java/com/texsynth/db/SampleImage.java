package com.texsynth.db;

public class SampleImage {
    private final long id;
    private final String sampleHash;
    private final int rows;
    private final int cols;
    private final int channels;
    private final long createdTs;

    public SampleImage(long id, String sampleHash, int rows, int cols, int channels, long createdTs) {
        this.id = id;
        this.sampleHash = sampleHash;
        this.rows = rows;
        this.cols = cols;
        this.channels = channels;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getSampleHash() {
        return sampleHash;
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

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "SampleImage{id=" + id + ", " + rows + "x" + cols + "x" + channels + "}";
    }
}
