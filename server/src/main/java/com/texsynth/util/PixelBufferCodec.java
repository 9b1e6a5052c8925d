package com.texsynth.util;

import com.texsynth.server.synthesis.PixelBuffer;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Serializes a pixel buffer as three int dimensions (rows, cols, channels)
 * followed by its channel planes as doubles, all big-endian.
 */
public class PixelBufferCodec {

    private static final int HEADER_BYTES = 3 * Integer.BYTES;

    public static byte[] toBytes(PixelBuffer buffer) {
        if (buffer == null) {
            return null;
        }
        double[] planes = buffer.toChannelPlanes();
        ByteBuffer bytes = ByteBuffer.allocate(HEADER_BYTES + planes.length * Double.BYTES);
        bytes.putInt(buffer.getRows());
        bytes.putInt(buffer.getCols());
        bytes.putInt(buffer.getChannels());
        bytes.asDoubleBuffer().put(planes);
        return bytes.array();
    }

    public static PixelBuffer fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length < HEADER_BYTES) {
            throw new IllegalArgumentException("Blob too short for a pixel buffer header: " + bytes.length);
        }
        ByteBuffer wrapped = ByteBuffer.wrap(bytes);
        int rows = wrapped.getInt();
        int cols = wrapped.getInt();
        int channels = wrapped.getInt();
        DoubleBuffer doubles = wrapped.asDoubleBuffer();
        double[] planes = new double[doubles.remaining()];
        doubles.get(planes);
        return PixelBuffer.fromChannelPlanes(rows, cols, channels, planes);
    }
}
