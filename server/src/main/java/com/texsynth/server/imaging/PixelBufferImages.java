package com.texsynth.server.imaging;

import com.texsynth.server.synthesis.PixelBuffer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Converts between decoded images and [0, 1] pixel buffers. Grayscale buffers
 * have one channel (mean of R, G and B), colour buffers three (R, G, B).
 */
public class PixelBufferImages {

    private PixelBufferImages() {
    }

    public static PixelBuffer fromImage(BufferedImage image, boolean grayscale) {
        int width = image.getWidth();
        int height = image.getHeight();
        PixelBuffer buffer = new PixelBuffer(height, width, grayscale ? 1 : 3);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int clr = image.getRGB(x, y);
                int red = (clr & 0x00ff0000) >> 16;
                int green = (clr & 0x0000ff00) >> 8;
                int blue = clr & 0x000000ff;
                if (grayscale) {
                    buffer.set(y, x, 0, (red + green + blue) / 3.0 / 255.0);
                } else {
                    buffer.set(y, x, 0, red / 255.0);
                    buffer.set(y, x, 1, green / 255.0);
                    buffer.set(y, x, 2, blue / 255.0);
                }
            }
        }
        return buffer;
    }

    public static BufferedImage toImage(PixelBuffer buffer) {
        int height = buffer.getRows();
        int width = buffer.getCols();
        switch (buffer.getChannels()) {
            case 1: {
                BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
                WritableRaster raster = image.getRaster();
                for (int y = 0; y < height; y++) {
                    for (int x = 0; x < width; x++) {
                        raster.setSample(x, y, 0, toByte(buffer.get(y, x, 0)));
                    }
                }
                return image;
            }
            case 3: {
                BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
                for (int y = 0; y < height; y++) {
                    for (int x = 0; x < width; x++) {
                        int rgb = (toByte(buffer.get(y, x, 0)) << 16)
                                | (toByte(buffer.get(y, x, 1)) << 8)
                                | toByte(buffer.get(y, x, 2));
                        image.setRGB(x, y, rgb);
                    }
                }
                return image;
            }
            default:
                throw new IllegalArgumentException(
                        "Only 1 or 3 channel buffers can be encoded, got " + buffer.getChannels());
        }
    }

    public static PixelBuffer read(Path path, boolean grayscale) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Unsupported or unreadable image: " + path);
        }
        return fromImage(image, grayscale);
    }

    public static PixelBuffer decode(byte[] encoded, boolean grayscale) throws IOException {
        try (InputStream in = new ByteArrayInputStream(encoded)) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new IOException("Unsupported or unreadable image data");
            }
            return fromImage(image, grayscale);
        }
    }

    public static void writePng(PixelBuffer buffer, Path path) throws IOException {
        File file = path.toFile();
        if (!ImageIO.write(toImage(buffer), "png", file)) {
            throw new IOException("No PNG writer available for " + path);
        }
    }

    public static byte[] encodePng(PixelBuffer buffer) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(toImage(buffer), "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    private static int toByte(double value) {
        long v = Math.round(value * 255.0);
        if (v < 0) {
            return 0;
        }
        if (v > 255) {
            return 255;
        }
        return (int) v;
    }
}
