package com.texsynth.server.tools;

import com.texsynth.server.imaging.PixelBufferImages;
import com.texsynth.server.synthesis.PixelBuffer;
import com.texsynth.server.synthesis.SynthesisResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class TextureSynthesisCliTest {

    @TempDir
    Path tempDir;

    @Test
    public void testParsePositionalAndFlags() {
        TextureSynthesisCli.Options options = TextureSynthesisCli.parse(new String[] {
                "in.png", "out.png", "64", "48", "--gray", "9", "123", "--preview-dir", "previews",
                "--preview-every", "5" });

        assertEquals(Paths.get("in.png"), options.input);
        assertEquals(Paths.get("out.png"), options.output);
        assertEquals(64, options.rows);
        assertEquals(48, options.cols);
        assertEquals(Integer.valueOf(9), options.windowSize);
        assertEquals(Long.valueOf(123L), options.seed);
        assertTrue(options.grayscale);
        assertEquals(Paths.get("previews"), options.previewDir);
        assertEquals(5, options.previewEvery);
    }

    @Test
    public void testParseRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> TextureSynthesisCli.parse(new String[] { "in.png", "out.png", "64" }));
        assertThrows(IllegalArgumentException.class,
                () -> TextureSynthesisCli.parse(new String[] { "in.png", "out.png", "x", "48" }));
        assertThrows(IllegalArgumentException.class,
                () -> TextureSynthesisCli.parse(new String[] { "in.png", "out.png", "64", "48", "--preview-dir" }));
        assertThrows(IllegalArgumentException.class,
                () -> TextureSynthesisCli.parse(new String[] { "in.png", "out.png", "64", "48", "9", "seed" }));
    }

    @Test
    public void testRunWritesOutputAndPreviews() throws Exception {
        PixelBuffer sample = new PixelBuffer(5, 5, 3);
        for (int r = 0; r < 5; r++) {
            for (int c = 0; c < 5; c++) {
                sample.setPixel(r, c, new double[] { r / 4.0, c / 4.0, ((r + c) % 2) });
            }
        }
        Path input = tempDir.resolve("sample.png");
        PixelBufferImages.writePng(sample, input);

        TextureSynthesisCli.Options options = new TextureSynthesisCli.Options();
        options.input = input;
        options.output = tempDir.resolve("out.png");
        options.rows = 9;
        options.cols = 8;
        options.windowSize = 3;
        options.seed = 11L;
        options.previewDir = tempDir.resolve("previews");
        options.previewEvery = 1;

        SynthesisResult result = TextureSynthesisCli.run(options);

        PixelBuffer written = PixelBufferImages.read(options.output, false);
        assertEquals(9, written.getRows());
        assertEquals(8, written.getCols());
        try (Stream<Path> previews = Files.list(options.previewDir)) {
            assertEquals(result.getPasses(), previews.count());
        }
        assertTrue(Files.exists(options.previewDir.resolve("pass_00001.png")));
    }
}
