package com.texsynth.server.tools;

import com.texsynth.server.imaging.PixelBufferImages;
import com.texsynth.server.synthesis.PassReport;
import com.texsynth.server.synthesis.PixelBuffer;
import com.texsynth.server.synthesis.SynthesisProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the partially grown output as pass_NNNNN.png every N passes.
 */
public class PreviewWriter implements SynthesisProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(PreviewWriter.class);

    private final Path directory;
    private final int everyNPasses;

    public PreviewWriter(Path directory, int everyNPasses) throws IOException {
        if (everyNPasses <= 0) {
            throw new IllegalArgumentException("everyNPasses must be positive");
        }
        this.directory = Files.createDirectories(directory);
        this.everyNPasses = everyNPasses;
    }

    @Override
    public void onPassCompleted(PassReport report, PixelBuffer output) {
        if (report.getPassNumber() % everyNPasses != 0) {
            return;
        }
        Path file = directory.resolve(String.format("pass_%05d.png", report.getPassNumber()));
        try {
            PixelBufferImages.writePng(output, file);
            logger.debug("Wrote preview {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write preview " + file, e);
        }
    }
}
