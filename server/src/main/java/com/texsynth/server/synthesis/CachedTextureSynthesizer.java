package com.texsynth.server.synthesis;

import com.texsynth.db.SampleImage;
import com.texsynth.db.SampleImageDao;
import com.texsynth.db.SynthesisResultDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.Optional;
import java.util.Random;

/**
 * Stores the output of seeded (and therefore reproducible) runs in SQLite and
 * serves repeated requests from there.
 */
public class CachedTextureSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(CachedTextureSynthesizer.class);

    // Bump when a change to the engine alters outputs for identical inputs
    public static final String ENGINE_VERSION = "v1";

    private final TextureSynthesizer delegate;
    private final SampleImageDao sampleDao;
    private final SynthesisResultDao resultDao;

    public CachedTextureSynthesizer(TextureSynthesizer delegate,
            SampleImageDao sampleDao,
            SynthesisResultDao resultDao) {
        this.delegate = delegate;
        this.sampleDao = sampleDao;
        this.resultDao = resultDao;
    }

    /**
     * Cache hits skip synthesis; the listener then receives a single report for the
     * finished output instead of one per pass.
     */
    public SynthesisResult synthesize(PixelBuffer sample, int outputRows, int outputCols, int windowSize,
            long rngSeed, SynthesisProgressListener listener) {
        delegate.checkDimensions(sample, outputRows, outputCols, windowSize);
        String hash = computeSampleHash(sample);
        String key = paramsKey(outputRows, outputCols, windowSize, rngSeed);

        SampleImage stored;
        try {
            // 1. Get or Create Sample
            stored = sampleDao.getOrCreateByHash(hash, sample.getRows(), sample.getCols(), sample.getChannels());

            // 2. Try to load from cache
            Optional<SynthesisResult> cached = resultDao.loadResult(stored.getId(), key, ENGINE_VERSION);
            if (cached.isPresent()) {
                logger.debug("Cache HIT for sample {} key {}", stored.getId(), key);
                reportCachedResult(cached.get(), listener);
                return cached.get();
            }
        } catch (SQLException e) {
            logger.error("Database error in CachedTextureSynthesizer, falling back to direct synthesis", e);
            return delegate.synthesize(sample, outputRows, outputCols, windowSize, new Random(rngSeed), listener);
        }

        // 3. Compute
        logger.debug("Cache MISS for sample {} key {}", stored.getId(), key);
        SynthesisResult result = delegate.synthesize(sample, outputRows, outputCols, windowSize,
                new Random(rngSeed), listener);

        // 4. Store
        try {
            resultDao.upsertResult(stored.getId(), key, ENGINE_VERSION, result);
        } catch (SQLException e) {
            logger.error("Failed to store synthesis result for sample {} key {}", stored.getId(), key, e);
        }
        return result;
    }

    private static void reportCachedResult(SynthesisResult result, SynthesisProgressListener listener) {
        if (listener == null) {
            return;
        }
        PixelBuffer output = result.getOutput();
        int total = output.getRows() * output.getCols();
        PassReport report = new PassReport(result.getPasses(), 0, 0, total, total,
                result.getFinalMaxErrorThreshold(), false);
        listener.onPassCompleted(report, output.copy());
    }

    String paramsKey(int outputRows, int outputCols, int windowSize, long rngSeed) {
        return "out=" + outputRows + "x" + outputCols
                + ";win=" + PatchIndex.adjustWindowSize(windowSize)
                + ";rng=" + rngSeed
                + ";" + delegate.getParameters().fingerprint();
    }

    /**
     * SHA-256 over the dimensions and the exact bit patterns of every sample value.
     */
    public static String computeSampleHash(PixelBuffer sample) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            StringBuilder header = new StringBuilder();
            header.append(sample.getRows()).append('x').append(sample.getCols()).append('x')
                    .append(sample.getChannels()).append(';');
            digest.update(header.toString().getBytes(java.nio.charset.StandardCharsets.US_ASCII));
            for (double v : sample.toChannelPlanes()) {
                long bits = Double.doubleToLongBits(v);
                for (int shift = 56; shift >= 0; shift -= 8) {
                    digest.update((byte) (bits >>> shift));
                }
            }
            byte[] hash = digest.digest();
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1)
                    hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
