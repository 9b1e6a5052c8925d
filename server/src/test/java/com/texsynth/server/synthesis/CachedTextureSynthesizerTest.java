package com.texsynth.server.synthesis;

import com.texsynth.db.SampleImageDao;
import com.texsynth.db.SqliteInitializer;
import com.texsynth.db.SynthesisResultDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CachedTextureSynthesizerTest {

    @TempDir
    Path tempDir;

    private String dbPath;
    private CachedTextureSynthesizer cached;
    private PixelBuffer sample;

    private static class CountingSynthesizer extends TextureSynthesizer {
        int calls = 0;

        @Override
        public SynthesisResult synthesize(PixelBuffer sample, int outputRows, int outputCols, int windowSize,
                Random random, SynthesisProgressListener listener) {
            calls++;
            return super.synthesize(sample, outputRows, outputCols, windowSize, random, listener);
        }
    }

    private static class ReadOnlyResultDao extends SynthesisResultDao {
        ReadOnlyResultDao(String dbPath) {
            super(dbPath);
        }

        @Override
        public void upsertResult(long sampleId, String paramsKey, String engineVersion, SynthesisResult result)
                throws SQLException {
            throw new SQLException("attempt to write a readonly database");
        }
    }

    @BeforeEach
    void setup() throws SQLException {
        dbPath = tempDir.resolve("cache.db").toString();
        SqliteInitializer.initialize(dbPath);
        cached = new CachedTextureSynthesizer(new TextureSynthesizer(), new SampleImageDao(dbPath),
                new SynthesisResultDao(dbPath));

        Random random = new Random(5);
        sample = new PixelBuffer(6, 6, 1);
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 6; c++) {
                sample.set(r, c, 0, random.nextDouble());
            }
        }
    }

    @Test
    void testSeededRunIsServedFromCacheTheSecondTime() {
        SynthesisResult first = cached.synthesize(sample, 9, 9, 3, 77L, null);
        assertFalse(first.isFromCache());

        SynthesisResult second = cached.synthesize(sample, 9, 9, 3, 77L, null);
        assertTrue(second.isFromCache());
        assertArrayEquals(first.getOutput().toChannelPlanes(), second.getOutput().toChannelPlanes(), 0.0);
        assertEquals(first.getPasses(), second.getPasses());
        assertEquals(first.getFinalMaxErrorThreshold(), second.getFinalMaxErrorThreshold(), 0.0);
        assertEquals(3, second.getWindowSize());
    }

    @Test
    void testDifferentSeedOrSizeMisses() {
        cached.synthesize(sample, 9, 9, 3, 77L, null);
        assertFalse(cached.synthesize(sample, 9, 9, 3, 78L, null).isFromCache());
        assertFalse(cached.synthesize(sample, 9, 10, 3, 77L, null).isFromCache());
    }

    @Test
    void testEvenAndNextOddWindowShareAnEntry() {
        cached.synthesize(sample, 8, 8, 4, 1L, null);
        assertTrue(cached.synthesize(sample, 8, 8, 5, 1L, null).isFromCache());
    }

    @Test
    void testDatabaseFailureFallsBackToDirectSynthesis() {
        String missing = tempDir.resolve("no-such-dir").resolve("cache.db").toString();
        CachedTextureSynthesizer broken = new CachedTextureSynthesizer(new TextureSynthesizer(),
                new SampleImageDao(missing), new SynthesisResultDao(missing));

        SynthesisResult result = broken.synthesize(sample, 7, 7, 3, 3L, null);
        assertFalse(result.isFromCache());
        assertEquals(7, result.getOutput().getRows());
    }

    @Test
    void testStoreFailureReturnsComputedResultWithoutRecomputing() {
        CountingSynthesizer synthesizer = new CountingSynthesizer();
        CachedTextureSynthesizer readOnly = new CachedTextureSynthesizer(synthesizer, new SampleImageDao(dbPath),
                new ReadOnlyResultDao(dbPath));
        List<PassReport> reports = new ArrayList<>();

        SynthesisResult result = readOnly.synthesize(sample, 9, 9, 3, 77L, (report, output) -> reports.add(report));

        assertEquals(1, synthesizer.calls);
        assertFalse(result.isFromCache());
        assertEquals(9, result.getOutput().getRows());
        assertEquals(result.getPasses(), reports.size());
    }

    @Test
    void testCacheHitReportsFinishedOutputOnce() {
        SynthesisResult first = cached.synthesize(sample, 9, 9, 3, 77L, null);
        List<PassReport> reports = new ArrayList<>();
        List<PixelBuffer> outputs = new ArrayList<>();

        SynthesisResult second = cached.synthesize(sample, 9, 9, 3, 77L, (report, output) -> {
            reports.add(report);
            outputs.add(output);
        });

        assertTrue(second.isFromCache());
        assertEquals(1, reports.size());
        assertEquals(first.getPasses(), reports.get(0).getPassNumber());
        assertEquals(81, reports.get(0).getFilledCount());
        assertEquals(1.0, reports.get(0).getFilledFraction(), 0.0);
        assertArrayEquals(second.getOutput().toChannelPlanes(), outputs.get(0).toChannelPlanes(), 0.0);
        assertNotSame(second.getOutput(), outputs.get(0));
    }

    @Test
    void testInvalidDimensionsFailBeforeTouchingTheCache() {
        assertThrows(InvalidDimensionsException.class, () -> cached.synthesize(sample, 2, 9, 3, 1L, null));
    }

    @Test
    void testSampleHashDependsOnValuesAndShape() {
        String hash = CachedTextureSynthesizer.computeSampleHash(sample);
        assertEquals(64, hash.length());
        assertEquals(hash, CachedTextureSynthesizer.computeSampleHash(sample.copy()));

        PixelBuffer changed = sample.copy();
        changed.set(0, 0, 0, changed.get(0, 0, 0) + 1e-9);
        assertNotEquals(hash, CachedTextureSynthesizer.computeSampleHash(changed));

        PixelBuffer reshaped = PixelBuffer.fromChannelPlanes(4, 9, 1, sample.toChannelPlanes());
        assertNotEquals(hash, CachedTextureSynthesizer.computeSampleHash(reshaped));
    }
}
