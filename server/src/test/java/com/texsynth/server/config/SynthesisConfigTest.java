package com.texsynth.server.config;

import com.texsynth.server.synthesis.FrontierCommitMode;
import com.texsynth.server.synthesis.InvalidDimensionsException;
import com.texsynth.server.synthesis.SynthesisParameters;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SynthesisConfigTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testLoadConfigFromDefaultFile() {
        SynthesisConfig.ConfigRoot config = SynthesisConfig.load();

        // Values from synthesis_config.json
        assertEquals(11, config.windowSizeOrDefault());
        assertTrue(config.cacheEnabled());
        assertEquals(25, config.logEveryNPassesOrDefault());

        SynthesisParameters params = config.parametersOrDefault();
        assertEquals(3, params.seedSize);
        assertEquals(0.1, params.errorTolerance, 1e-12);
        assertEquals(0.3, params.initialMaxErrorThreshold, 1e-12);
        assertEquals(1.1, params.thresholdGrowthFactor, 1e-12);
        assertEquals(6.4, params.gaussianSigmaDivisor, 1e-12);
        assertEquals(0, params.maxPasses);
        assertEquals(FrontierCommitMode.IMMEDIATE, params.commitMode);
    }

    @Test
    public void testMissingBlocksFallBackToDefaults() {
        SynthesisConfig.ConfigRoot config = SynthesisConfig.parse(json("{\"unknownKey\": 1}"));

        assertEquals(SynthesisConfig.DEFAULT_WINDOW_SIZE, config.windowSizeOrDefault());
        assertFalse(config.cacheEnabled());
        assertEquals(0, config.logEveryNPassesOrDefault());
        assertEquals(SynthesisParameters.defaults().fingerprint(), config.parametersOrDefault().fingerprint());
    }

    @Test
    public void testPartialSynthesisBlockKeepsFieldDefaults() {
        SynthesisConfig.ConfigRoot config = SynthesisConfig.parse(
                json("{\"synthesis\": {\"commitMode\": \"END_OF_PASS\", \"maxPasses\": 500}}"));

        SynthesisParameters params = config.parametersOrDefault();
        assertEquals(FrontierCommitMode.END_OF_PASS, params.commitMode);
        assertEquals(500, params.maxPasses);
        assertEquals(0.3, params.initialMaxErrorThreshold, 1e-12);
    }

    @Test
    public void testInvalidParametersAreRejected() {
        RuntimeException even = assertThrows(RuntimeException.class,
                () -> SynthesisConfig.parse(json("{\"synthesis\": {\"seedSize\": 4}}")));
        assertTrue(even.getCause() instanceof InvalidDimensionsException);

        assertThrows(RuntimeException.class,
                () -> SynthesisConfig.parse(json("{\"synthesis\": {\"thresholdGrowthFactor\": 1.0}}")));
        assertThrows(RuntimeException.class, () -> SynthesisConfig.parse(json("not json")));
    }

    @Test
    public void testParametersCopyIsIndependent() {
        SynthesisConfig.ConfigRoot config = SynthesisConfig.defaults();
        SynthesisParameters params = config.parametersOrDefault();
        params.seedSize = 5;
        assertEquals(3, config.parametersOrDefault().seedSize);
    }
}
