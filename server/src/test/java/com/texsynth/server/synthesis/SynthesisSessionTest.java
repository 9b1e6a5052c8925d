package com.texsynth.server.synthesis;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SynthesisSessionTest {

    /** Records how many filled positions each queried neighbourhood had. */
    private static class RecordingSelector extends MatchSelector {
        final List<Integer> filledCounts = new ArrayList<>();

        RecordingSelector(PatchIndex index, Random random) {
            super(index, 0.1, random);
        }

        @Override
        public MatchResult select(NeighborhoodView view, double maxErrorThreshold) {
            filledCounts.add(view.getFilledCount());
            return super.select(view, maxErrorThreshold);
        }
    }

    private static SynthesisSession session(FrontierCommitMode mode, RecordingSelector[] selectorOut) {
        PixelBuffer sample = PixelBuffer.filled(5, 5, 1, 0.5);
        PatchIndex index = new PatchIndex(sample, 3, 6.4);
        Random random = new Random(8);
        RecordingSelector selector = new RecordingSelector(index, random);
        selectorOut[0] = selector;
        SynthesisParameters params = SynthesisParameters.defaults();
        params.commitMode = mode;
        return new SynthesisSession(sample, index, selector, params, 5, 5, random, null);
    }

    @Test
    void testStateMachineRunsSeedingGrowingDone() {
        RecordingSelector[] selector = new RecordingSelector[1];
        SynthesisSession session = session(FrontierCommitMode.IMMEDIATE, selector);
        assertEquals(SynthesisState.SEEDING, session.getState());
        assertNull(session.getCanvas());

        session.step();
        assertEquals(SynthesisState.GROWING, session.getState());
        assertEquals(9, session.getCanvas().getFilledCount());

        session.step();
        assertEquals(SynthesisState.GROWING, session.getState());
        assertEquals(1, session.getPasses());
        assertTrue(session.getCanvas().isComplete());

        session.step();
        assertEquals(SynthesisState.DONE, session.getState());
        assertEquals(16, session.getMatchAttempts());
    }

    @Test
    void testImmediateCommitExposesEarlierPixelsOfTheSamePass() {
        RecordingSelector[] selector = new RecordingSelector[1];
        session(FrontierCommitMode.IMMEDIATE, selector).run();

        // Frontier is visited row-major: (0, 0) then (0, 1). The seed covers rows/cols 1..3.
        // (0, 0) sees only (1, 1); (0, 1) sees (1, 1), (1, 2) and the just-written (0, 0).
        assertEquals(1, selector[0].filledCounts.get(0));
        assertEquals(3, selector[0].filledCounts.get(1));
    }

    @Test
    void testEndOfPassCommitReadsStartOfPassState() {
        RecordingSelector[] selector = new RecordingSelector[1];
        SynthesisResult result = session(FrontierCommitMode.END_OF_PASS, selector).run();

        assertEquals(1, selector[0].filledCounts.get(0));
        assertEquals(2, selector[0].filledCounts.get(1));

        assertEquals(1, result.getPasses());
        for (double v : result.getOutput().toChannelPlanes()) {
            assertEquals(0.5, v, 0.0);
        }
    }
}
