package io.github.yok.psfpr.core.run;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ProgressStateTest {

    @Test
    void notStartedIsSingleLine() {
        ProgressState s = ProgressState.notStarted();

        assertEquals(0, s.getIteration());
        assertFalse(s.isFinished());
        assertTrue(s.getStatus().isSingleLine());
        assertEquals("Phase retrieval not started yet", s.getStatus().joined());
    }

    @Test
    void resetClearsIterationAndShowsRunningStatus() {
        ProgressState s = ProgressState.reset(100);

        assertEquals(0, s.getIteration());
        assertEquals(0.0, s.getPupilDiff());
        assertEquals(Arrays.asList("Iteration 0 / 100", "Phase retrieval running..."),
                s.getStatus().getLines());
        assertNull(s.getReason());
    }

    @Test
    void runningCarriesDiffsOfTheSameIteration() {
        ProgressState s = ProgressState.running(7, 100, 1e-4, 2e-5);

        assertEquals(7, s.getIteration());
        assertEquals(1e-4, s.getPupilDiff());
        assertEquals(2e-5, s.getMseDiff());
        assertEquals("Iteration 7 / 100", s.getStatus().getLines().get(0));
        assertFalse(s.isFinished());
    }

    @Test
    void terminateKeepsIterationAndReplacesStatus() {
        ProgressState s = ProgressState.running(7, 100, 1e-4, 2e-5)
                .terminate(TerminationReason.MSE_CONVERGED);

        assertEquals(7, s.getIteration());
        assertEquals(1e-4, s.getPupilDiff());
        assertTrue(s.isFinished());
        assertEquals(TerminationReason.MSE_CONVERGED, s.getReason());
        assertEquals("Mean-square error converged.", s.getStatus().joined());
    }

    @Test
    void statusHasOneOrTwoLines() {
        assertEquals("a\nb", StatusMessage.of("a", "b").joined());
        assertThrows(IllegalArgumentException.class, () -> StatusMessage.of());
        assertThrows(IllegalArgumentException.class, () -> StatusMessage.of("a", "b", "c"));
    }

    @Test
    void historyCopyIsDetached() {
        ConvergenceHistory history = new ConvergenceHistory();
        history.append(0.1, 0.2);
        ConvergenceHistory copy = history.copy();

        history.append(0.3, 0.4);

        assertEquals(1, copy.size());
        assertEquals(2, history.size());
        assertEquals(0.3, history.pupilDiffs()[1]);
    }
}
