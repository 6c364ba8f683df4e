package io.tryjob4j.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildCompletionTest {

    @Test
    void summaryLineUsesLowerCaseResultAndDetail() {
        assertEquals("a: success (finished)",
                new BuildCompletion("a", 1, BuildResult.SUCCESS, "finished").summaryLine());
        assertEquals("b: failure (failure)",
                new BuildCompletion("b", 2, BuildResult.FAILURE, null).summaryLine());
    }

    @Test
    void onlyFinishedResultsAreTerminal() {
        assertFalse(BuildResult.PENDING.isTerminal());
        assertFalse(BuildResult.RUNNING.isTerminal());
        assertTrue(BuildResult.SUCCESS.isTerminal());
        assertTrue(BuildResult.FAILURE.isTerminal());
        assertTrue(BuildResult.EXCEPTION.isTerminal());
    }
}
