package com.ryuqq.transmap.testkit.contract;

import com.ryuqq.transmap.adapter.runner.RunnerConfig;
import com.ryuqq.transmap.adapter.runner.SynthesisRunner;
import com.ryuqq.transmap.application.item.ActionRequirementItem;
import com.ryuqq.transmap.application.runner.ActionBinding;
import com.ryuqq.transmap.application.runner.RunReport;
import com.ryuqq.transmap.application.runner.RunStatus;
import com.ryuqq.transmap.core.model.State;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for callback failures.
 *
 * <p>A failing callback stops the run immediately and propagates unchanged; the
 * fixture is still stopped and torn down, and a failing cleanup step never hides the
 * callback failure. Checks written with JUnit assertions fail the same way. With the
 * continue-on-check-failure policy the remaining combinations still run.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class FailureContractTest extends AbstractContractTest {

    @Test
    void testFailure_CheckFailure_StopsRunAndPropagates() {
        // Given
        ActionRequirementItem item = speedLoadResultSpec().compile();
        SynthesisRunner runner = createRunner(new RunnerConfig());
        IllegalStateException failure = new IllegalStateException("expected Error");
        callbacks.failOn("check(0,Error)", failure);

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> runner.run(item, new ActionBinding(callbacks, callbacks)));

        // Then
        assertSame(failure, thrown);
        List<String> trace = callbacks.getTrace();
        assertEquals(List.of("check(0,Error)", "stop", "teardown"), trace.subList(trace.size() - 3, trace.size()));
        assertSame(failure, framework.getFailures().get("Fast/Full"));
        assertFalse(framework.isCaseRunning());
        assertEquals("", runner.scope());
    }

    @Test
    void testFailure_SetupFailure_SkipsActionLoopAndTeardown() {
        // Given
        ActionRequirementItem item = speedLoadResultSpec().compile();
        SynthesisRunner runner = createRunner(new RunnerConfig());
        callbacks.failOn("setup", new IllegalStateException("no device"));

        // When/Then
        assertThrows(IllegalStateException.class, () -> runner.run(item, new ActionBinding(callbacks, callbacks)));
        assertEquals(List.of("setup"), callbacks.getTrace());
        assertFalse(framework.isCaseRunning());
    }

    @Test
    void testFailure_ContinueOnCheckFailure_RunsRemainingCombinations() {
        // Given
        ActionRequirementItem item = spec(SPEED_LOAD_UID, speedLoadPreConditions(), List.of(
            row("Slow", "Empty", "Error"),
            row("Slow", "Full", "Ok"),
            row("Fast", "Empty", "Ok"),
            row("Fast", "Full", "Ok")
        )).compile();
        SynthesisRunner runner = createRunner(new RunnerConfig().withContinueOnCheckFailure(true));
        callbacks.failOn("check(0,Error)", new IllegalStateException("expected Error"));

        // When
        RunReport report = runner.run(item, ActionBinding.of(callbacks));

        // Then
        assertEquals(RunStatus.FAILED, report.status());
        assertEquals(4, callbacks.getActionCount());
        assertEquals(List.of("Slow/Full", "Fast/Empty", "Fast/Full"), framework.getPassed());
        assertEquals(1, framework.getFailures().size());
    }

    @Test
    void testFailure_StopFailsDuringCheckFailure_KeepsCheckFailure() {
        // Given
        ActionRequirementItem item = speedLoadResultSpec().compile();
        SynthesisRunner runner = createRunner(new RunnerConfig());
        IllegalStateException failure = new IllegalStateException("expected Error");
        IllegalStateException stopFailure = new IllegalStateException("stop failed");
        callbacks.failOn("check(0,Error)", failure).failOn("stop", stopFailure);

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> runner.run(item, new ActionBinding(callbacks, callbacks)));

        // Then
        assertSame(failure, thrown);
        assertArrayEquals(new Throwable[] {stopFailure}, thrown.getSuppressed());
        List<String> trace = callbacks.getTrace();
        assertEquals("teardown", trace.get(trace.size() - 1));
        assertFalse(framework.isCaseRunning());
    }

    @Test
    void testFailure_AssertingCheck_ContinuesAndReportsFailure() {
        // Given: check written with JUnit assertions, first combination expects Error
        RecordingCallbacks asserting = new RecordingCallbacks() {
            @Override
            public void check(int postCondition, State expected) {
                super.check(postCondition, expected);
                assertEquals("Ok", expected.getName());
            }
        };
        ActionRequirementItem item = spec(SPEED_LOAD_UID, speedLoadPreConditions(), List.of(
            row("Slow", "Empty", "Error"),
            row("Slow", "Full", "Ok"),
            row("Fast", "Empty", "Ok"),
            row("Fast", "Full", "Ok")
        )).compile();
        SynthesisRunner runner = createRunner(new RunnerConfig().withContinueOnCheckFailure(true));

        // When
        RunReport report = runner.run(item, ActionBinding.of(asserting));

        // Then
        assertEquals(RunStatus.FAILED, report.status());
        assertEquals(4, asserting.getActionCount());
        assertEquals(List.of("Slow/Full", "Fast/Empty", "Fast/Full"), framework.getPassed());
        assertInstanceOf(AssertionError.class, framework.getFailures().get("Slow/Empty"));
    }

    @Test
    void testFailure_AssertingCheck_StopsByDefault() {
        // Given
        RecordingCallbacks asserting = new RecordingCallbacks() {
            @Override
            public void check(int postCondition, State expected) {
                super.check(postCondition, expected);
                assertEquals("Ok", expected.getName());
            }
        };
        ActionRequirementItem item = speedLoadResultSpec().compile();
        SynthesisRunner runner = createRunner(new RunnerConfig());

        // When
        assertThrows(AssertionError.class, () -> runner.run(item, new ActionBinding(asserting, asserting)));

        // Then
        assertEquals(4, asserting.getActionCount());
        assertEquals(1, framework.getFailures().size());
        assertTrue(framework.getFailures().containsKey("Fast/Full"));
        List<String> trace = asserting.getTrace();
        assertEquals(List.of("check(0,Error)", "stop", "teardown"), trace.subList(trace.size() - 3, trace.size()));
    }
}
