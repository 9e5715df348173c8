package com.ryuqq.transmap.testkit.contract;

import com.ryuqq.transmap.adapter.runner.RunnerConfig;
import com.ryuqq.transmap.adapter.runner.SynthesisRunner;
import com.ryuqq.transmap.application.item.ActionRequirementItem;
import com.ryuqq.transmap.application.item.EmittedItem;
import com.ryuqq.transmap.application.runner.ActionBinding;
import com.ryuqq.transmap.application.runner.RunReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the Speed/Load/Result end-to-end scenario.
 *
 * <p>Validates that a compiled action requirement drives the callbacks in nesting
 * order, reports a plan of four steps and exposes the scope of every combination.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>planSize() == 4 and the framework sees plan(4) before the first step</li>
 *   <li>prepare/action/check trace for all four combinations</li>
 *   <li>(Fast, Full) expects Result=Error</li>
 *   <li>Emitted item mirrors the run</li>
 * </ul>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class EndToEndContractTest extends AbstractContractTest {

    @Test
    void testEndToEnd_SpeedLoadResult_DispatchesFourCombinationsInOrder() {
        // Given: compiled Speed/Load/Result item
        ActionRequirementItem item = speedLoadResultSpec().compile();
        SynthesisRunner runner = createRunner(new RunnerConfig());

        // When
        RunReport report = runner.run(item, new ActionBinding(callbacks, callbacks));

        // Then: full trace
        assertTrace(
            "setup",
            "before", "prepare(0,Slow)", "prepare(1,Empty)", "action", "check(0,Ok)", "after",
            "before", "prepare(0,Slow)", "prepare(1,Full)", "action", "check(0,Ok)", "after",
            "before", "prepare(0,Fast)", "prepare(1,Empty)", "action", "check(0,Ok)", "after",
            "before", "prepare(0,Fast)", "prepare(1,Full)", "action", "check(0,Error)", "after",
            "stop",
            "teardown"
        );
        assertEquals(4, item.getSynthesizer().planSize());
        assertTrue(report.isPassed());
        assertEquals(List.of("Slow/Empty", "Slow/Full", "Fast/Empty", "Fast/Full"), callbacks.getActionScopes());
    }

    @Test
    void testEndToEnd_Framework_SeesPlanBeforeFirstStep() {
        // Given
        ActionRequirementItem item = speedLoadResultSpec().compile();
        SynthesisRunner runner = createRunner(new RunnerConfig());

        // When
        runner.run(item, ActionBinding.of(callbacks));

        // Then
        List<String> events = framework.getEvents();
        assertEquals("begin(TestCaseTransmapReqSpeedLoad)", events.get(0));
        assertEquals("plan(4)", events.get(1));
        assertEquals("scope(Slow/Empty)", events.get(2));
        assertEquals("end(TestCaseTransmapReqSpeedLoad)", events.get(events.size() - 1));
        assertEquals(List.of("Slow/Empty", "Slow/Full", "Fast/Empty", "Fast/Full"), framework.getPassed());
        assertTrue(framework.getFailures().isEmpty());
    }

    @Test
    void testEndToEnd_EmittedItem_MirrorsDispatchedCombinations() {
        // Given
        ActionRequirementItem item = speedLoadResultSpec().compile();

        // When
        EmittedItem emitted = item.emit(emitter);

        // Then
        assertEquals(4, emitted.planSteps());
        assertEquals("Fast/Full -> Result=Error", emitted.body().get(3));
        assertSame(emitted, emitter.find(SPEED_LOAD_UID).orElseThrow());
    }
}
