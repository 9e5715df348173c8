package com.ryuqq.transmap.testkit.contract;

import com.ryuqq.transmap.adapter.runner.RunnerConfig;
import com.ryuqq.transmap.adapter.runner.SuiteReport;
import com.ryuqq.transmap.adapter.runner.SuiteRunner;
import com.ryuqq.transmap.application.runner.ActionBinding;
import com.ryuqq.transmap.application.runner.RunStatus;
import com.ryuqq.transmap.core.error.ConfigurationException;
import com.ryuqq.transmap.core.model.Condition;
import com.ryuqq.transmap.core.model.ConditionModel;
import com.ryuqq.transmap.core.model.State;
import com.ryuqq.transmap.core.table.TransitionEntry;
import com.ryuqq.transmap.core.table.TransitionTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for configuration errors.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A dense table of 3 entries for a generation space of 4 fails construction</li>
 *   <li>A broken action requirement aborts only itself within a suite</li>
 * </ul>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class ConfigurationContractTest extends AbstractContractTest {

    @Test
    void testConfiguration_DenseTableTooSmall_ThrowsConfigurationException() {
        // Given: 2 × 2 generation space
        ConditionModel model = new ConditionModel(
            List.of(
                Condition.preExempt("Speed", State.of("Slow"), State.of("Fast")),
                Condition.preExempt("Load", State.of("Empty"), State.of("Full"))
            ),
            List.of(resultCondition())
        );
        List<TransitionEntry> entries = List.of(
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0)
        );

        // When/Then
        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> TransitionTable.dense(model, entries));
        assertEquals("entries", exception.getField());
    }

    @Test
    void testConfiguration_BrokenItem_AbortsOnlyItself() {
        // Given
        source.register(speedLoadResultSpec())
            .register(spec("/transmap/req/broken", speedLoadPreConditions(), List.of(
                row("Slow", "Empty", "Ok"),
                row("Slow", "Empty", "Error")
            )));
        SuiteRunner suiteRunner = new SuiteRunner(source, item -> ActionBinding.of(callbacks),
            createRunner(new RunnerConfig()));

        // When
        SuiteReport report = suiteRunner.runAll();

        // Then
        assertEquals(RunStatus.PASSED, report.reports().get(0).status());
        assertEquals(RunStatus.ABORTED, report.reports().get(1).status());
        assertTrue(report.reports().get(1).message().contains("overlaps"));
        assertFalse(framework.getEvents().contains("begin(TestCaseTransmapReqBroken)"));
        assertEquals(4, callbacks.getActionCount());
    }
}
