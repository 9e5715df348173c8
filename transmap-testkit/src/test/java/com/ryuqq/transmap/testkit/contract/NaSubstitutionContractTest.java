package com.ryuqq.transmap.testkit.contract;

import com.ryuqq.transmap.adapter.runner.RunnerConfig;
import com.ryuqq.transmap.application.item.ActionRequirementItem;
import com.ryuqq.transmap.application.runner.ActionBinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for NA substitution.
 *
 * <p>When the entry of a combination marks a pre-condition not applicable, that
 * pre-condition is prepared with the NA sentinel and its scope reads {@code NA},
 * regardless of the concrete state the odometer is on.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class NaSubstitutionContractTest extends AbstractContractTest {

    private ActionRequirementItem fastIgnoresLoad() {
        return spec(SPEED_LOAD_UID, speedLoadPreConditions(), List.of(
            row("Slow", "Empty", "Ok"),
            row("Slow", "Full", "Ok"),
            row("Fast", "NA", "Error")
        )).compile();
    }

    @Test
    void testNaSubstitution_NotApplicableDimensionPreparedWithSentinel() {
        // Given
        ActionRequirementItem item = fastIgnoresLoad();

        // When
        createRunner(new RunnerConfig()).run(item, ActionBinding.of(callbacks));

        // Then: both Fast combinations prepare Load as NA
        assertEquals(List.of(
            "prepare(0,Slow)", "prepare(1,Empty)",
            "prepare(0,Slow)", "prepare(1,Full)",
            "prepare(0,Fast)", "prepare(1,NA)",
            "prepare(0,Fast)", "prepare(1,NA)"
        ), callbacks.traceOf("prepare"));
        assertEquals(List.of("Slow/Empty", "Slow/Full", "Fast/NA", "Fast/NA"), callbacks.getActionScopes());
    }

    @Test
    void testNaSubstitution_NotApplicableSlotsNeverDispatched() {
        // Given
        ActionRequirementItem item = fastIgnoresLoad();

        // When
        int planSize = item.getSynthesizer().planSize();

        // Then: 9 positions, 5 of them hold an NA slot
        assertEquals(9, item.getTable().generationSize());
        assertEquals(4, planSize);
    }
}
