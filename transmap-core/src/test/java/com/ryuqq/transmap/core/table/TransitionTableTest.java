package com.ryuqq.transmap.core.table;

import com.ryuqq.transmap.core.error.ConfigurationException;
import com.ryuqq.transmap.core.model.Condition;
import com.ryuqq.transmap.core.model.ConditionModel;
import com.ryuqq.transmap.core.model.State;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TransitionTable 생성 시 불변식 검증 테스트.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class TransitionTableTest {

    /** Speed × Load, 둘 다 NA 면제 → 생성 순서 공간 4. */
    private static final ConditionModel MODEL = new ConditionModel(
        List.of(
            Condition.preExempt("Speed", State.of("Slow"), State.of("Fast")),
            Condition.preExempt("Load", State.of("Empty"), State.of("Full"))
        ),
        List.of(Condition.post("Result", State.of("Ok"), State.of("Error")))
    );

    private static List<TransitionEntry> fourEntries() {
        return List.of(
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 1)
        );
    }

    @Test
    void dense_ExactSize_IsIdentityMapped() {
        // When
        TransitionTable table = TransitionTable.dense(MODEL, fourEntries());

        // Then
        assertTrue(table.isDense());
        assertEquals(4, table.generationSize());
        assertEquals(1, table.entryAt(3).expectedAt(0));
    }

    @Test
    void dense_ThreeEntriesForSpaceOfFour_ThrowsConfigurationException() {
        // Given
        List<TransitionEntry> entries = fourEntries().subList(0, 3);

        // When
        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> TransitionTable.dense(MODEL, entries));

        // Then
        assertEquals("entries", exception.getField());
        assertTrue(exception.getMessage().contains("3 entries"));
    }

    @Test
    void constructor_OrderMapLengthMismatch_ThrowsConfigurationException() {
        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new TransitionTable(MODEL, fourEntries(), new int[] {0, 1, 2}));

        assertEquals("orderMap", exception.getField());
    }

    @Test
    void constructor_OrderMapValueOutOfRange_ThrowsConfigurationException() {
        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new TransitionTable(MODEL, fourEntries(), new int[] {0, 4, 2, 3}));

        assertEquals("orderMap[1]", exception.getField());
    }

    @Test
    void constructor_OrphanEntry_ThrowsConfigurationException() {
        // Given: entry 2 never referenced
        int[] orderMap = {0, 1, 1, 3};

        // When
        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new TransitionTable(MODEL, fourEntries(), orderMap));

        // Then
        assertEquals("entries[2]", exception.getField());
    }

    @Test
    void constructor_SharedEntries_IsNotDense() {
        // Given: two entries shared by all four positions
        List<TransitionEntry> entries = List.of(TransitionEntry.of(2, 0), TransitionEntry.of(2, 1));

        // When
        TransitionTable table = new TransitionTable(MODEL, entries, new int[] {0, 0, 0, 1});

        // Then
        assertFalse(table.isDense());
        assertEquals(0, table.storageIndexOf(2));
        assertEquals(1, table.entryAt(3).expectedAt(0));
    }

    @Test
    void constructor_ExpectedStateOutOfRange_ThrowsConfigurationException() {
        // Given
        List<TransitionEntry> entries = List.of(
            TransitionEntry.of(2, 2),
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0)
        );

        // When
        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> TransitionTable.dense(MODEL, entries));

        // Then
        assertEquals("entries[0].expected[0]", exception.getField());
    }

    @Test
    void constructor_ExpectedLengthMismatch_ThrowsConfigurationException() {
        List<TransitionEntry> entries = List.of(
            TransitionEntry.of(2, 0, 0),
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0)
        );

        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> TransitionTable.dense(MODEL, entries));

        assertEquals("entries[0].expected", exception.getField());
    }

    @Test
    void constructor_NotApplicableOnExemptDimension_ThrowsConfigurationException() {
        // Given
        TransitionEntry naLoad = TransitionEntry.of(
            List.of(Applicability.APPLICABLE, Applicability.NOT_APPLICABLE), 0);
        List<TransitionEntry> entries = List.of(
            naLoad,
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0),
            TransitionEntry.of(2, 0)
        );

        // When
        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> TransitionTable.dense(MODEL, entries));

        // Then
        assertEquals("entries[0].applicability[1]", exception.getField());
    }
}
