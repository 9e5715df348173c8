package com.ryuqq.transmap.core.codec;

import com.ryuqq.transmap.core.error.ConfigurationException;
import com.ryuqq.transmap.core.error.StateIndexOutOfRangeException;
import com.ryuqq.transmap.core.model.Condition;
import com.ryuqq.transmap.core.model.ConditionModel;
import com.ryuqq.transmap.core.model.State;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IndexCodec 테스트.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class IndexCodecTest {

    @Test
    void weights_Radices324_Returns841() {
        // Given
        IndexCodec codec = new IndexCodec(3, 2, 4);

        // When & Then
        assertArrayEquals(new int[] {8, 4, 1}, codec.weights());
        assertEquals(24, codec.size());
        assertEquals(3, codec.dimensions());
    }

    @Test
    void encode_InnermostDimensionIsFastest() {
        // Given
        IndexCodec codec = new IndexCodec(3, 2, 4);

        // When & Then
        assertEquals(0, codec.encode(0, 0, 0));
        assertEquals(1, codec.encode(0, 0, 1));
        assertEquals(4, codec.encode(0, 1, 0));
        assertEquals(23, codec.encode(2, 1, 3));
    }

    @Test
    void decode_EveryIndex_RoundTripsThroughEncode() {
        // Given
        IndexCodec codec = new IndexCodec(3, 2, 4);

        // When & Then
        for (int index = 0; index < codec.size(); index++) {
            assertEquals(index, codec.encode(codec.decode(index)));
        }
        assertArrayEquals(new int[] {1, 0, 2}, codec.decode(10));
    }

    @Test
    void encode_ComponentEqualToRadix_ThrowsStateIndexOutOfRange() {
        // Given
        IndexCodec codec = new IndexCodec(3, 2, 4);

        // When
        StateIndexOutOfRangeException exception = assertThrows(StateIndexOutOfRangeException.class,
            () -> codec.encode(3, 0, 0));

        // Then
        assertEquals(0, exception.getDimension());
        assertEquals(3, exception.getValue());
        assertEquals(3, exception.getBound());
    }

    @Test
    void encode_NegativeComponent_ThrowsStateIndexOutOfRange() {
        IndexCodec codec = new IndexCodec(3, 2, 4);

        StateIndexOutOfRangeException exception = assertThrows(StateIndexOutOfRangeException.class,
            () -> codec.encode(0, -1, 0));

        assertEquals(1, exception.getDimension());
    }

    @Test
    void encode_WrongVectorLength_ThrowsIllegalArgument() {
        IndexCodec codec = new IndexCodec(3, 2, 4);

        assertThrows(IllegalArgumentException.class, () -> codec.encode(1, 1));
    }

    @Test
    void decode_IndexOutsideSpace_ThrowsStateIndexOutOfRange() {
        // Given
        IndexCodec codec = new IndexCodec(3, 2, 4);

        // When & Then
        StateIndexOutOfRangeException upper = assertThrows(StateIndexOutOfRangeException.class,
            () -> codec.decode(24));
        assertEquals(-1, upper.getDimension());
        assertEquals(24, upper.getBound());
        assertThrows(StateIndexOutOfRangeException.class, () -> codec.decode(-1));
    }

    @Test
    void constructor_ZeroRadix_ThrowsConfigurationException() {
        assertThrows(ConfigurationException.class, () -> new IndexCodec(2, 0));
    }

    @Test
    void constructor_ProductOverflowsInt_ThrowsConfigurationException() {
        assertThrows(ConfigurationException.class, () -> new IndexCodec(65536, 65536));
    }

    @Test
    void forGenerationSpace_AddsNotApplicableSlotOnlyForCarryingConditions() {
        // Given
        ConditionModel model = new ConditionModel(
            List.of(
                Condition.pre("Speed", State.of("Slow"), State.of("Fast")),
                Condition.preExempt("Mode", State.of("A"), State.of("B"), State.of("C"))
            ),
            List.of(Condition.post("Result", State.of("Ok")))
        );

        // When
        IndexCodec codec = IndexCodec.forGenerationSpace(model);

        // Then
        assertArrayEquals(new int[] {3, 3}, codec.radices());
        assertEquals(9, codec.size());
    }
}
