package com.ryuqq.transmap.adapter.inmemory.emitter;

import com.ryuqq.transmap.application.item.EmittedItem;
import com.ryuqq.transmap.application.item.TestCaseItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryItemEmitter}.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class InMemoryItemEmitterTest {

    @Test
    void emit_CollectsItemsInOrder() {
        // Given
        InMemoryItemEmitter emitter = new InMemoryItemEmitter();
        TestCaseItem first = new TestCaseItem("/val/first", "First.", null, List.of());
        TestCaseItem second = new TestCaseItem("/val/second", "Second.", null, List.of());

        // When
        EmittedItem emitted = first.emit(emitter);
        second.emit(emitter);

        // Then
        assertEquals(2, emitter.getEmitted().size());
        assertSame(emitted, emitter.getEmitted().get(0));
        assertEquals("TestCaseValSecond", emitter.find("/val/second").orElseThrow().context().groupIdentifier());
        assertTrue(emitter.find("/val/none").isEmpty());
    }

    @Test
    void emit_Null_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryItemEmitter().emit(null));
    }
}
