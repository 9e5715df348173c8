package com.ryuqq.transmap.application.generation;

import com.ryuqq.transmap.application.item.EmittedItem;
import com.ryuqq.transmap.application.item.ItemKind;
import com.ryuqq.transmap.application.item.MeasurementRequest;
import com.ryuqq.transmap.application.item.RuntimeMeasurementItem;
import com.ryuqq.transmap.application.item.TestCaseItem;
import com.ryuqq.transmap.application.item.TestItem;
import com.ryuqq.transmap.application.item.TestSuiteItem;
import com.ryuqq.transmap.application.port.ItemEmitter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * ItemGenerator 유닛 테스트.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ItemGeneratorTest {

    @Mock
    private ItemEmitter emitter;

    @Test
    void 스위트_먼저_측정_마지막_순서로_전달() {
        // given
        List<TestItem> items = List.of(
            new RuntimeMeasurementItem("/perf/sem", "Measures.", null,
                List.of(new MeasurementRequest("Obtain", "Obtain an available semaphore."))),
            new TestCaseItem("/val/a", "A.", null, List.of()),
            new TestSuiteItem("/suite/one", "Suite.", null, "One", "T_TEST_SUITE(One);"),
            new TestCaseItem("/val/b", "B.", null, List.of())
        );
        ItemGenerator generator = new ItemGenerator(emitter);

        // when
        List<EmittedItem> emitted = generator.generate(items);

        // then
        ArgumentCaptor<EmittedItem> captor = ArgumentCaptor.forClass(EmittedItem.class);
        verify(emitter, times(4)).emit(captor.capture());
        assertThat(captor.getAllValues()).isEqualTo(emitted);
        assertThat(emitted).extracting(e -> e.description().name())
            .containsExactly("/suite/one", "/val/a", "/val/b", "/perf/sem");
        assertThat(emitted.get(0).kind()).isEqualTo(ItemKind.TEST_SUITE);
        assertThat(emitted.get(3).body()).containsExactly("PerfSem_Obtain");
    }

    @Test
    void null_emitter는_예외() {
        assertThatThrownBy(() -> new ItemGenerator(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("emitter cannot be null");
    }
}
