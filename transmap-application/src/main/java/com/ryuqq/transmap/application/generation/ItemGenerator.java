package com.ryuqq.transmap.application.generation;

import com.ryuqq.transmap.application.item.EmittedItem;
import com.ryuqq.transmap.application.item.TestItem;
import com.ryuqq.transmap.application.port.ItemEmitter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 항목 목록을 생성 순서대로 emitter에 전달.
 *
 * <p>테스트 스위트가 먼저, 그 다음 테스트 케이스와 액션 요구사항, 마지막으로 런타임 측정이
 * 전달됩니다. 같은 그룹 안에서는 선언 순서를 유지합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class ItemGenerator {

    private final ItemEmitter emitter;

    /**
     * 생성자.
     *
     * @param emitter 생성 결과를 받을 emitter
     * @throws IllegalArgumentException emitter가 null인 경우
     */
    public ItemGenerator(ItemEmitter emitter) {
        if (emitter == null) {
            throw new IllegalArgumentException("emitter cannot be null");
        }
        this.emitter = emitter;
    }

    /**
     * 항목 생성.
     *
     * @param items 생성할 항목
     * @return 전달한 생성 결과 (전달 순서)
     */
    public List<EmittedItem> generate(List<? extends TestItem> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        List<TestItem> ordered = new ArrayList<>(items);
        ordered.sort(Comparator.comparingInt(ItemGenerator::emissionGroup));

        List<EmittedItem> emitted = new ArrayList<>(ordered.size());
        for (TestItem item : ordered) {
            emitted.add(item.emit(emitter));
        }
        return emitted;
    }

    static int emissionGroup(TestItem item) {
        return switch (item.kind()) {
            case TEST_SUITE -> 0;
            case TEST_CASE, ACTION_REQUIREMENT -> 1;
            case RUNTIME_MEASUREMENT -> 2;
        };
    }
}
