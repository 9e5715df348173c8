package com.ryuqq.transmap.application.item;

import com.ryuqq.transmap.application.port.ItemEmitter;

/**
 * 생성 대상 테스트 항목.
 *
 * <p>닫힌 variant 집합이며 {@link #kind()} 태그로 구분됩니다. 모든 variant는
 * 설명({@link #describe()}), 식별자 구성({@link #buildContext()}),
 * 생성 결과 전달({@link #emit(ItemEmitter)})을 공유합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public sealed interface TestItem
    permits TestCaseItem, TestSuiteItem, ActionRequirementItem, RuntimeMeasurementItem {

    ItemKind kind();

    String uid();

    String brief();

    /**
     * 상세 설명.
     *
     * @return 상세 설명 (없으면 null)
     */
    String description();

    /**
     * 생성 대상 식별자 구성.
     *
     * @return ItemContext
     */
    default ItemContext buildContext() {
        return ItemContext.of(kind(), uid());
    }

    /**
     * 치환된 설명 구성.
     *
     * @return ItemDescription
     */
    ItemDescription describe();

    /**
     * 치환된 생성 결과 구성.
     *
     * @return EmittedItem
     */
    EmittedItem render();

    /**
     * 생성 결과를 emitter에 전달.
     *
     * @param emitter 외부 emitter
     * @return 전달한 생성 결과
     * @throws IllegalArgumentException emitter가 null인 경우
     */
    default EmittedItem emit(ItemEmitter emitter) {
        if (emitter == null) {
            throw new IllegalArgumentException("emitter cannot be null");
        }
        EmittedItem emitted = render();
        emitter.emit(emitted);
        return emitted;
    }
}
