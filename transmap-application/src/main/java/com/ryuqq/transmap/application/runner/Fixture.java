package com.ryuqq.transmap.application.runner;

/**
 * 액션 요구사항 실행을 감싸는 fixture 수명주기.
 *
 * <p>호출 순서: {@code setup → (조합 반복) → stop → teardown}.
 * 모든 메서드는 선택 사항이며 기본 구현은 아무 것도 하지 않습니다.
 * setup이 성공하면 실행 결과와 관계없이 teardown이 호출됩니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public interface Fixture {

    /**
     * 아무 것도 하지 않는 fixture.
     */
    Fixture NONE = new Fixture() {
    };

    default void setup() {
    }

    /**
     * 조합 반복이 끝난 직후 호출 (실패로 중단된 경우 포함).
     */
    default void stop() {
    }

    default void teardown() {
    }
}
