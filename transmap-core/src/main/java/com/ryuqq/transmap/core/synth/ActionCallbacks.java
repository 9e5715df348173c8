package com.ryuqq.transmap.core.synth;

import com.ryuqq.transmap.core.model.State;

/**
 * 외부 액션 실행 협력자가 제공하는 콜백.
 *
 * <p>콜백은 살아남은(건너뛰거나 가지치기되지 않은) 조합마다 다음 순서로 호출됩니다:</p>
 * <pre>
 * beforeVariant()
 * prepare(0, s0) ... prepare(n-1, s(n-1))   // 바깥 → 안쪽
 * action()
 * check(0, e0) ... check(m-1, e(m-1))       // 후행 조건 선언 순서
 * afterVariant()
 * </pre>
 *
 * <p>{@code action()}은 공유된 외부 상태를 변경할 수 있으므로 호출 순서가 곧 동작입니다.
 * 콜백이 던진 예외는 그대로 호출자에게 전파되며, 이후 조합은 실행되지 않습니다
 * ({@link FailureHandler}가 계속 진행을 요청한 경우 제외).</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public interface ActionCallbacks {

    /**
     * 선행 조건 상태 준비.
     *
     * @param preCondition 선행 조건 인덱스
     * @param state 유효 상태 (NA로 대체되었을 수 있음)
     */
    void prepare(int preCondition, State state);

    /**
     * 테스트 대상 액션 실행.
     */
    void action();

    /**
     * 후행 조건 검증.
     *
     * @param postCondition 후행 조건 인덱스
     * @param expected 기대 상태
     */
    void check(int postCondition, State expected);

    /**
     * 조합 실행 전 훅 (기본: 아무 것도 하지 않음).
     */
    default void beforeVariant() {
    }

    /**
     * 조합 실행 후 정리 훅 (기본: 아무 것도 하지 않음).
     */
    default void afterVariant() {
    }
}
