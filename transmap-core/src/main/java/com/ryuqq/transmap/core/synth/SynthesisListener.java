package com.ryuqq.transmap.core.synth;

/**
 * 조합 방문 관찰자.
 *
 * <p>진행 상황 보고와 실패 위치 파악(scope)을 위해 runner가 사용합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public interface SynthesisListener {

    /**
     * 아무 것도 하지 않는 리스너.
     */
    SynthesisListener NONE = new SynthesisListener() {
    };

    /**
     * 콜백 실행 직전 호출.
     *
     * @param combination 실행할 조합
     */
    default void onDispatch(Combination combination) {
    }

    /**
     * 콜백 없이 지나간 조합(SKIP, PRUNE)에 대해 호출.
     *
     * @param combination 건너뛴 조합
     */
    default void onPass(Combination combination) {
    }
}
