package com.ryuqq.transmap.application.runner;

import com.ryuqq.transmap.core.synth.ActionCallbacks;

/**
 * 액션 요구사항 하나에 연결되는 콜백과 fixture.
 *
 * @param callbacks 조합별 콜백
 * @param fixture 실행 전체를 감싸는 fixture
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record ActionBinding(ActionCallbacks callbacks, Fixture fixture) {

    public ActionBinding {
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        if (fixture == null) {
            throw new IllegalArgumentException("fixture cannot be null");
        }
    }

    /**
     * fixture 없는 바인딩.
     *
     * @param callbacks 조합별 콜백
     * @return ActionBinding
     */
    public static ActionBinding of(ActionCallbacks callbacks) {
        return new ActionBinding(callbacks, Fixture.NONE);
    }
}
