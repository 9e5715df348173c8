package com.ryuqq.transmap.core.synth;

/**
 * 콜백 실패 처리 계약.
 *
 * <p>Synthesizer 자체는 실패 허용 정책을 갖지 않습니다. 호출자가 등록한 핸들러의
 * 결정에 따라 중단하거나 다음 조합으로 진행할 뿐입니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureHandler {

    /**
     * 항상 중단하는 기본 핸들러.
     */
    FailureHandler STOP = (combination, phase, failure) -> Resolution.STOP;

    /**
     * 콜백 실패 처리.
     *
     * @param combination 실패한 조합
     * @param phase 실패한 단계
     * @param failure 콜백이 던진 예외 또는 {@link AssertionError}
     * @return STOP이면 예외를 그대로 전파, CONTINUE이면 다음 조합으로 진행
     */
    Resolution onFailure(Combination combination, Phase phase, Throwable failure);
}
