package com.ryuqq.transmap.core.synth;

/**
 * 콜백 실패에 대한 호출자의 결정.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public enum Resolution {

    /**
     * 즉시 중단하고 원래 예외를 전파.
     */
    STOP,

    /**
     * 현재 조합을 정리하고 다음 조합으로 진행.
     */
    CONTINUE
}
