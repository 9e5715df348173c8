package com.ryuqq.transmap.core.synth;

/**
 * 조합 하나를 실행하는 동안의 콜백 단계.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public enum Phase {
    BEFORE_VARIANT,
    PREPARE,
    ACTION,
    CHECK,
    AFTER_VARIANT
}
