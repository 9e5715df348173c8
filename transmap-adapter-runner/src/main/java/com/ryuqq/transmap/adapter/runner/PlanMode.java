package com.ryuqq.transmap.adapter.runner;

/**
 * 계획 크기 보고 시점.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public enum PlanMode {

    /**
     * 조합 반복 전에 보고 (dry pass로 계산).
     */
    UPFRONT,

    /**
     * 실행이 끝난 뒤 한 번 보고.
     */
    LAZY
}
