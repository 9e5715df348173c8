package com.ryuqq.transmap.core.model;

/**
 * 조건 종류.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public enum ConditionKind {

    /**
     * 선행 조건 (독립 입력 차원, NA sentinel 보유).
     */
    PRE,

    /**
     * 후행 조건 (기대 결과 차원, NA sentinel 없음).
     */
    POST
}
