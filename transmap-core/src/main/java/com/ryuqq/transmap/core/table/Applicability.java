package com.ryuqq.transmap.core.table;

/**
 * 엔트리에 대한 선행 조건 차원의 적용 여부.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public enum Applicability {

    /**
     * 이 차원의 상태가 결과에 영향을 줌.
     */
    APPLICABLE,

    /**
     * 이 차원의 상태가 결과에 영향을 주지 않음 (보고 시 NA로 대체).
     */
    NOT_APPLICABLE
}
