package com.ryuqq.transmap.application.runner;

/**
 * 항목 실행 상태.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public enum RunStatus {

    /**
     * 모든 조합이 실패 없이 실행됨.
     */
    PASSED,

    /**
     * 하나 이상의 조합이 실패함 (계속 진행 정책으로 끝까지 실행된 경우 포함).
     */
    FAILED,

    /**
     * 설정 오류로 항목이 실행되지 않음.
     */
    ABORTED
}
