package com.ryuqq.transmap.core.synth;

/**
 * 방문한 조합의 처리 방식.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public enum Disposition {

    /**
     * prepare → action → check 콜백 실행.
     */
    DISPATCH,

    /**
     * 엔트리의 skip 플래그로 콜백 없이 건너뜀.
     */
    SKIP,

    /**
     * skip-ahead 표시로 안쪽 하위 곱 전체를 가지치기.
     */
    PRUNE
}
