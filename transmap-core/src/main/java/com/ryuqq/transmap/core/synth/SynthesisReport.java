package com.ryuqq.transmap.core.synth;

/**
 * 합성 실행 결과 집계.
 *
 * @param visited 방문한 단계 수 (DISPATCH + SKIP + PRUNE)
 * @param dispatched 콜백을 실행한 조합 수
 * @param skipped skip 엔트리로 건너뛴 조합 수
 * @param pruned 가지치기로 실행되지 않은 구체 조합 수 (NA 슬롯 위치 제외)
 * @param continuedFailures 실패했지만 핸들러가 계속 진행을 결정한 조합 수
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record SynthesisReport(
    int visited,
    int dispatched,
    int skipped,
    int pruned,
    int continuedFailures
) {

    /**
     * 실패 없이 끝났는지 확인.
     *
     * @return 계속 진행된 실패가 없으면 true
     */
    public boolean isClean() {
        return continuedFailures == 0;
    }
}
