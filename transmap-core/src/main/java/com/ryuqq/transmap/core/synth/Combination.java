package com.ryuqq.transmap.core.synth;

import com.ryuqq.transmap.core.model.State;
import com.ryuqq.transmap.core.table.TransitionEntry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 열거 중 방문한 조합 하나의 스냅샷.
 *
 * <p>반복 벡터(iteration)는 실제로 열거된 상태 인덱스이고, 유효 벡터(effective)는
 * NA 대체가 적용되어 prepare 콜백과 보고에 사용되는 상태입니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class Combination {

    private final int generationIndex;
    private final int storageIndex;
    private final int[] iteration;
    private final List<State> effective;
    private final List<State> expected;
    private final TransitionEntry entry;
    private final Disposition disposition;
    private final int prunedDimension;
    private final int prunedCount;

    Combination(int generationIndex, int storageIndex, int[] iteration, List<State> effective,
                List<State> expected, TransitionEntry entry, Disposition disposition,
                int prunedDimension, int prunedCount) {
        this.generationIndex = generationIndex;
        this.storageIndex = storageIndex;
        this.iteration = iteration.clone();
        this.effective = List.copyOf(effective);
        this.expected = List.copyOf(expected);
        this.entry = entry;
        this.disposition = disposition;
        this.prunedDimension = prunedDimension;
        this.prunedCount = prunedCount;
    }

    public int getGenerationIndex() {
        return generationIndex;
    }

    public int getStorageIndex() {
        return storageIndex;
    }

    /**
     * 반복 벡터 조회.
     *
     * @return 상태 인덱스 벡터 사본 (바깥 → 안쪽)
     */
    public int[] getIteration() {
        return iteration.clone();
    }

    public int iterationAt(int dimension) {
        return iteration[dimension];
    }

    public List<State> getEffective() {
        return effective;
    }

    public State effectiveAt(int dimension) {
        return effective.get(dimension);
    }

    /**
     * 후행 조건별 기대 상태.
     *
     * @return 기대 상태 목록 (SKIP 조합이면 의미 없음)
     */
    public List<State> getExpected() {
        return expected;
    }

    public State expectedAt(int postCondition) {
        return expected.get(postCondition);
    }

    public TransitionEntry getEntry() {
        return entry;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    public boolean isDispatched() {
        return disposition == Disposition.DISPATCH;
    }

    /**
     * 가지치기를 유발한 차원.
     *
     * @return PRUNE이면 차원 인덱스, 아니면 -1
     */
    public int getPrunedDimension() {
        return prunedDimension;
    }

    /**
     * 가지치기로 실행되지 않는 구체 조합 수 (이 조합 포함, NA 슬롯 위치 제외).
     *
     * @return PRUNE이면 1 이상, 아니면 0
     */
    public int getPrunedCount() {
        return prunedCount;
    }

    /**
     * 출력 가능한 scope 문자열.
     *
     * <p>유효 상태 이름을 {@code /}로 연결합니다 (예: {@code Fast/NA}).</p>
     *
     * @return scope 문자열
     */
    public String scope() {
        return effective.stream().map(State::getName).collect(Collectors.joining("/"));
    }

    @Override
    public String toString() {
        return "Combination{" + generationIndex + ":" + scope() + ", " + disposition + '}';
    }
}
