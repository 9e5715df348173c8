package com.ryuqq.transmap.core.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 하나의 조합(또는 NA로 묶인 조합 그룹)에 대해 미리 계산된 엔트리.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>applicability:</strong> 선행 조건별 적용 여부</li>
 *   <li><strong>expected:</strong> 후행 조건별 기대 상태 인덱스</li>
 *   <li><strong>skip:</strong> true이면 콜백 없이 건너뜀</li>
 *   <li><strong>skipReason:</strong> 건너뛰는 이유 (null 가능)</li>
 * </ul>
 *
 * <p>길이와 범위 검증은 조건 모델을 알고 있는 {@link TransitionTable}이 수행합니다.</p>
 *
 * @param applicability 선행 조건별 적용 여부
 * @param expected 후행 조건별 기대 상태 인덱스
 * @param skip 건너뛰기 여부
 * @param skipReason 건너뛰는 이유 (null 가능)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record TransitionEntry(
    List<Applicability> applicability,
    List<Integer> expected,
    boolean skip,
    String skipReason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException applicability 또는 expected가 null인 경우
     */
    public TransitionEntry {
        if (applicability == null) {
            throw new IllegalArgumentException("applicability cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        applicability = List.copyOf(applicability);
        expected = List.copyOf(expected);
        // skipReason은 null 허용
    }

    /**
     * 모든 선행 조건이 적용되는 엔트리 생성.
     *
     * @param preConditionCount 선행 조건 수
     * @param expected 후행 조건별 기대 상태 인덱스
     * @return TransitionEntry 인스턴스
     */
    public static TransitionEntry of(int preConditionCount, int... expected) {
        return new TransitionEntry(
            Collections.nCopies(preConditionCount, Applicability.APPLICABLE), boxed(expected), false, null);
    }

    /**
     * 적용 여부를 지정한 엔트리 생성.
     *
     * @param applicability 선행 조건별 적용 여부
     * @param expected 후행 조건별 기대 상태 인덱스
     * @return TransitionEntry 인스턴스
     */
    public static TransitionEntry of(List<Applicability> applicability, int... expected) {
        return new TransitionEntry(applicability, boxed(expected), false, null);
    }

    /**
     * 건너뛰는 엔트리 생성.
     *
     * <p>기대 상태는 사용되지 않으므로 모두 0으로 채워집니다.</p>
     *
     * @param preConditionCount 선행 조건 수
     * @param postConditionCount 후행 조건 수
     * @param reason 건너뛰는 이유 (null 가능)
     * @return skip 엔트리
     */
    public static TransitionEntry skipped(int preConditionCount, int postConditionCount, String reason) {
        return new TransitionEntry(
            Collections.nCopies(preConditionCount, Applicability.APPLICABLE),
            Collections.nCopies(postConditionCount, 0), true, reason);
    }

    /**
     * 차원이 NA로 표시되었는지 확인.
     *
     * @param dimension 선행 조건 인덱스
     * @return NOT_APPLICABLE이면 true
     */
    public boolean isNotApplicable(int dimension) {
        return applicability.get(dimension) == Applicability.NOT_APPLICABLE;
    }

    /**
     * NA로 표시된 차원이 하나라도 있는지 확인.
     *
     * @return NOT_APPLICABLE 차원 존재 여부
     */
    public boolean hasNotApplicable() {
        return applicability.contains(Applicability.NOT_APPLICABLE);
    }

    public int expectedAt(int postCondition) {
        return expected.get(postCondition);
    }

    private static List<Integer> boxed(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int value : values) {
            list.add(value);
        }
        return list;
    }
}
