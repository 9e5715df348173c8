package com.ryuqq.transmap.core.table;

import java.util.List;

/**
 * 명세 로더가 전달하는 원시 전이 맵 행.
 *
 * <p>선행 조건마다 구체 상태 이름 또는 {@code NA}를, 후행 조건마다 기대 상태 이름을
 * 지정합니다. 기대 상태 대신 skip reason을 지정하면 해당 행은 건너뛰는 엔트리가 됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * TransitionRow.of(List.of("Fast", "NA"), List.of("Ok"));
 * TransitionRow.skip(List.of("Slow", "Full"), "NotSupported");
 * </pre>
 *
 * @param preStates 선행 조건별 상태 이름 또는 {@code NA}
 * @param postStates 후행 조건별 기대 상태 이름 (skip 행이면 빈 목록)
 * @param skipReason skip reason 이름 (null 가능)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record TransitionRow(
    List<String> preStates,
    List<String> postStates,
    String skipReason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException preStates 또는 postStates가 null인 경우
     */
    public TransitionRow {
        if (preStates == null) {
            throw new IllegalArgumentException("preStates cannot be null");
        }
        if (postStates == null) {
            throw new IllegalArgumentException("postStates cannot be null");
        }
        preStates = List.copyOf(preStates);
        postStates = List.copyOf(postStates);
    }

    /**
     * 기대 상태를 가진 행 생성.
     *
     * @param preStates 선행 조건별 상태 이름 또는 NA
     * @param postStates 후행 조건별 기대 상태 이름
     * @return TransitionRow 인스턴스
     */
    public static TransitionRow of(List<String> preStates, List<String> postStates) {
        return new TransitionRow(preStates, postStates, null);
    }

    /**
     * 건너뛰는 행 생성.
     *
     * @param preStates 선행 조건별 상태 이름 또는 NA
     * @param skipReason skip reason 이름
     * @return TransitionRow 인스턴스
     */
    public static TransitionRow skip(List<String> preStates, String skipReason) {
        if (skipReason == null || skipReason.isBlank()) {
            throw new IllegalArgumentException("skipReason cannot be null or blank");
        }
        return new TransitionRow(preStates, List.of(), skipReason);
    }

    public boolean isSkip() {
        return skipReason != null;
    }
}
