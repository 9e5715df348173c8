package com.ryuqq.transmap.adapter.runner;

/**
 * SynthesisRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>planMode: 계획 크기 보고 시점 (기본 UPFRONT)</li>
 *   <li>continueOnCheckFailure: check 단계 실패 후 다음 조합으로 계속 진행 (기본 false)</li>
 *   <li>logCombinations: 조합마다 scope를 debug 로그로 남김 (기본 false)</li>
 * </ul>
 *
 * <p>check 이외 단계(prepare, action, fixture hook)의 실패는 설정과 관계없이 실행을 중단합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 * @param planMode 계획 크기 보고 시점 (null 불가)
 * @param continueOnCheckFailure check 실패 시 계속 진행 여부
 * @param logCombinations 조합별 debug 로그 여부
 */
public record RunnerConfig(
    PlanMode planMode,
    boolean continueOnCheckFailure,
    boolean logCombinations
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: planMode=UPFRONT, continueOnCheckFailure=false, logCombinations=false</p>
     */
    public RunnerConfig() {
        this(PlanMode.UPFRONT, false, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException planMode가 null인 경우
     */
    public RunnerConfig {
        if (planMode == null) {
            throw new IllegalArgumentException("planMode cannot be null");
        }
    }

    /**
     * planMode만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withPlanMode(PlanMode planMode) {
        return new RunnerConfig(planMode, continueOnCheckFailure, logCombinations);
    }

    /**
     * continueOnCheckFailure만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withContinueOnCheckFailure(boolean continueOnCheckFailure) {
        return new RunnerConfig(planMode, continueOnCheckFailure, logCombinations);
    }

    /**
     * logCombinations만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withLogCombinations(boolean logCombinations) {
        return new RunnerConfig(planMode, continueOnCheckFailure, logCombinations);
    }
}
