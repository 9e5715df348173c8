package com.ryuqq.transmap.application.runner;

import com.ryuqq.transmap.core.synth.SynthesisReport;

/**
 * 항목 하나의 실행 결과.
 *
 * <p><strong>상태별 필드:</strong></p>
 * <ul>
 *   <li>PASSED: synthesis != null, message == null</li>
 *   <li>FAILED: synthesis는 계속 진행된 경우에만 존재, message = 실패 메시지</li>
 *   <li>ABORTED: synthesis == null, planSize == 0, message = 설정 오류 메시지</li>
 * </ul>
 *
 * @param uid 항목 uid
 * @param status 실행 상태
 * @param planSize 계획 크기
 * @param synthesis 합성 실행 집계 (nullable)
 * @param message 실패 또는 중단 메시지 (nullable)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record RunReport(
    String uid,
    RunStatus status,
    int planSize,
    SynthesisReport synthesis,
    String message
) {

    public RunReport {
        if (uid == null || uid.isBlank()) {
            throw new IllegalArgumentException("uid cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static RunReport passed(String uid, int planSize, SynthesisReport synthesis) {
        return new RunReport(uid, RunStatus.PASSED, planSize, synthesis, null);
    }

    public static RunReport failed(String uid, int planSize, SynthesisReport synthesis, String message) {
        return new RunReport(uid, RunStatus.FAILED, planSize, synthesis, message);
    }

    public static RunReport aborted(String uid, String message) {
        return new RunReport(uid, RunStatus.ABORTED, 0, null, message);
    }

    public boolean isPassed() {
        return status == RunStatus.PASSED;
    }
}
