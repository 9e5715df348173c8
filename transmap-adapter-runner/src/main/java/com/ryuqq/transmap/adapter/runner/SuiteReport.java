package com.ryuqq.transmap.adapter.runner;

import com.ryuqq.transmap.application.runner.RunReport;
import com.ryuqq.transmap.application.runner.RunStatus;

import java.util.List;

/**
 * 스위트 실행 결과.
 *
 * @param reports 항목별 실행 결과 (실행 순서)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record SuiteReport(List<RunReport> reports) {

    public SuiteReport {
        reports = reports == null ? List.of() : List.copyOf(reports);
    }

    public long count(RunStatus status) {
        return reports.stream().filter(r -> r.status() == status).count();
    }

    /**
     * 모든 항목이 통과했는지 확인.
     *
     * @return 실패 또는 중단된 항목이 없으면 true
     */
    public boolean isAllPassed() {
        return reports.stream().allMatch(RunReport::isPassed);
    }
}
