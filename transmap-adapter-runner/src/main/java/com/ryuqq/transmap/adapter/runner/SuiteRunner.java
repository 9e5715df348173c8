package com.ryuqq.transmap.adapter.runner;

import com.ryuqq.transmap.application.item.ActionRequirementItem;
import com.ryuqq.transmap.application.item.ActionRequirementSpec;
import com.ryuqq.transmap.application.port.ActionBindingProvider;
import com.ryuqq.transmap.application.port.SpecificationSource;
import com.ryuqq.transmap.application.runner.ItemRunner;
import com.ryuqq.transmap.application.runner.RunReport;
import com.ryuqq.transmap.application.runner.RunStatus;
import com.ryuqq.transmap.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 명세 소스의 모든 액션 요구사항을 항목별로 격리하여 실행하는 Runner.
 *
 * <p><strong>격리 규칙:</strong></p>
 * <ul>
 *   <li>조건 모델 또는 전이 맵 검증 실패({@link ConfigurationException}) → 해당 항목 ABORTED</li>
 *   <li>실행 중 콜백 실패 (assertion 실패 포함) → 해당 항목 FAILED</li>
 *   <li>어느 경우든 나머지 항목은 계속 실행됨</li>
 * </ul>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class SuiteRunner {

    private static final Logger log = LoggerFactory.getLogger(SuiteRunner.class);

    private final SpecificationSource source;
    private final ActionBindingProvider bindings;
    private final ItemRunner runner;

    /**
     * 생성자.
     *
     * @param source 명세 소스
     * @param bindings 항목별 콜백 제공자
     * @param runner 항목 실행기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SuiteRunner(SpecificationSource source, ActionBindingProvider bindings, ItemRunner runner) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        this.source = source;
        this.bindings = bindings;
        this.runner = runner;
    }

    /**
     * 모든 액션 요구사항 실행.
     *
     * @return 스위트 실행 결과
     */
    public SuiteReport runAll() {
        List<ActionRequirementSpec> specs = source.actionRequirements();
        log.info("Suite run started: {} action requirements", specs.size());

        List<RunReport> reports = new ArrayList<>(specs.size());
        for (ActionRequirementSpec spec : specs) {
            reports.add(runOne(spec));
        }

        SuiteReport suite = new SuiteReport(reports);
        log.info("Suite run completed: {} passed, {} failed, {} aborted",
            suite.count(RunStatus.PASSED), suite.count(RunStatus.FAILED), suite.count(RunStatus.ABORTED));
        return suite;
    }

    /**
     * 개별 항목 실행.
     *
     * <p>예외 발생 시에도 결과로 기록하여 다른 항목 실행을 방해하지 않습니다.</p>
     *
     * @param spec 액션 요구사항 선언
     * @return 실행 결과
     */
    RunReport runOne(ActionRequirementSpec spec) {
        ActionRequirementItem item;
        try {
            item = spec.compile();
        } catch (ConfigurationException e) {
            log.error("Action requirement {} aborted: {}", spec.uid(), e.getMessage(), e);
            return RunReport.aborted(spec.uid(), e.getMessage());
        }

        try {
            return runner.run(item, bindings.bindingFor(item));
        } catch (ConfigurationException e) {
            log.error("Action requirement {} aborted: {}", spec.uid(), e.getMessage(), e);
            return RunReport.aborted(spec.uid(), e.getMessage());
        } catch (RuntimeException | AssertionError e) {
            log.error("Action requirement {} failed", spec.uid(), e);
            return RunReport.failed(spec.uid(), item.getSynthesizer().planSize(), null, e.getMessage());
        }
    }
}
