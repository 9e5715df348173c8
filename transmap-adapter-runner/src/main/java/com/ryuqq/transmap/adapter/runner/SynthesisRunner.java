package com.ryuqq.transmap.adapter.runner;

import com.ryuqq.transmap.application.item.ActionRequirementItem;
import com.ryuqq.transmap.application.runner.ActionBinding;
import com.ryuqq.transmap.application.runner.Fixture;
import com.ryuqq.transmap.application.runner.ItemRunner;
import com.ryuqq.transmap.application.runner.RunReport;
import com.ryuqq.transmap.core.model.State;
import com.ryuqq.transmap.core.spi.TestFramework;
import com.ryuqq.transmap.core.synth.ActionCallbacks;
import com.ryuqq.transmap.core.synth.Combination;
import com.ryuqq.transmap.core.synth.FailureHandler;
import com.ryuqq.transmap.core.synth.Phase;
import com.ryuqq.transmap.core.synth.Resolution;
import com.ryuqq.transmap.core.synth.SynthesisListener;
import com.ryuqq.transmap.core.synth.SynthesisReport;
import com.ryuqq.transmap.core.synth.Synthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 액션 요구사항을 외부 테스트 프레임워크와 연결하여 실행하는 Runner.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. caseBegin(groupIdentifier)
 * 2. UPFRONT이면 plan(planSize)
 * 3. fixture.setup() → action loop 진입
 * 4. For each dispatched Combination:
 *    a. scopeChanged(scope)
 *    b. beforeVariant → prepare* → action → check* → afterVariant
 *    c. 성공 → stepPassed(scope), 실패 → stepFailed(scope, e)
 * 5. action loop 종료 → fixture.stop() → fixture.teardown()
 * 6. LAZY이면 plan(planSize)
 * 7. caseEnd(groupIdentifier)
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>check 단계 실패 + continueOnCheckFailure → warn 로그 후 다음 조합</li>
 *   <li>그 외 실패 → 예외를 그대로 전파 (stop/teardown/caseEnd는 호출됨)</li>
 *   <li>stop/teardown 예외 → 전파 중인 콜백 실패에 suppressed로 첨부</li>
 * </ul>
 *
 * <p><strong>Thread-Safety:</strong> 단일 스레드 전용입니다.
 * {@link #scope()}는 같은 스레드의 콜백 안에서 호출되는 것을 전제로 합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class SynthesisRunner implements ItemRunner {

    private static final Logger log = LoggerFactory.getLogger(SynthesisRunner.class);

    private final TestFramework framework;
    private final RunnerConfig config;

    private boolean inActionLoop;
    private Combination current;
    private boolean currentFailed;
    private String lastFailure;

    /**
     * 기본 설정 생성자.
     *
     * @param framework 외부 테스트 프레임워크
     */
    public SynthesisRunner(TestFramework framework) {
        this(framework, new RunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param framework 외부 테스트 프레임워크
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SynthesisRunner(TestFramework framework, RunnerConfig config) {
        if (framework == null) {
            throw new IllegalArgumentException("framework cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.framework = framework;
        this.config = config;
    }

    @Override
    public RunReport run(ActionRequirementItem item, ActionBinding binding) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (binding == null) {
            throw new IllegalArgumentException("binding cannot be null");
        }

        String caseName = item.buildContext().groupIdentifier();
        Synthesizer synthesizer = item.getSynthesizer();
        int planSize = synthesizer.planSize();
        lastFailure = null;

        framework.caseBegin(caseName);
        try {
            if (config.planMode() == PlanMode.UPFRONT) {
                framework.plan(planSize);
            }
            log.info("Synthesis run started: {} ({} planned of {} combinations)",
                item.uid(), planSize, item.getTable().generationSize());

            SynthesisReport report = runInActionLoop(synthesizer, binding);

            if (config.planMode() == PlanMode.LAZY) {
                framework.plan(planSize);
            }
            log.info("Synthesis run completed: {} (dispatched={}, skipped={}, pruned={}, failed={})",
                item.uid(), report.dispatched(), report.skipped(), report.pruned(), report.continuedFailures());

            return report.isClean()
                ? RunReport.passed(item.uid(), planSize, report)
                : RunReport.failed(item.uid(), planSize, report, lastFailure);
        } finally {
            framework.caseEnd(caseName);
        }
    }

    private SynthesisReport runInActionLoop(Synthesizer synthesizer, ActionBinding binding) {
        Fixture fixture = binding.fixture();
        fixture.setup();
        inActionLoop = true;
        SynthesisReport report;
        try {
            report = synthesizer.run(new ReportingCallbacks(binding.callbacks()), this::onFailure, new ScopeListener());
        } catch (RuntimeException | Error e) {
            leaveActionLoop(fixture, e);
            throw e;
        }
        leaveActionLoop(fixture, null);
        return report;
    }

    /**
     * action loop 종료 후 stop과 teardown 호출.
     *
     * <p>둘 다 항상 호출됩니다. 진행 중인 콜백 실패가 있으면 정리 단계의 예외는
     * 그 실패에 suppressed로 붙고, 없으면 첫 정리 예외가 던져집니다.</p>
     *
     * @param fixture 고정 장치
     * @param failure 전파 중인 콜백 실패 (없으면 null)
     */
    private void leaveActionLoop(Fixture fixture, Throwable failure) {
        inActionLoop = false;
        current = null;

        RuntimeException cleanupFailure = runCleanup(fixture::stop, "stop", null);
        cleanupFailure = runCleanup(fixture::teardown, "teardown", cleanupFailure);
        if (cleanupFailure == null) {
            return;
        }
        if (failure == null) {
            throw cleanupFailure;
        }
        failure.addSuppressed(cleanupFailure);
    }

    private RuntimeException runCleanup(Runnable step, String name, RuntimeException previous) {
        try {
            step.run();
            return previous;
        } catch (RuntimeException e) {
            log.warn("Fixture {} failed: {}", name, e.getMessage());
            if (previous == null) {
                return e;
            }
            previous.addSuppressed(e);
            return previous;
        }
    }

    private Resolution onFailure(Combination combination, Phase phase, Throwable failure) {
        currentFailed = true;
        lastFailure = combination.scope() + ": " + failure.getMessage();
        framework.stepFailed(combination.scope(), failure);

        if (phase == Phase.CHECK && config.continueOnCheckFailure()) {
            log.warn("Check failed at {}, continuing with next combination: {}", combination.scope(), failure.getMessage());
            return Resolution.CONTINUE;
        }
        return FailureHandler.STOP.onFailure(combination, phase, failure);
    }

    @Override
    public String scope() {
        if (!inActionLoop || current == null) {
            return "";
        }
        return current.scope();
    }

    @Override
    public boolean isInActionLoop() {
        return inActionLoop;
    }

    /**
     * 현재 조합 추적 및 scope 통지.
     */
    private final class ScopeListener implements SynthesisListener {

        @Override
        public void onDispatch(Combination combination) {
            current = combination;
            currentFailed = false;
            framework.scopeChanged(combination.scope());
            if (config.logCombinations()) {
                log.debug("Dispatching {} (generation index {})", combination.scope(), combination.getGenerationIndex());
            }
        }
    }

    /**
     * 조합 성공 시 stepPassed를 보고하는 콜백 decorator.
     */
    private final class ReportingCallbacks implements ActionCallbacks {

        private final ActionCallbacks delegate;

        private ReportingCallbacks(ActionCallbacks delegate) {
            this.delegate = delegate;
        }

        @Override
        public void beforeVariant() {
            delegate.beforeVariant();
        }

        @Override
        public void prepare(int preCondition, State state) {
            delegate.prepare(preCondition, state);
        }

        @Override
        public void action() {
            delegate.action();
        }

        @Override
        public void check(int postCondition, State expected) {
            delegate.check(postCondition, expected);
        }

        @Override
        public void afterVariant() {
            delegate.afterVariant();
            if (!currentFailed) {
                framework.stepPassed(current.scope());
            }
        }
    }
}
