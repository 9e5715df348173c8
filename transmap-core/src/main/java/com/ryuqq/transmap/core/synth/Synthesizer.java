package com.ryuqq.transmap.core.synth;

import com.ryuqq.transmap.core.model.ConditionModel;
import com.ryuqq.transmap.core.table.TransitionTable;

import java.util.Iterator;

/**
 * 조합 기반 전이 맵 테스트 합성기.
 *
 * <p>선행 조건 상태의 카테시안 곱을 고정된 중첩 순서로 열거하면서 skip 엔트리와
 * skip-ahead 가지치기를 적용하고, 살아남은 조합마다 prepare/action/check 콜백을 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(callbacks) 호출
 *   ↓
 * For each Combination (odometer 순서):
 *   - SKIP     → 콜백 없음
 *   - PRUNE    → 콜백 없음, 안쪽 하위 곱 전체를 한 번에 건너뜀
 *   - DISPATCH → beforeVariant → prepare* → action → check* → afterVariant
 * </pre>
 *
 * <p><strong>동시성:</strong> 단일 스레드, 동기식. 하나의 인스턴스를 동시에 여러 실행에
 * 사용하지 않아야 합니다. 실행별 카운터는 {@link #run}마다 새로 초기화됩니다.</p>
 *
 * <p><strong>실패 처리:</strong> 콜백 예외는 {@link FailureHandler}가 CONTINUE를
 * 반환하지 않는 한 그대로 전파되며, 이후 조합은 실행되지 않습니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class Synthesizer {

    private final TransitionTable table;
    private final ConditionModel model;
    private int planSize = -1;

    /**
     * 생성자.
     *
     * @param table 검증된 전이 테이블
     * @throws IllegalArgumentException table이 null인 경우
     */
    public Synthesizer(TransitionTable table) {
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        this.table = table;
        this.model = table.getModel();
    }

    /**
     * 방문 단계를 순서대로 제공하는 순수 반복자.
     *
     * <p>호출할 때마다 처음부터 다시 시작하는 새 반복자를 반환합니다.</p>
     *
     * @return 조합 반복자
     */
    public Iterator<Combination> steps() {
        return new Odometer(table);
    }

    /**
     * 계획 크기 (콜백을 실행하는 조합 수).
     *
     * <p>첫 호출 시 콜백 없이 한 번 순회(dry pass)하여 계산하고 이후 캐시합니다.
     * 열거는 결정적이므로 실제 실행의 dispatch 수와 항상 같습니다.</p>
     *
     * @return 계획 크기
     */
    public int planSize() {
        if (planSize < 0) {
            int count = 0;
            Iterator<Combination> it = steps();
            while (it.hasNext()) {
                if (it.next().isDispatched()) {
                    count++;
                }
            }
            planSize = count;
        }
        return planSize;
    }

    /**
     * 실패 시 즉시 중단하는 기본 정책으로 실행.
     *
     * @param callbacks 액션 콜백
     * @return 실행 결과
     */
    public SynthesisReport run(ActionCallbacks callbacks) {
        return run(callbacks, FailureHandler.STOP, SynthesisListener.NONE);
    }

    /**
     * 실패 처리 정책과 리스너를 지정하여 실행.
     *
     * @param callbacks 액션 콜백
     * @param failureHandler 콜백 실패 처리 정책
     * @param listener 조합 방문 관찰자
     * @return 실행 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws RuntimeException 콜백이 던진 예외 (핸들러가 STOP을 반환한 경우 그대로)
     * @throws AssertionError 콜백의 assertion 실패 (핸들러가 STOP을 반환한 경우 그대로)
     */
    public SynthesisReport run(ActionCallbacks callbacks, FailureHandler failureHandler, SynthesisListener listener) {
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        if (failureHandler == null) {
            throw new IllegalArgumentException("failureHandler cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }

        int visited = 0;
        int dispatched = 0;
        int skipped = 0;
        int pruned = 0;
        int continued = 0;

        Iterator<Combination> it = steps();
        while (it.hasNext()) {
            Combination combination = it.next();
            visited++;
            switch (combination.getDisposition()) {
                case SKIP -> {
                    skipped++;
                    listener.onPass(combination);
                }
                case PRUNE -> {
                    pruned += combination.getPrunedCount();
                    listener.onPass(combination);
                }
                case DISPATCH -> {
                    dispatched++;
                    listener.onDispatch(combination);
                    if (!dispatch(combination, callbacks, failureHandler)) {
                        continued++;
                    }
                }
            }
        }
        return new SynthesisReport(visited, dispatched, skipped, pruned, continued);
    }

    /**
     * 조합 하나의 콜백 실행.
     *
     * @return 실패 없이 끝났으면 true, 실패 후 계속 진행이 결정되었으면 false
     */
    private boolean dispatch(Combination combination, ActionCallbacks callbacks, FailureHandler failureHandler) {
        Phase phase = Phase.BEFORE_VARIANT;
        try {
            callbacks.beforeVariant();

            phase = Phase.PREPARE;
            for (int i = 0; i < model.preConditionCount(); i++) {
                callbacks.prepare(i, combination.effectiveAt(i));
            }

            phase = Phase.ACTION;
            callbacks.action();

            phase = Phase.CHECK;
            for (int j = 0; j < model.postConditionCount(); j++) {
                callbacks.check(j, combination.expectedAt(j));
            }

            phase = Phase.AFTER_VARIANT;
            callbacks.afterVariant();
            return true;
        } catch (RuntimeException | AssertionError e) {
            // assertion 실패도 콜백 실패로 처리
            if (failureHandler.onFailure(combination, phase, e) != Resolution.CONTINUE) {
                throw e;
            }
            if (phase != Phase.AFTER_VARIANT) {
                callbacks.afterVariant();
            }
            return false;
        }
    }

    public TransitionTable getTable() {
        return table;
    }

    public ConditionModel getModel() {
        return model;
    }
}
