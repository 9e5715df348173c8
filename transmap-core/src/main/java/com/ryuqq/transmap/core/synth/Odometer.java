package com.ryuqq.transmap.core.synth;

import com.ryuqq.transmap.core.codec.IndexCodec;
import com.ryuqq.transmap.core.model.ConditionModel;
import com.ryuqq.transmap.core.model.State;
import com.ryuqq.transmap.core.table.TransitionEntry;
import com.ryuqq.transmap.core.table.TransitionTable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 선행 조건 상태의 카테시안 곱을 바깥 → 안쪽 사전식 순서로 순회하는 반복자.
 *
 * <p><strong>알고리즘 (단계마다):</strong></p>
 * <ol>
 *   <li>생성 순서 인덱스 결정: dense 테이블은 단조 증가 커서, 그 외에는 반복 벡터 인코딩</li>
 *   <li>order map → 저장 인덱스 → 엔트리</li>
 *   <li>엔트리 skip → SKIP</li>
 *   <li>NA 대체로 유효 벡터 계산</li>
 *   <li>유효 상태 중 가장 바깥의 skip-ahead 차원 p가 있으면 → PRUNE,
 *       p보다 안쪽 차원을 모두 radix-1로 강제</li>
 *   <li>odometer 증가 (안쪽부터, overflow 시 0으로 돌리고 바깥으로 carry)</li>
 * </ol>
 *
 * <p>PRUNE 이후에는 커서가 반복 벡터에서 다시 계산됩니다. 상태는 이 인스턴스에만
 * 존재하며 실행마다 새로 생성됩니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
final class Odometer implements Iterator<Combination> {

    private final TransitionTable table;
    private final ConditionModel model;
    private final IndexCodec codec;
    private final int[] iteration;

    private int cursor;
    private boolean recompute;
    private boolean exhausted;

    Odometer(TransitionTable table) {
        this.table = table;
        this.model = table.getModel();
        this.codec = table.getCodec();
        this.iteration = new int[codec.dimensions()];
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public Combination next() {
        if (exhausted) {
            throw new NoSuchElementException("All combinations have been visited");
        }

        int generationIndex = (table.isDense() && !recompute) ? cursor : codec.encode(iteration);
        recompute = false;
        int storageIndex = table.storageIndexOf(generationIndex);
        TransitionEntry entry = table.entryAt(generationIndex);

        List<State> effective = effectiveStates(entry);
        Disposition disposition;
        int prunedDimension = -1;
        int prunedCount = 0;

        if (entry.skip()) {
            disposition = Disposition.SKIP;
        } else {
            prunedDimension = firstSkipAhead(effective);
            if (prunedDimension >= 0) {
                disposition = Disposition.PRUNE;
                prunedCount = concretePositionsFrom(prunedDimension);
            } else {
                disposition = Disposition.DISPATCH;
            }
        }

        Combination combination = new Combination(generationIndex, storageIndex, iteration, effective,
            expectedStates(entry), entry, disposition, prunedDimension, prunedCount);

        if (disposition == Disposition.PRUNE) {
            // 안쪽 차원을 최대값으로 강제하면 다음 증가가 p로 carry됨
            for (int j = prunedDimension + 1; j < iteration.length; j++) {
                iteration[j] = codec.radix(j) - 1;
            }
            recompute = true;
        }
        increment();
        cursor = generationIndex + 1;
        return combination;
    }

    private void increment() {
        for (int i = iteration.length - 1; i >= 0; i--) {
            iteration[i]++;
            if (iteration[i] < codec.radix(i)) {
                return;
            }
            iteration[i] = 0;
        }
        exhausted = true;
    }

    /**
     * 현재 위치부터 {@code dimension}의 블록 끝까지 남은 구체 조합 수.
     *
     * <p>NA 슬롯 위치는 어차피 실행되지 않으므로 세지 않습니다. 가지치기를 일으킨
     * 조합은 모든 차원이 구체 상태이므로 안쪽 차원의 카디널리티로 계산합니다.</p>
     */
    private int concretePositionsFrom(int dimension) {
        int count = 1;
        int tail = 1;
        for (int k = iteration.length - 1; k > dimension; k--) {
            int cardinality = model.preCondition(k).cardinality();
            count += (cardinality - iteration[k] - 1) * tail;
            tail *= cardinality;
        }
        return count;
    }

    private List<State> effectiveStates(TransitionEntry entry) {
        List<State> states = new ArrayList<>(iteration.length);
        for (int i = 0; i < iteration.length; i++) {
            if (!entry.skip() && entry.isNotApplicable(i)) {
                states.add(State.NA);
            } else {
                states.add(model.preCondition(i).stateAt(iteration[i]));
            }
        }
        return states;
    }

    private List<State> expectedStates(TransitionEntry entry) {
        List<State> states = new ArrayList<>(model.postConditionCount());
        for (int j = 0; j < model.postConditionCount(); j++) {
            states.add(model.postCondition(j).stateAt(entry.expectedAt(j)));
        }
        return states;
    }

    private static int firstSkipAhead(List<State> effective) {
        for (int i = 0; i < effective.size(); i++) {
            if (effective.get(i).isSkipAhead()) {
                return i;
            }
        }
        return -1;
    }
}
