package com.ryuqq.transmap.core.table;

import com.ryuqq.transmap.core.codec.IndexCodec;
import com.ryuqq.transmap.core.error.ConfigurationException;
import com.ryuqq.transmap.core.model.Condition;
import com.ryuqq.transmap.core.model.ConditionModel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 원시 전이 맵 행을 검증된 {@link TransitionTable}로 컴파일.
 *
 * <p><strong>컴파일 규칙:</strong></p>
 * <ol>
 *   <li>각 행은 하나의 저장 엔트리가 됩니다 (NA로 묶인 그룹당 하나).</li>
 *   <li>{@code NA} 셀은 해당 차원의 모든 구체 상태를 덮고, 그 차원을 NOT_APPLICABLE로 표시합니다.</li>
 *   <li>구체 상태로만 이루어진 모든 생성 순서 위치는 정확히 하나의 행으로 덮여야 합니다.
 *       빈 위치는 완전성 오류, 중복은 중복 커버 오류입니다.</li>
 *   <li>어떤 차원의 NA 슬롯을 포함하는 위치는 마지막에 추가되는 하나의 암묵적 skip 엔트리에 연결됩니다.</li>
 * </ol>
 *
 * <p>모든 행이 생성 순서대로 정확히 하나의 위치만 덮고 NA 슬롯이 없으면 dense 테이블이 만들어집니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class TransitionTableCompiler {

    private static final String NA = "NA";
    private static final String IMPLICIT_SKIP_REASON = "NotApplicableSlot";

    private final ConditionModel model;
    private final Set<String> skipReasons;
    private final IndexCodec codec;

    /**
     * skip reason 없이 생성.
     *
     * @param model 조건 모델
     */
    public TransitionTableCompiler(ConditionModel model) {
        this(model, Set.of());
    }

    /**
     * 선언된 skip reason과 함께 생성.
     *
     * @param model 조건 모델
     * @param skipReasons 행이 참조할 수 있는 skip reason 이름
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TransitionTableCompiler(ConditionModel model, Set<String> skipReasons) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (skipReasons == null) {
            throw new IllegalArgumentException("skipReasons cannot be null");
        }
        this.model = model;
        this.skipReasons = Set.copyOf(skipReasons);
        this.codec = IndexCodec.forGenerationSpace(model);
    }

    /**
     * 행 목록을 전이 테이블로 컴파일.
     *
     * @param rows 원시 행
     * @return 검증된 전이 테이블
     * @throws ConfigurationException 행이 유효하지 않거나 커버리지가 완전하지 않은 경우
     */
    public TransitionTable compile(List<TransitionRow> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows cannot be null");
        }
        int[] owner = new int[codec.size()];
        Arrays.fill(owner, -1);

        List<TransitionEntry> entries = new ArrayList<>(rows.size() + 1);
        for (int r = 0; r < rows.size(); r++) {
            int[] cells = resolvePreStates(r, rows.get(r));
            entries.add(toEntry(r, rows.get(r), cells));
            cover(r, cells, owner);
        }

        int implicitSkip = -1;
        int[] vector = new int[codec.dimensions()];
        for (int g = 0; g < owner.length; g++) {
            if (owner[g] >= 0) {
                continue;
            }
            codec.decodeInto(g, vector);
            if (!holdsNotApplicableSlot(vector)) {
                throw new ConfigurationException("rows",
                    "Transition map is incomplete: no row covers " + describe(vector));
            }
            if (implicitSkip < 0) {
                implicitSkip = entries.size();
                entries.add(TransitionEntry.skipped(
                    model.preConditionCount(), model.postConditionCount(), IMPLICIT_SKIP_REASON));
            }
            owner[g] = implicitSkip;
        }
        return new TransitionTable(model, entries, owner);
    }

    private int[] resolvePreStates(int r, TransitionRow row) {
        String path = "rows[" + r + "]";
        if (row == null) {
            throw new ConfigurationException(path, "Row cannot be null");
        }
        if (row.preStates().size() != model.preConditionCount()) {
            throw new ConfigurationException(path + ".pre-conditions", String.format(
                "Expected %d pre-condition states (current: %d)", model.preConditionCount(), row.preStates().size()));
        }
        int[] cells = new int[model.preConditionCount()];
        for (int i = 0; i < cells.length; i++) {
            Condition condition = model.preCondition(i);
            String stateName = row.preStates().get(i);
            if (NA.equals(stateName)) {
                if (!condition.hasNotApplicable()) {
                    throw new ConfigurationException(path + ".pre-conditions[" + i + "]",
                        "Pre-condition " + condition.name() + " is NA-exempt and cannot be NA");
                }
                cells[i] = -1;
                continue;
            }
            int index = condition.indexOf(stateName);
            if (index < 0) {
                throw new ConfigurationException(path + ".pre-conditions[" + i + "]",
                    "Unknown state " + stateName + " of pre-condition " + condition.name());
            }
            cells[i] = index;
        }
        return cells;
    }

    private TransitionEntry toEntry(int r, TransitionRow row, int[] cells) {
        String path = "rows[" + r + "]";
        List<Applicability> applicability = new ArrayList<>(cells.length);
        for (int cell : cells) {
            applicability.add(cell < 0 ? Applicability.NOT_APPLICABLE : Applicability.APPLICABLE);
        }
        if (row.isSkip()) {
            if (!skipReasons.contains(row.skipReason())) {
                throw new ConfigurationException(path + ".skip-reason", "Unknown skip reason: " + row.skipReason());
            }
            return new TransitionEntry(applicability,
                Collections.nCopies(model.postConditionCount(), 0), true, row.skipReason());
        }
        if (row.postStates().size() != model.postConditionCount()) {
            throw new ConfigurationException(path + ".post-conditions", String.format(
                "Expected %d post-condition states (current: %d)", model.postConditionCount(), row.postStates().size()));
        }
        int[] expected = new int[model.postConditionCount()];
        for (int j = 0; j < expected.length; j++) {
            Condition condition = model.postCondition(j);
            String stateName = row.postStates().get(j);
            int index = condition.indexOf(stateName);
            if (index < 0) {
                throw new ConfigurationException(path + ".post-conditions[" + j + "]",
                    "Unknown state " + stateName + " of post-condition " + condition.name());
            }
            expected[j] = index;
        }
        return TransitionEntry.of(applicability, expected);
    }

    /**
     * 행이 덮는 모든 구체 조합을 odometer 방식으로 순회하며 소유 행을 기록.
     */
    private void cover(int r, int[] cells, int[] owner) {
        int n = cells.length;
        int[] vector = new int[n];
        for (int i = 0; i < n; i++) {
            vector[i] = cells[i] < 0 ? 0 : cells[i];
        }
        while (true) {
            int g = codec.encode(vector);
            if (owner[g] >= 0) {
                throw new ConfigurationException("rows[" + r + "]", String.format(
                    "Row overlaps rows[%d] at %s", owner[g], describe(vector)));
            }
            owner[g] = r;

            int i = n - 1;
            while (i >= 0) {
                if (cells[i] >= 0) {
                    i--;
                    continue;
                }
                vector[i]++;
                if (vector[i] < model.preCondition(i).cardinality()) {
                    break;
                }
                vector[i] = 0;
                i--;
            }
            if (i < 0) {
                return;
            }
        }
    }

    private boolean holdsNotApplicableSlot(int[] vector) {
        for (int i = 0; i < vector.length; i++) {
            Condition condition = model.preCondition(i);
            if (condition.hasNotApplicable() && vector[i] == condition.cardinality()) {
                return true;
            }
        }
        return false;
    }

    private String describe(int[] vector) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            Condition condition = model.preCondition(i);
            sb.append(condition.name()).append('=').append(condition.stateAt(vector[i]).getName());
        }
        return sb.toString();
    }
}
