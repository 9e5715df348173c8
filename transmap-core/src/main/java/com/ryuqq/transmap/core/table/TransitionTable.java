package com.ryuqq.transmap.core.table;

import com.ryuqq.transmap.core.codec.IndexCodec;
import com.ryuqq.transmap.core.error.ConfigurationException;
import com.ryuqq.transmap.core.model.Condition;
import com.ryuqq.transmap.core.model.ConditionModel;

import java.util.List;

/**
 * 검증된 전이 테이블.
 *
 * <p>저장 순서의 엔트리 목록과, 생성 순서 인덱스를 저장 인덱스로 매핑하는
 * order map으로 구성됩니다. NA로 묶인 그룹이 없는 경우 order map은 항등 매핑이며
 * 이 테이블을 <em>dense</em>하다고 부릅니다.</p>
 *
 * <p><strong>불변식 (생성 시 검증):</strong></p>
 * <ul>
 *   <li>{@code orderMap.length == Π radix_i} (선행 조건, NA 포함)</li>
 *   <li>모든 order map 값은 유효한 엔트리 인덱스</li>
 *   <li>모든 엔트리는 하나 이상의 생성 순서 인덱스에서 도달 가능 (orphan 없음)</li>
 *   <li>{@code entry.applicability.size() == 선행 조건 수}</li>
 *   <li>{@code entry.expected.size() == 후행 조건 수}, 각 값은 해당 후행 조건의 상태 범위 내</li>
 *   <li>NA 면제 선행 조건에는 NOT_APPLICABLE 표시 불가</li>
 * </ul>
 *
 * <p>위반 시 {@link ConfigurationException}이 발생하며, 위반한 필드 경로를 포함합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class TransitionTable {

    private final ConditionModel model;
    private final IndexCodec codec;
    private final List<TransitionEntry> entries;
    private final int[] orderMap;
    private final boolean dense;

    /**
     * 생성자.
     *
     * @param model 조건 모델
     * @param entries 저장 순서의 엔트리
     * @param orderMap 생성 순서 인덱스 → 저장 인덱스
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws ConfigurationException 불변식 위반 시
     */
    public TransitionTable(ConditionModel model, List<TransitionEntry> entries, int[] orderMap) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        if (orderMap == null) {
            throw new IllegalArgumentException("orderMap cannot be null");
        }
        this.model = model;
        this.codec = IndexCodec.forGenerationSpace(model);
        this.entries = List.copyOf(entries);
        this.orderMap = orderMap.clone();

        validateOrderMap();
        validateEntries();
        this.dense = isIdentity(this.orderMap);
    }

    /**
     * 추가 순서(append order)로 빽빽하게 채워진 테이블 생성.
     *
     * <p>엔트리 {@code g}가 생성 순서 인덱스 {@code g}에 대응합니다.</p>
     *
     * @param model 조건 모델
     * @param entries 생성 순서의 엔트리 (정확히 Π radix 개)
     * @return dense 테이블
     * @throws ConfigurationException 엔트리 수가 생성 순서 공간 크기와 다른 경우
     */
    public static TransitionTable dense(ConditionModel model, List<TransitionEntry> entries) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        int size = IndexCodec.forGenerationSpace(model).size();
        if (entries.size() != size) {
            throw new ConfigurationException("entries", String.format(
                "Transition table is incomplete: %d entries for a generation-order space of %d",
                entries.size(), size));
        }
        int[] identity = new int[size];
        for (int i = 0; i < size; i++) {
            identity[i] = i;
        }
        return new TransitionTable(model, entries, identity);
    }

    private void validateOrderMap() {
        if (orderMap.length != codec.size()) {
            throw new ConfigurationException("orderMap", String.format(
                "Order map length must equal the generation-order space size %d (current: %d)",
                codec.size(), orderMap.length));
        }
        boolean[] reached = new boolean[entries.size()];
        for (int g = 0; g < orderMap.length; g++) {
            int storageIndex = orderMap[g];
            if (storageIndex < 0 || storageIndex >= entries.size()) {
                throw new ConfigurationException("orderMap[" + g + "]", String.format(
                    "Storage index %d does not refer to an entry (entries: %d)", storageIndex, entries.size()));
            }
            reached[storageIndex] = true;
        }
        for (int s = 0; s < reached.length; s++) {
            if (!reached[s]) {
                throw new ConfigurationException("entries[" + s + "]",
                    "Entry is not reachable from any generation-order index");
            }
        }
    }

    private void validateEntries() {
        int preCount = model.preConditionCount();
        int postCount = model.postConditionCount();
        for (int s = 0; s < entries.size(); s++) {
            TransitionEntry entry = entries.get(s);
            String path = "entries[" + s + "]";
            if (entry.applicability().size() != preCount) {
                throw new ConfigurationException(path + ".applicability", String.format(
                    "Expected %d applicability markings (current: %d)", preCount, entry.applicability().size()));
            }
            if (entry.expected().size() != postCount) {
                throw new ConfigurationException(path + ".expected", String.format(
                    "Expected %d post-condition states (current: %d)", postCount, entry.expected().size()));
            }
            for (int i = 0; i < preCount; i++) {
                Condition condition = model.preCondition(i);
                if (entry.isNotApplicable(i) && !condition.hasNotApplicable()) {
                    throw new ConfigurationException(path + ".applicability[" + i + "]",
                        "Pre-condition " + condition.name() + " is NA-exempt and cannot be marked not applicable");
                }
            }
            for (int j = 0; j < postCount; j++) {
                Condition condition = model.postCondition(j);
                int state = entry.expectedAt(j);
                if (state < 0 || state >= condition.cardinality()) {
                    throw new ConfigurationException(path + ".expected[" + j + "]", String.format(
                        "State index %d is out of range for post-condition %s (states: %d)",
                        state, condition.name(), condition.cardinality()));
                }
            }
        }
    }

    private static boolean isIdentity(int[] map) {
        for (int i = 0; i < map.length; i++) {
            if (map[i] != i) {
                return false;
            }
        }
        return true;
    }

    /**
     * 생성 순서 인덱스의 엔트리 조회.
     *
     * @param generationIndex 생성 순서 인덱스
     * @return 엔트리
     * @throws IndexOutOfBoundsException 인덱스가 범위를 벗어난 경우
     */
    public TransitionEntry entryAt(int generationIndex) {
        return entries.get(orderMap[generationIndex]);
    }

    /**
     * 생성 순서 인덱스 → 저장 인덱스.
     *
     * @param generationIndex 생성 순서 인덱스
     * @return 저장 인덱스
     */
    public int storageIndexOf(int generationIndex) {
        return orderMap[generationIndex];
    }

    public ConditionModel getModel() {
        return model;
    }

    public IndexCodec getCodec() {
        return codec;
    }

    public List<TransitionEntry> getEntries() {
        return entries;
    }

    public int[] getOrderMap() {
        return orderMap.clone();
    }

    /**
     * 생성 순서 공간 크기.
     *
     * @return order map 길이
     */
    public int generationSize() {
        return orderMap.length;
    }

    /**
     * order map이 항등 매핑인지 확인.
     *
     * @return dense 테이블이면 true
     */
    public boolean isDense() {
        return dense;
    }
}
