package com.ryuqq.transmap.core.model;

import com.ryuqq.transmap.core.error.ConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 선행 조건과 후행 조건의 순서 있는 카탈로그.
 *
 * <p>선행 조건의 선언 순서가 열거의 중첩 순서(바깥 → 안쪽)를 결정합니다.
 * 생성 시 즉시 검증되며 이후 불변입니다.</p>
 *
 * @param preConditions 선행 조건 (바깥 → 안쪽)
 * @param postConditions 후행 조건 (선언 순서)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record ConditionModel(
    List<Condition> preConditions,
    List<Condition> postConditions
) {

    /**
     * Compact Constructor.
     *
     * @throws ConfigurationException 모델이 유효하지 않은 경우
     */
    public ConditionModel {
        if (preConditions == null || preConditions.isEmpty()) {
            throw new ConfigurationException("pre-conditions", "At least one pre-condition is required");
        }
        if (postConditions == null || postConditions.isEmpty()) {
            throw new ConfigurationException("post-conditions", "At least one post-condition is required");
        }
        preConditions = List.copyOf(preConditions);
        postConditions = List.copyOf(postConditions);
        checkKindAndNames("pre-conditions", preConditions, ConditionKind.PRE);
        checkKindAndNames("post-conditions", postConditions, ConditionKind.POST);
    }

    private static void checkKindAndNames(String field, List<Condition> conditions, ConditionKind kind) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            String path = field + "[" + i + "]";
            if (condition.kind() != kind) {
                throw new ConfigurationException(path, "Expected a " + kind + " condition but was " + condition.kind());
            }
            if (!names.add(condition.name())) {
                throw new ConfigurationException(path, "Duplicate condition: " + condition.name());
            }
        }
    }

    /**
     * ConditionModel 생성.
     *
     * @param preConditions 선행 조건
     * @param postConditions 후행 조건
     * @return ConditionModel 인스턴스
     */
    public static ConditionModel of(List<Condition> preConditions, List<Condition> postConditions) {
        return new ConditionModel(preConditions, postConditions);
    }

    public int preConditionCount() {
        return preConditions.size();
    }

    public int postConditionCount() {
        return postConditions.size();
    }

    public Condition preCondition(int index) {
        return preConditions.get(index);
    }

    public Condition postCondition(int index) {
        return postConditions.get(index);
    }

    /**
     * 선행 조건 차원 크기 (NA 포함).
     *
     * @return 바깥 → 안쪽 순서의 radix 배열
     */
    public int[] preConditionRadices() {
        int[] radices = new int[preConditions.size()];
        for (int i = 0; i < radices.length; i++) {
            radices[i] = preConditions.get(i).radix();
        }
        return radices;
    }

    /**
     * 이름으로 선행 조건 인덱스 조회.
     *
     * @param name 조건 이름
     * @return 인덱스, 없으면 -1
     */
    public int indexOfPreCondition(String name) {
        return indexOf(preConditions, name);
    }

    /**
     * 이름으로 후행 조건 인덱스 조회.
     *
     * @param name 조건 이름
     * @return 인덱스, 없으면 -1
     */
    public int indexOfPostCondition(String name) {
        return indexOf(postConditions, name);
    }

    private static int indexOf(List<Condition> conditions, String name) {
        for (int i = 0; i < conditions.size(); i++) {
            if (conditions.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
