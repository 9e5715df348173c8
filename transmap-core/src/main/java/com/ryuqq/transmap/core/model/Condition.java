package com.ryuqq.transmap.core.model;

import com.ryuqq.transmap.core.error.ConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 명명된 상태의 순서 있는 목록을 가진 조건.
 *
 * <p><strong>차원 크기:</strong></p>
 * <ul>
 *   <li>{@code cardinality()}: 선언된 상태 수 (1 이상)</li>
 *   <li>{@code radix()}: 선행 조건은 cardinality + 1 (NA 포함), NA 면제 선행 조건과 후행 조건은 cardinality</li>
 * </ul>
 *
 * <p>NA sentinel의 상태 인덱스는 항상 {@code cardinality()}입니다.</p>
 *
 * @param name 조건 이름
 * @param kind 조건 종류
 * @param states 선언된 상태 (선언 순서)
 * @param naExempt NA sentinel을 갖지 않는 선행 조건 여부
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record Condition(
    String name,
    ConditionKind kind,
    List<State> states,
    boolean naExempt
) {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    /**
     * Compact Constructor.
     *
     * @throws ConfigurationException 조건 정의가 유효하지 않은 경우
     */
    public Condition {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new ConfigurationException("condition", "Condition name is not an identifier: " + name);
        }
        if (kind == null) {
            throw new ConfigurationException(name, "kind cannot be null");
        }
        if (states == null || states.isEmpty()) {
            throw new ConfigurationException(name, "Condition must declare at least one state");
        }
        states = List.copyOf(states);
        Set<String> names = new HashSet<>();
        for (State state : states) {
            if (state.isNotApplicable()) {
                throw new ConfigurationException(name, "NA sentinel cannot be declared as a state");
            }
            if (!names.add(state.getName())) {
                throw new ConfigurationException(name, "Duplicate state: " + state.getName());
            }
            if (kind == ConditionKind.POST && state.isSkipAhead()) {
                throw new ConfigurationException(name, "Post-condition state cannot carry a skip-ahead annotation: " + state);
            }
        }
        if (kind == ConditionKind.POST && naExempt) {
            throw new ConfigurationException(name, "Post-conditions have no NA sentinel to be exempt from");
        }
    }

    /**
     * 선행 조건 생성.
     *
     * @param name 조건 이름
     * @param states 선언된 상태
     * @return 선행 조건
     */
    public static Condition pre(String name, State... states) {
        return new Condition(name, ConditionKind.PRE, List.of(states), false);
    }

    /**
     * NA 면제 선행 조건 생성.
     *
     * @param name 조건 이름
     * @param states 선언된 상태
     * @return NA sentinel이 없는 선행 조건
     */
    public static Condition preExempt(String name, State... states) {
        return new Condition(name, ConditionKind.PRE, List.of(states), true);
    }

    /**
     * 후행 조건 생성.
     *
     * @param name 조건 이름
     * @param states 선언된 상태
     * @return 후행 조건
     */
    public static Condition post(String name, State... states) {
        return new Condition(name, ConditionKind.POST, List.of(states), false);
    }

    /**
     * 이름만으로 상태를 선언하는 편의 메서드.
     *
     * @param kind 조건 종류
     * @param name 조건 이름
     * @param stateNames 상태 이름
     * @return 조건
     */
    public static Condition of(ConditionKind kind, String name, String... stateNames) {
        State[] states = new State[stateNames.length];
        for (int i = 0; i < stateNames.length; i++) {
            states[i] = State.of(stateNames[i]);
        }
        return new Condition(name, kind, List.of(states), false);
    }

    public int cardinality() {
        return states.size();
    }

    /**
     * NA sentinel 보유 여부.
     *
     * @return NA 면제가 아닌 선행 조건이면 true
     */
    public boolean hasNotApplicable() {
        return kind == ConditionKind.PRE && !naExempt;
    }

    /**
     * 생성 순서 공간에서의 차원 크기.
     *
     * @return NA sentinel을 포함한 상태 수
     */
    public int radix() {
        return hasNotApplicable() ? states.size() + 1 : states.size();
    }

    /**
     * 인덱스에 해당하는 상태 조회.
     *
     * @param index 상태 인덱스 (NA sentinel은 {@code cardinality()})
     * @return 상태
     * @throws IndexOutOfBoundsException 인덱스가 radix 범위를 벗어난 경우
     */
    public State stateAt(int index) {
        if (index == states.size() && hasNotApplicable()) {
            return State.NA;
        }
        return states.get(index);
    }

    /**
     * 이름으로 상태 인덱스 조회.
     *
     * @param stateName 상태 이름 ({@code NA}는 sentinel 인덱스)
     * @return 상태 인덱스, 없으면 -1
     */
    public int indexOf(String stateName) {
        if (State.NA.getName().equals(stateName)) {
            return hasNotApplicable() ? states.size() : -1;
        }
        for (int i = 0; i < states.size(); i++) {
            if (states.get(i).getName().equals(stateName)) {
                return i;
            }
        }
        return -1;
    }
}
