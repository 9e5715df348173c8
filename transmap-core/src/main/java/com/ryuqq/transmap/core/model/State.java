package com.ryuqq.transmap.core.model;

import java.util.regex.Pattern;

/**
 * 조건의 명명된 상태.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>패턴: 식별자 형식 ({@code [A-Za-z_][A-Za-z0-9_]*})</li>
 *   <li>{@code NA}는 예약된 이름 (sentinel 전용)</li>
 * </ul>
 *
 * <p>선행 조건의 상태는 skip-ahead 표시를 가질 수 있습니다. 이 상태가 해당 차원의
 * 유효 상태가 되면 더 안쪽 차원은 모두 무관한 것으로 간주되어 가지치기됩니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class State {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final String NA_NAME = "NA";

    /**
     * Not Applicable sentinel.
     *
     * <p>모든 선행 조건(NA 면제 조건 제외)의 선언된 상태 뒤에 암묵적으로 추가됩니다.</p>
     */
    public static final State NA = new State(NA_NAME, false, true);

    private final String name;
    private final boolean skipAhead;

    private State(String name, boolean skipAhead, boolean sentinel) {
        if (!sentinel) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("State name cannot be null or blank");
            }
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new IllegalArgumentException("State name is not an identifier: " + name);
            }
            if (NA_NAME.equals(name)) {
                throw new IllegalArgumentException("State name NA is reserved for the not-applicable sentinel");
            }
        }
        this.name = name;
        this.skipAhead = skipAhead;
    }

    /**
     * 일반 상태 생성.
     *
     * @param name 상태 이름
     * @return State 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static State of(String name) {
        return new State(name, false, false);
    }

    /**
     * skip-ahead 표시가 있는 상태 생성.
     *
     * @param name 상태 이름
     * @return skip-ahead 표시가 있는 State 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static State skipping(String name) {
        return new State(name, true, false);
    }

    public String getName() {
        return name;
    }

    /**
     * 이 상태가 안쪽 차원 전체를 무관하게 만드는지 확인.
     *
     * @return skip-ahead 표시 여부
     */
    public boolean isSkipAhead() {
        return skipAhead;
    }

    /**
     * NA sentinel 여부.
     *
     * @return NA sentinel이면 true
     */
    public boolean isNotApplicable() {
        return this == NA;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        State state = (State) o;
        return skipAhead == state.skipAhead && name.equals(state.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + (skipAhead ? 1 : 0);
    }

    @Override
    public String toString() {
        return name;
    }
}
