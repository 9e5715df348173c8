package com.ryuqq.transmap.application.substitution;

/**
 * 테스트 계획 단계 카운터 (불변 값 객체).
 *
 * <p>치환 호출마다 명시적으로 전달되고, 치환 결과와 함께 갱신된 값이 반환됩니다.</p>
 *
 * @param value 다음에 할당될 단계 번호 (0부터)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record StepCounter(int value) {

    public StepCounter {
        if (value < 0) {
            throw new IllegalArgumentException("value cannot be negative (current: " + value + ")");
        }
    }

    /**
     * 0에서 시작하는 카운터.
     *
     * @return 초기 카운터
     */
    public static StepCounter initial() {
        return new StepCounter(0);
    }

    /**
     * 단계를 진행한 새 카운터.
     *
     * @param steps 진행할 단계 수 (0 이상)
     * @return 진행된 카운터
     * @throws IllegalArgumentException steps가 음수인 경우
     */
    public StepCounter advance(int steps) {
        if (steps < 0) {
            throw new IllegalArgumentException("steps cannot be negative (current: " + steps + ")");
        }
        return new StepCounter(Math.addExact(value, steps));
    }
}
