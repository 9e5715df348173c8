package com.ryuqq.transmap.core.error;

/**
 * 상태 인덱스 또는 선형 인덱스가 허용 범위를 벗어난 경우.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public class StateIndexOutOfRangeException extends ContractViolationException {

    private final int dimension;
    private final long value;
    private final long bound;

    /**
     * 생성자.
     *
     * @param dimension 위반한 차원 (선형 인덱스 자체가 범위를 벗어난 경우 -1)
     * @param value 전달된 값
     * @param bound 배타적 상한
     */
    public StateIndexOutOfRangeException(int dimension, long value, long bound) {
        super(dimension < 0
            ? String.format("Index %d is out of range [0, %d)", value, bound)
            : String.format("State index %d at dimension %d is out of range [0, %d)", value, dimension, bound));
        this.dimension = dimension;
        this.value = value;
        this.bound = bound;
    }

    public int getDimension() {
        return dimension;
    }

    public long getValue() {
        return value;
    }

    public long getBound() {
        return bound;
    }
}
