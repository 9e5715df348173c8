package com.ryuqq.transmap.core.codec;

import com.ryuqq.transmap.core.error.ConfigurationException;
import com.ryuqq.transmap.core.error.StateIndexOutOfRangeException;
import com.ryuqq.transmap.core.model.ConditionModel;

import java.util.Arrays;

/**
 * 혼합 기수(mixed-radix) 인덱스 코덱.
 *
 * <p>상태 인덱스 벡터와 단일 선형 인덱스 사이를 변환합니다.
 * 차원 {@code i}의 가중치는 더 안쪽 차원 크기의 곱입니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * w_i = Π_{j&gt;i} c_j        (w_{n-1} = 1)
 * encode(v) = Σ v_i * w_i
 * decode(x): v_i = (x / w_i) % c_i
 * </pre>
 *
 * <p><strong>예시:</strong> radix {@code [3, 2, 4]} → weights {@code [8, 4, 1]}</p>
 *
 * <p>바깥 → 안쪽 사전식 순서를 보존하는 유일한 선형 전단사입니다.
 * 범위를 벗어난 입력은 {@link StateIndexOutOfRangeException}으로 즉시 실패하며,
 * 절대 순환(wrap)하지 않습니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class IndexCodec {

    private final int[] radices;
    private final int[] weights;
    private final int size;

    /**
     * 생성자.
     *
     * @param radices 차원 크기 (바깥 → 안쪽)
     * @throws IllegalArgumentException radices가 null인 경우
     * @throws ConfigurationException 차원 크기가 1 미만이거나 공간 크기가 int 범위를 넘는 경우
     */
    public IndexCodec(int... radices) {
        if (radices == null) {
            throw new IllegalArgumentException("radices cannot be null");
        }
        this.radices = radices.clone();
        this.weights = new int[radices.length];

        int product = 1;
        for (int i = radices.length - 1; i >= 0; i--) {
            if (radices[i] < 1) {
                throw new ConfigurationException(
                    "radices[" + i + "]", "Dimension size must be at least 1 (current: " + radices[i] + ")");
            }
            weights[i] = product;
            try {
                product = Math.multiplyExact(product, radices[i]);
            } catch (ArithmeticException e) {
                throw new ConfigurationException("radices", "Generation-order space exceeds " + Integer.MAX_VALUE + " combinations");
            }
        }
        this.size = product;
    }

    /**
     * 조건 모델의 생성 순서 공간에 대한 코덱 생성.
     *
     * @param model 조건 모델
     * @return 선행 조건 radix(NA 포함)를 차원 크기로 하는 코덱
     */
    public static IndexCodec forGenerationSpace(ConditionModel model) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        return new IndexCodec(model.preConditionRadices());
    }

    /**
     * 상태 인덱스 벡터를 선형 인덱스로 인코딩.
     *
     * @param vector 상태 인덱스 벡터 (바깥 → 안쪽)
     * @return 선형 인덱스
     * @throws StateIndexOutOfRangeException 성분이 해당 차원 범위를 벗어난 경우
     * @throws IllegalArgumentException 벡터 길이가 차원 수와 다른 경우
     */
    public int encode(int... vector) {
        checkLength(vector);
        int index = 0;
        for (int i = 0; i < radices.length; i++) {
            int v = vector[i];
            if (v < 0 || v >= radices[i]) {
                throw new StateIndexOutOfRangeException(i, v, radices[i]);
            }
            index += v * weights[i];
        }
        return index;
    }

    /**
     * 선형 인덱스를 상태 인덱스 벡터로 디코딩.
     *
     * @param index 선형 인덱스
     * @return 새 상태 인덱스 벡터
     * @throws StateIndexOutOfRangeException 인덱스가 [0, size) 범위를 벗어난 경우
     */
    public int[] decode(int index) {
        int[] vector = new int[radices.length];
        decodeInto(index, vector);
        return vector;
    }

    /**
     * 선형 인덱스를 주어진 벡터에 디코딩 (할당 없음).
     *
     * @param index 선형 인덱스
     * @param target 결과를 기록할 벡터
     * @throws StateIndexOutOfRangeException 인덱스가 [0, size) 범위를 벗어난 경우
     */
    public void decodeInto(int index, int[] target) {
        checkLength(target);
        if (index < 0 || index >= size) {
            throw new StateIndexOutOfRangeException(-1, index, size);
        }
        int remainder = index;
        for (int i = 0; i < radices.length; i++) {
            target[i] = remainder / weights[i];
            remainder = remainder % weights[i];
        }
    }

    private void checkLength(int[] vector) {
        if (vector == null) {
            throw new IllegalArgumentException("vector cannot be null");
        }
        if (vector.length != radices.length) {
            throw new IllegalArgumentException(
                String.format("vector length must be %d (current: %d)", radices.length, vector.length));
        }
    }

    /**
     * 전체 공간 크기 (Π radix).
     *
     * @return 조합 수
     */
    public int size() {
        return size;
    }

    public int dimensions() {
        return radices.length;
    }

    public int radix(int dimension) {
        return radices[dimension];
    }

    public int weight(int dimension) {
        return weights[dimension];
    }

    public int[] radices() {
        return radices.clone();
    }

    public int[] weights() {
        return weights.clone();
    }

    @Override
    public String toString() {
        return "IndexCodec{radices=" + Arrays.toString(radices) + ", weights=" + Arrays.toString(weights) + '}';
    }
}
