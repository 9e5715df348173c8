package com.ryuqq.transmap.core.error;

/**
 * 호출자 계약 위반.
 *
 * <p>범위를 벗어난 상태 벡터 인코딩처럼 API를 잘못 사용한 경우 즉시 발생합니다.
 * 값을 조정(clamp)하거나 순환(wrap)시키지 않습니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public class ContractViolationException extends IllegalArgumentException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public ContractViolationException(String message) {
        super(message);
    }
}
