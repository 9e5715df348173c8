package com.ryuqq.transmap.core.error;

/**
 * 테스트 항목 구성 오류.
 *
 * <p>조건 모델이나 전이 테이블이 불변식을 위반할 때 생성 시점에 발생합니다.
 * 해당 테스트 항목의 합성만 중단되며, 다른 항목의 실행에는 영향을 주지 않습니다.</p>
 *
 * <p><strong>대표적인 원인:</strong></p>
 * <ul>
 *   <li>상태가 하나도 없는 조건 (cardinality 0)</li>
 *   <li>order map 크기와 생성 순서 공간 크기 불일치</li>
 *   <li>도달할 수 없는(orphan) 엔트리</li>
 *   <li>NA 면제 조건에 대한 NA 표시</li>
 * </ul>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    private final String field;

    /**
     * 필드 정보 없이 생성.
     *
     * @param message 오류 메시지
     */
    public ConfigurationException(String message) {
        this(null, message);
    }

    /**
     * 문제가 된 필드를 지정하여 생성.
     *
     * @param field 문제가 된 조건 또는 엔트리 경로 (예: {@code entries[3].expected}), null 가능
     * @param message 오류 메시지
     */
    public ConfigurationException(String field, String message) {
        super(field == null ? message : field + ": " + message);
        this.field = field;
    }

    /**
     * 문제가 된 필드 조회.
     *
     * @return 필드 경로, 특정할 수 없으면 null
     */
    public String getField() {
        return field;
    }
}
