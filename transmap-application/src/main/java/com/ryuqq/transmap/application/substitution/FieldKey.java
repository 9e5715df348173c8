package com.ryuqq.transmap.application.substitution;

import com.ryuqq.transmap.application.item.ItemKind;

/**
 * 값 치환 테이블의 키.
 *
 * @param kind 항목 종류
 * @param field 필드 이름 (예: {@code test-run})
 *
 * @author Transmap Team
 * @since 1.0.0
 */
record FieldKey(ItemKind kind, String field) {
}
