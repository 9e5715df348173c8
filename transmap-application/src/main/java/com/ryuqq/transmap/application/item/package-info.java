/**
 * 테스트 항목 variant.
 *
 * <p>{@link com.ryuqq.transmap.application.item.TestItem}은 sealed 인터페이스로
 * 테스트 케이스, 테스트 스위트, 액션 요구사항, 런타임 측정의 네 가지 variant만 허용합니다.
 * variant별 처리는 {@link com.ryuqq.transmap.application.item.ItemKind} 태그로 분기합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.application.item;
