/**
 * 계획 텍스트 치환.
 *
 * <p>단계 카운터는 {@link com.ryuqq.transmap.application.substitution.StepCounter} 값 객체로
 * 호출 간에 명시적으로 전달됩니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.application.substitution;
