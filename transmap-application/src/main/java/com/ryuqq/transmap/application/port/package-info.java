/**
 * 외부 협력자 포트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.transmap.application.port.SpecificationSource} - 명세 로딩</li>
 *   <li>{@link com.ryuqq.transmap.application.port.ItemEmitter} - 생성 결과 전달</li>
 *   <li>{@link com.ryuqq.transmap.application.port.ActionBindingProvider} - 항목별 콜백 제공</li>
 * </ul>
 *
 * <p>구현체는 adapter-inmemory 모듈 또는 외부 애플리케이션에 위치합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.application.port;
