/**
 * 액션 요구사항 실행 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transmap.application.runner.ItemRunner} - 항목 실행기</li>
 *   <li>{@link com.ryuqq.transmap.application.runner.Fixture} - 실행 수명주기</li>
 *   <li>{@link com.ryuqq.transmap.application.runner.RunReport} - 실행 결과</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈에 위치합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.application.runner;
