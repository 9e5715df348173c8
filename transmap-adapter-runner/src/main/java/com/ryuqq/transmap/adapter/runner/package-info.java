/**
 * Transmap Runner Adapter - 액션 요구사항 실행 구현체.
 *
 * <h2>핵심 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transmap.adapter.runner.SynthesisRunner} - 단일 항목 실행, 계획 보고, scope 노출</li>
 *   <li>{@link com.ryuqq.transmap.adapter.runner.SuiteRunner} - 항목별 격리 실행</li>
 *   <li>{@link com.ryuqq.transmap.adapter.runner.RunnerConfig} - 실행 설정</li>
 * </ul>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.adapter.runner;
