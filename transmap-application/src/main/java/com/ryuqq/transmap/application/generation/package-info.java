/**
 * 항목 생성 순서 조정.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.application.generation;
