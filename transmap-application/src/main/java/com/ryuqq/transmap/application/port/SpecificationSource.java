package com.ryuqq.transmap.application.port;

import com.ryuqq.transmap.application.item.ActionRequirementSpec;
import com.ryuqq.transmap.application.item.TestItem;

import java.util.List;
import java.util.Optional;

/**
 * 명세 로딩 협력자 SPI.
 *
 * <p>명세 문서의 파싱과 저장소 구성은 구현체의 책임입니다. 액션 요구사항은 검증 전
 * 형태({@link ActionRequirementSpec})로 제공되어 항목별로 격리된 검증이 가능합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public interface SpecificationSource {

    /**
     * 선언된 모든 액션 요구사항 (선언 순서).
     *
     * @return 액션 요구사항 목록
     */
    List<ActionRequirementSpec> actionRequirements();

    /**
     * uid로 액션 요구사항 조회.
     *
     * @param uid 항목 uid
     * @return 액션 요구사항 (없으면 empty)
     */
    Optional<ActionRequirementSpec> findActionRequirement(String uid);

    /**
     * 액션 요구사항 이외의 이미 검증된 항목 (테스트 케이스, 스위트, 런타임 측정).
     *
     * @return 항목 목록 (선언 순서)
     */
    List<TestItem> items();
}
