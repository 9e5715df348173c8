package com.ryuqq.transmap.application.item;

/**
 * 테스트 항목 종류 (variant tag).
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public enum ItemKind {

    /**
     * 순서 있는 액션과 검사로 이루어진 테스트 케이스.
     */
    TEST_CASE,

    /**
     * 테스트 케이스를 묶는 테스트 스위트.
     */
    TEST_SUITE,

    /**
     * 전이 맵으로부터 합성되는 액션 요구사항 테스트.
     */
    ACTION_REQUIREMENT,

    /**
     * 런타임 측정 테스트.
     */
    RUNTIME_MEASUREMENT;

    /**
     * 그룹 식별자 접두어.
     *
     * @return 테스트 스위트면 {@code TestSuite}, 그 외 {@code TestCase}
     */
    public String groupPrefix() {
        return this == TEST_SUITE ? "TestSuite" : "TestCase";
    }
}
