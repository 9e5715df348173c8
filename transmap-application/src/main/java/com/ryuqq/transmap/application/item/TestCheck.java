package com.ryuqq.transmap.application.item;

/**
 * 테스트 케이스 액션의 검사.
 *
 * @param brief 검사 요약
 * @param code 검사 코드 텍스트 ({@code ${step}} 치환 대상)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record TestCheck(String brief, String code) {

    public TestCheck {
        ItemTexts.requireText(brief, "brief");
        code = code == null ? "" : code;
    }
}
