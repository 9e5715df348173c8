package com.ryuqq.transmap.application.item;

import java.util.List;

/**
 * 테스트 케이스의 순서 있는 액션.
 *
 * @param brief 액션 요약
 * @param code 액션 코드 텍스트
 * @param checks 액션 이후 수행할 검사 (선언 순서)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record TestAction(String brief, String code, List<TestCheck> checks) {

    public TestAction {
        ItemTexts.requireText(brief, "brief");
        code = code == null ? "" : code;
        checks = checks == null ? List.of() : List.copyOf(checks);
    }
}
