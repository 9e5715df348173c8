package com.ryuqq.transmap.application.item;

import java.util.List;

/**
 * 치환이 끝난 항목 설명.
 *
 * @param groupIdentifier 그룹 식별자
 * @param name 항목 이름 (uid)
 * @param brief 요약
 * @param details 상세 설명 줄 (액션 설명 포함)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record ItemDescription(
    String groupIdentifier,
    String name,
    String brief,
    List<String> details
) {

    public ItemDescription {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
