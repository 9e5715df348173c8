package com.ryuqq.transmap.application.item;

import java.util.List;

/**
 * 외부 emitter에 전달되는 생성 결과.
 *
 * <p>소스 텍스트 포맷팅은 외부 협력자의 책임이며, 이 record는 그에 필요한
 * 구조화된 데이터만 담습니다.</p>
 *
 * @param kind 항목 종류
 * @param context 생성 대상 식별자
 * @param description 치환된 설명
 * @param planSteps 계획된 테스트 단계 수
 * @param body 본문 줄 (치환 완료)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record EmittedItem(
    ItemKind kind,
    ItemContext context,
    ItemDescription description,
    int planSteps,
    List<String> body
) {

    public EmittedItem {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (planSteps < 0) {
            throw new IllegalArgumentException("planSteps cannot be negative (current: " + planSteps + ")");
        }
        body = body == null ? List.of() : List.copyOf(body);
    }
}
