package com.ryuqq.transmap.application.item;

import java.util.ArrayList;
import java.util.List;

/**
 * 런타임 측정 테스트.
 *
 * @param uid 항목 uid
 * @param brief 요약
 * @param description 상세 설명 (nullable)
 * @param requests 측정 요청 (선언 순서)
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record RuntimeMeasurementItem(
    String uid,
    String brief,
    String description,
    List<MeasurementRequest> requests
) implements TestItem {

    public RuntimeMeasurementItem {
        ItemTexts.requireText(uid, "uid");
        ItemTexts.requireText(brief, "brief");
        requests = requests == null ? List.of() : List.copyOf(requests);
    }

    @Override
    public ItemKind kind() {
        return ItemKind.RUNTIME_MEASUREMENT;
    }

    @Override
    public ItemDescription describe() {
        List<String> details = new ArrayList<>();
        for (MeasurementRequest request : requests) {
            details.add("- " + request.name() + ": " + ItemTexts.SUBSTITUTOR.substitute(this, request.brief()).strip());
        }
        return ItemTexts.describe(this, details);
    }

    @Override
    public EmittedItem render() {
        List<String> body = new ArrayList<>();
        for (MeasurementRequest request : requests) {
            body.add(buildContext().ident() + "_" + request.name());
        }
        return new EmittedItem(kind(), buildContext(), describe(), 0, body);
    }
}
