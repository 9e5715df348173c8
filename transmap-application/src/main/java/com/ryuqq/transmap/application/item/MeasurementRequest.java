package com.ryuqq.transmap.application.item;

/**
 * 런타임 측정 요청.
 *
 * @param name 요청 이름
 * @param brief 요청 요약
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record MeasurementRequest(String name, String brief) {

    public MeasurementRequest {
        ItemTexts.requireText(name, "name");
        ItemTexts.requireText(brief, "brief");
    }
}
