package com.ryuqq.transmap.application.item;

import com.ryuqq.transmap.application.substitution.Substitution;
import com.ryuqq.transmap.application.substitution.StepCounter;

import java.util.ArrayList;
import java.util.List;

/**
 * 테스트 스위트.
 *
 * @param uid 항목 uid
 * @param brief 요약
 * @param description 상세 설명 (nullable)
 * @param suiteName 스위트 이름
 * @param code 스위트 코드 텍스트
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record TestSuiteItem(
    String uid,
    String brief,
    String description,
    String suiteName,
    String code
) implements TestItem {

    public TestSuiteItem {
        ItemTexts.requireText(uid, "uid");
        ItemTexts.requireText(brief, "brief");
        ItemTexts.requireText(suiteName, "suiteName");
        code = code == null ? "" : code;
    }

    @Override
    public ItemKind kind() {
        return ItemKind.TEST_SUITE;
    }

    @Override
    public ItemDescription describe() {
        return ItemTexts.describe(this, List.of());
    }

    @Override
    public EmittedItem render() {
        Substitution substitution = ItemTexts.SUBSTITUTOR.substitute(this, code, StepCounter.initial());
        List<String> body = new ArrayList<>();
        TestCaseItem.addLines(body, substitution.text());
        return new EmittedItem(kind(), buildContext(), describe(), substitution.counter().value(), body);
    }
}
