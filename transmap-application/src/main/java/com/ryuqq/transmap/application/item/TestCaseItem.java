package com.ryuqq.transmap.application.item;

import com.ryuqq.transmap.application.substitution.StepCounter;
import com.ryuqq.transmap.application.substitution.Substitution;

import java.util.ArrayList;
import java.util.List;

/**
 * 순서 있는 액션과 검사로 이루어진 테스트 케이스.
 *
 * <p>계획 단계 수는 액션과 검사 코드의 {@code ${step}} / {@code ${steps/N}} 전개 수입니다.</p>
 *
 * @param uid 항목 uid
 * @param brief 요약
 * @param description 상세 설명 (nullable)
 * @param actions 액션 목록
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record TestCaseItem(
    String uid,
    String brief,
    String description,
    List<TestAction> actions
) implements TestItem {

    public TestCaseItem {
        ItemTexts.requireText(uid, "uid");
        ItemTexts.requireText(brief, "brief");
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    @Override
    public ItemKind kind() {
        return ItemKind.TEST_CASE;
    }

    @Override
    public ItemDescription describe() {
        List<String> details = new ArrayList<>();
        if (!actions.isEmpty()) {
            details.add("This test case performs the following actions:");
            for (TestAction action : actions) {
                details.add("- " + ItemTexts.SUBSTITUTOR.substitute(this, action.brief()).strip());
                for (TestCheck check : action.checks()) {
                    details.add("  - " + ItemTexts.SUBSTITUTOR.substitute(this, check.brief()).strip());
                }
            }
        }
        return ItemTexts.describe(this, details);
    }

    @Override
    public EmittedItem render() {
        StepCounter counter = StepCounter.initial();
        List<String> body = new ArrayList<>();
        for (TestAction action : actions) {
            Substitution code = ItemTexts.SUBSTITUTOR.substitute(this, action.code(), counter);
            counter = code.counter();
            addLines(body, code.text());
            for (TestCheck check : action.checks()) {
                Substitution checkCode = ItemTexts.SUBSTITUTOR.substitute(this, check.code(), counter);
                counter = checkCode.counter();
                addLines(body, checkCode.text());
            }
        }
        return new EmittedItem(kind(), buildContext(), describe(), counter.value(), body);
    }

    static void addLines(List<String> body, String text) {
        if (!text.isBlank()) {
            body.addAll(text.strip().lines().toList());
        }
    }
}
