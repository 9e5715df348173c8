package com.ryuqq.transmap.application.item;

import com.ryuqq.transmap.application.substitution.PlanTextSubstitutor;

import java.util.ArrayList;
import java.util.List;

/**
 * 항목 variant가 공유하는 텍스트 구성 도우미.
 */
final class ItemTexts {

    static final PlanTextSubstitutor SUBSTITUTOR = new PlanTextSubstitutor();

    private ItemTexts() {
    }

    static ItemDescription describe(TestItem item, List<String> extraDetails) {
        List<String> details = new ArrayList<>();
        String description = SUBSTITUTOR.substitute(item, item.description());
        if (!description.isBlank()) {
            details.add(description.strip());
        }
        details.addAll(extraDetails);
        return new ItemDescription(
            item.buildContext().groupIdentifier(),
            item.uid(),
            SUBSTITUTOR.substitute(item, item.brief()).strip(),
            details
        );
    }

    static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
