package com.ryuqq.transmap.application.substitution;

import com.ryuqq.transmap.application.item.ItemKind;
import com.ryuqq.transmap.application.item.TestItem;
import com.ryuqq.transmap.application.item.TestSuiteItem;
import com.ryuqq.transmap.core.error.ConfigurationException;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 계획 텍스트 치환기.
 *
 * <p>지원하는 치환:</p>
 * <ul>
 *   <li>{@code ${step}} → 현재 단계 번호, 카운터 1 증가</li>
 *   <li>{@code ${steps/N}} → {@code Accounts for N test plan steps}, 카운터 N 증가</li>
 *   <li>{@code ${.:/field}} → (항목 종류, 필드) 테이블에서 해석한 값</li>
 * </ul>
 *
 * <p>값 테이블은 클래스 초기화 시 한 번 만들어지는 불변 맵이며, 값은 항목에 대한 순수 함수입니다.
 * 단계 카운터는 호출자가 전달하고 결과와 함께 돌려받습니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class PlanTextSubstitutor {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]*)\\}");
    private static final Pattern STEPS = Pattern.compile("steps/([0-9]+)");
    private static final String ITEM_FIELD_PREFIX = ".:/";

    private static final Map<FieldKey, Function<TestItem, String>> VALUES;

    static {
        Map<FieldKey, Function<TestItem, String>> values = new HashMap<>();
        for (ItemKind kind : ItemKind.values()) {
            values.put(new FieldKey(kind, "uid"), TestItem::uid);
            values.put(new FieldKey(kind, "ident"), item -> item.buildContext().ident());
            values.put(new FieldKey(kind, "group-identifier"), item -> item.buildContext().groupIdentifier());
        }
        for (ItemKind kind : new ItemKind[] {ItemKind.TEST_CASE, ItemKind.ACTION_REQUIREMENT}) {
            values.put(new FieldKey(kind, "test-context-type"), item -> item.buildContext().contextType());
            values.put(new FieldKey(kind, "test-context-instance"), item -> item.buildContext().instance());
            values.put(new FieldKey(kind, "test-run"), item -> item.buildContext().runFunction());
        }
        values.put(new FieldKey(ItemKind.RUNTIME_MEASUREMENT, "test-context-type"),
            item -> item.buildContext().contextType());
        values.put(new FieldKey(ItemKind.TEST_SUITE, "test-suite-name"),
            item -> ((TestSuiteItem) item).suiteName());
        VALUES = Map.copyOf(values);
    }

    /**
     * 텍스트 치환.
     *
     * @param item 치환 대상 항목
     * @param text 원본 텍스트 (null이면 빈 문자열로 취급)
     * @param counter 현재 단계 카운터
     * @return 치환된 텍스트와 갱신된 카운터
     * @throws IllegalArgumentException item 또는 counter가 null인 경우
     * @throws ConfigurationException 알 수 없는 치환 키인 경우
     */
    public Substitution substitute(TestItem item, String text, StepCounter counter) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (counter == null) {
            throw new IllegalArgumentException("counter cannot be null");
        }
        if (text == null || text.isEmpty()) {
            return new Substitution("", counter);
        }

        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        StepCounter current = counter;
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement;
            Matcher steps = STEPS.matcher(key);
            if ("step".equals(key)) {
                replacement = Integer.toString(current.value());
                current = current.advance(1);
            } else if (steps.matches()) {
                int n = Integer.parseInt(steps.group(1));
                replacement = "Accounts for " + n + " test plan steps";
                current = current.advance(n);
            } else {
                replacement = resolve(item, key);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return new Substitution(sb.toString(), current);
    }

    /**
     * 단계 카운터 없이 텍스트 치환.
     *
     * <p>설명 텍스트처럼 계획 단계에 포함되지 않는 텍스트용입니다.</p>
     *
     * @param item 치환 대상 항목
     * @param text 원본 텍스트
     * @return 치환된 텍스트
     */
    public String substitute(TestItem item, String text) {
        return substitute(item, text, StepCounter.initial()).text();
    }

    private static String resolve(TestItem item, String key) {
        if (!key.startsWith(ITEM_FIELD_PREFIX)) {
            throw new ConfigurationException("substitution", "Unknown substitution ${" + key + "} in " + item.uid());
        }
        String field = key.substring(ITEM_FIELD_PREFIX.length());
        Function<TestItem, String> value = VALUES.get(new FieldKey(item.kind(), field));
        if (value == null) {
            throw new ConfigurationException("substitution",
                "Field '" + field + "' is not available for " + item.kind() + " item " + item.uid());
        }
        return value.apply(item);
    }

    /**
     * 치환 가능한 필드인지 확인.
     *
     * @param kind 항목 종류
     * @param field 필드 이름
     * @return 테이블에 존재하면 true
     */
    public static boolean supports(ItemKind kind, String field) {
        return VALUES.containsKey(new FieldKey(kind, field));
    }
}
