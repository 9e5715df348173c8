package com.ryuqq.transmap.application.item;

import com.ryuqq.transmap.core.model.ConditionModel;
import com.ryuqq.transmap.core.model.State;
import com.ryuqq.transmap.core.synth.Combination;
import com.ryuqq.transmap.core.synth.Synthesizer;
import com.ryuqq.transmap.core.table.TransitionTable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 전이 맵으로부터 합성되는 액션 요구사항 테스트.
 *
 * <p>검증된 {@link TransitionTable}과 그 위의 {@link Synthesizer}를 소유합니다.
 * 생성 결과의 계획 단계 수는 {@link Synthesizer#planSize()}입니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public final class ActionRequirementItem implements TestItem {

    private final String uid;
    private final String brief;
    private final String description;
    private final Synthesizer synthesizer;

    /**
     * 생성자.
     *
     * @param uid 항목 uid
     * @param brief 요약
     * @param description 상세 설명 (nullable)
     * @param table 검증된 전이 테이블
     * @throws IllegalArgumentException uid, brief, table이 유효하지 않은 경우
     */
    public ActionRequirementItem(String uid, String brief, String description, TransitionTable table) {
        ItemTexts.requireText(uid, "uid");
        ItemTexts.requireText(brief, "brief");
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        this.uid = uid;
        this.brief = brief;
        this.description = description;
        this.synthesizer = new Synthesizer(table);
    }

    @Override
    public ItemKind kind() {
        return ItemKind.ACTION_REQUIREMENT;
    }

    @Override
    public String uid() {
        return uid;
    }

    @Override
    public String brief() {
        return brief;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public ItemDescription describe() {
        ConditionModel model = getModel();
        List<String> details = new ArrayList<>();
        for (int i = 0; i < model.preConditionCount(); i++) {
            details.add("Pre-condition " + model.preCondition(i).name() + ": " + names(model.preCondition(i).states()));
        }
        for (int j = 0; j < model.postConditionCount(); j++) {
            details.add("Post-condition " + model.postCondition(j).name() + ": " + names(model.postCondition(j).states()));
        }
        return ItemTexts.describe(this, details);
    }

    /**
     * 실행될 조합마다 한 줄씩 기대 결과를 기술한 생성 결과.
     *
     * <p>예: {@code Fast/Full -> Result=Error}</p>
     */
    @Override
    public EmittedItem render() {
        ConditionModel model = getModel();
        List<String> body = new ArrayList<>();
        Iterator<Combination> it = synthesizer.steps();
        while (it.hasNext()) {
            Combination combination = it.next();
            if (!combination.isDispatched()) {
                continue;
            }
            StringBuilder line = new StringBuilder(combination.scope()).append(" ->");
            for (int j = 0; j < model.postConditionCount(); j++) {
                line.append(' ')
                    .append(model.postCondition(j).name())
                    .append('=')
                    .append(combination.expectedAt(j).getName());
            }
            body.add(line.toString());
        }
        return new EmittedItem(kind(), buildContext(), describe(), synthesizer.planSize(), body);
    }

    private static String names(List<State> states) {
        List<String> names = new ArrayList<>(states.size());
        for (State state : states) {
            names.add(state.getName());
        }
        return String.join(", ", names);
    }

    public Synthesizer getSynthesizer() {
        return synthesizer;
    }

    public TransitionTable getTable() {
        return synthesizer.getTable();
    }

    public ConditionModel getModel() {
        return synthesizer.getModel();
    }

    @Override
    public String toString() {
        return "ActionRequirementItem{uid='" + uid + "', planSize=" + synthesizer.planSize() + "}";
    }
}
