package com.ryuqq.transmap.application.item;

import com.ryuqq.transmap.core.error.ConfigurationException;
import com.ryuqq.transmap.core.model.Condition;
import com.ryuqq.transmap.core.model.ConditionModel;
import com.ryuqq.transmap.core.table.TransitionRow;
import com.ryuqq.transmap.core.table.TransitionTable;
import com.ryuqq.transmap.core.table.TransitionTableCompiler;

import java.util.List;
import java.util.Set;

/**
 * 검증 전의 액션 요구사항 선언.
 *
 * <p>명세 로더가 만들어내는 원시 입력입니다. {@link #compile()}에서 조건 모델과
 * 전이 테이블을 검증하며, 이 단계의 실패는 해당 항목에만 영향을 줍니다.</p>
 *
 * @param uid 항목 uid
 * @param brief 요약
 * @param description 상세 설명 (nullable)
 * @param preConditions 선행 조건 (바깥 → 안쪽 순서)
 * @param postConditions 사후 조건
 * @param rows 전이 맵 행
 * @param skipReasons 선언된 skip 사유
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record ActionRequirementSpec(
    String uid,
    String brief,
    String description,
    List<Condition> preConditions,
    List<Condition> postConditions,
    List<TransitionRow> rows,
    Set<String> skipReasons
) {

    public ActionRequirementSpec {
        ItemTexts.requireText(uid, "uid");
        ItemTexts.requireText(brief, "brief");
        preConditions = preConditions == null ? List.of() : List.copyOf(preConditions);
        postConditions = postConditions == null ? List.of() : List.copyOf(postConditions);
        rows = rows == null ? List.of() : List.copyOf(rows);
        skipReasons = skipReasons == null ? Set.of() : Set.copyOf(skipReasons);
    }

    /**
     * 조건 모델과 전이 테이블을 검증하여 실행 가능한 항목 생성.
     *
     * @return ActionRequirementItem
     * @throws ConfigurationException 조건 모델 또는 전이 맵이 유효하지 않은 경우
     */
    public ActionRequirementItem compile() {
        ConditionModel model = new ConditionModel(preConditions, postConditions);
        TransitionTable table = new TransitionTableCompiler(model, skipReasons).compile(rows);
        return new ActionRequirementItem(uid, brief, description, table);
    }
}
