package com.ryuqq.transmap.application.runner;

import com.ryuqq.transmap.application.item.ActionRequirementItem;

/**
 * 액션 요구사항 실행기.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ActionRequirementItem item = spec.compile();
 * RunReport report = runner.run(item, new ActionBinding(callbacks, fixture));
 *
 * // 콜백 안에서 현재 조합 식별
 * String scope = runner.scope();   // "Fast/NA"
 * </pre>
 *
 * <p>구현체는 adapter-runner 모듈에 위치합니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public interface ItemRunner {

    /**
     * 항목 실행.
     *
     * @param item 실행할 액션 요구사항
     * @param binding 콜백과 fixture
     * @return 실행 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws RuntimeException 콜백 실패가 계속 진행으로 해소되지 않은 경우 그대로 전파
     */
    RunReport run(ActionRequirementItem item, ActionBinding binding);

    /**
     * 현재 조합의 출력용 scope.
     *
     * @return 상태 이름을 {@code /}로 연결한 문자열, 조합 반복 밖에서는 빈 문자열
     */
    String scope();

    /**
     * 조합 반복 중인지 확인.
     *
     * @return setup 이후 stop 이전이면 true
     */
    boolean isInActionLoop();
}
