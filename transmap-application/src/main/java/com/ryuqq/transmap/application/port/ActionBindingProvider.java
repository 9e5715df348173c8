package com.ryuqq.transmap.application.port;

import com.ryuqq.transmap.application.item.ActionRequirementItem;
import com.ryuqq.transmap.application.runner.ActionBinding;

/**
 * 항목별 콜백/fixture 제공자.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActionBindingProvider {

    /**
     * 항목에 연결할 콜백과 fixture.
     *
     * @param item 실행할 액션 요구사항
     * @return ActionBinding
     */
    ActionBinding bindingFor(ActionRequirementItem item);
}
