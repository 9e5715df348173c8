package com.ryuqq.transmap.application.item;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TestCaseItem 유닛 테스트.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class TestCaseItemTest {

    private static TestCaseItem sample() {
        return new TestCaseItem(
            "/rtems/sem/val/obtain",
            "Tests ${.:/test-run}.",
            "Validates semaphore obtain.",
            List.of(
                new TestAction("Create a semaphore.", "sc = create();",
                    List.of(new TestCheck("Check the status.", "T_step_rsc_success(${step}, sc);"))),
                new TestAction("Obtain it.", "${steps/2}",
                    List.of(
                        new TestCheck("Check the status.", "T_step_rsc_success(${step}, sc);"),
                        new TestCheck("Check the owner.", "T_step_eq_ptr(${step}, owner, self);")
                    ))
            )
        );
    }

    @Test
    void 계획_단계_수는_step_전개_수() {
        // when
        EmittedItem emitted = sample().render();

        // then
        assertThat(emitted.planSteps()).isEqualTo(5);
        assertThat(emitted.body()).containsExactly(
            "sc = create();",
            "T_step_rsc_success(0, sc);",
            "Accounts for 2 test plan steps",
            "T_step_rsc_success(3, sc);",
            "T_step_eq_ptr(4, owner, self);"
        );
    }

    @Test
    void 설명은_액션과_검사를_나열() {
        // when
        ItemDescription description = sample().describe();

        // then
        assertThat(description.groupIdentifier()).isEqualTo("TestCaseRtemsSemValObtain");
        assertThat(description.brief()).isEqualTo("Tests RtemsSemValObtain_Run.");
        assertThat(description.details()).containsExactly(
            "Validates semaphore obtain.",
            "This test case performs the following actions:",
            "- Create a semaphore.",
            "  - Check the status.",
            "- Obtain it.",
            "  - Check the status.",
            "  - Check the owner."
        );
    }

    @Test
    void 같은_항목은_여러_번_렌더링해도_같은_결과() {
        // given
        TestCaseItem item = sample();

        // when & then
        assertThat(item.render()).isEqualTo(item.render());
    }
}
