package com.ryuqq.transmap.application.substitution;

import com.ryuqq.transmap.application.item.ItemKind;
import com.ryuqq.transmap.application.item.TestCaseItem;
import com.ryuqq.transmap.application.item.TestSuiteItem;
import com.ryuqq.transmap.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PlanTextSubstitutor 유닛 테스트.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
class PlanTextSubstitutorTest {

    private final PlanTextSubstitutor substitutor = new PlanTextSubstitutor();
    private final TestCaseItem testCase = new TestCaseItem("/rtems/task/val/one", "Tests a task.", null, List.of());

    @Test
    void step_치환마다_카운터_1_증가() {
        // when
        Substitution result = substitutor.substitute(testCase,
            "T_step_true(${step}, ok); T_step_true(${step}, done);", StepCounter.initial());

        // then
        assertThat(result.text()).isEqualTo("T_step_true(0, ok); T_step_true(1, done);");
        assertThat(result.counter()).isEqualTo(new StepCounter(2));
    }

    @Test
    void steps_N_치환은_N만큼_증가() {
        // when
        Substitution result = substitutor.substitute(testCase, "/* ${steps/3} */ ${step}", new StepCounter(5));

        // then
        assertThat(result.text()).isEqualTo("/* Accounts for 3 test plan steps */ 8");
        assertThat(result.counter().value()).isEqualTo(9);
    }

    @Test
    void 카운터는_호출_간에_명시적으로_전달됨() {
        // given
        StepCounter counter = StepCounter.initial();

        // when
        Substitution first = substitutor.substitute(testCase, "${step}", counter);
        Substitution second = substitutor.substitute(testCase, "${step}", first.counter());

        // then
        assertThat(counter.value()).isZero();
        assertThat(second.text()).isEqualTo("1");
    }

    @Test
    void 항목_필드는_종류별_테이블로_해석() {
        // when
        String text = substitutor.substitute(testCase,
            "${.:/test-context-type} *ctx = &${.:/test-context-instance}; ${.:/test-run}(ctx);");

        // then
        assertThat(text).isEqualTo("RtemsTaskValOne_Context *ctx = &RtemsTaskValOne_Instance; RtemsTaskValOne_Run(ctx);");
    }

    @Test
    void 스위트_이름_필드() {
        // given
        TestSuiteItem suite = new TestSuiteItem("/testsuites/smoke", "Smoke.", null, "SmokeSuite", "");

        // when & then
        assertThat(substitutor.substitute(suite, "const char *name = \"${.:/test-suite-name}\";"))
            .isEqualTo("const char *name = \"SmokeSuite\";");
    }

    @Test
    void 종류에_없는_필드는_설정_오류() {
        // given
        TestSuiteItem suite = new TestSuiteItem("/testsuites/smoke", "Smoke.", null, "SmokeSuite", "");

        // when & then
        assertThatThrownBy(() -> substitutor.substitute(suite, "${.:/test-run}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("test-run");
        assertThat(PlanTextSubstitutor.supports(ItemKind.TEST_SUITE, "test-run")).isFalse();
        assertThat(PlanTextSubstitutor.supports(ItemKind.ACTION_REQUIREMENT, "test-run")).isTrue();
    }

    @Test
    void 알_수_없는_치환은_설정_오류() {
        assertThatThrownBy(() -> substitutor.substitute(testCase, "${unknown}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("${unknown}");
    }

    @Test
    void null_텍스트는_빈_문자열() {
        // when
        Substitution result = substitutor.substitute(testCase, null, new StepCounter(3));

        // then
        assertThat(result.text()).isEmpty();
        assertThat(result.counter().value()).isEqualTo(3);
    }

    @Test
    void 음수_진행은_예외() {
        assertThatThrownBy(() -> StepCounter.initial().advance(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
