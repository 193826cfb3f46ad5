package io.chatflow.core.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ConditionOperator")
class ConditionOperatorTest {

    @ParameterizedTest(name = "{1} {0} {2} -> {3}")
    @CsvSource({
        "equals, Yes, yes, true",
        "not_equals, yes, no, true",
        "contains, I need HELP, help, true",
        "not_contains, bye, help, true",
        "starts_with, Hello there, hello, true",
        "ends_with, Thanks!, ks!, true",
        "gt, 10, 9.5, true",
        "lt, 3, 3, false",
        "gte, 3, 3, true",
        "lte, abc, 3, false",
        "regex, order #123, '#\\d+', true"
    })
    void shouldCompareCaseInsensitively(
            String operator, String actual, String expected, boolean outcome) {
        assertThat(ConditionOperator.parse(operator).orElseThrow().test(actual, expected))
                .isEqualTo(outcome);
    }

    @Test
    void shouldTreatBlankAsEmpty() {
        assertThat(ConditionOperator.IS_EMPTY.test("  ", "")).isTrue();
        assertThat(ConditionOperator.IS_NOT_EMPTY.test("x", "")).isTrue();
    }

    @Test
    void shouldParseWireNamesIgnoringCase() {
        assertThat(ConditionOperator.parse(" Starts_With ")).contains(ConditionOperator.STARTS_WITH);
        assertThat(ConditionOperator.parse("between")).isEmpty();
        assertThat(ConditionOperator.parse(null)).isEmpty();
    }

    @Test
    void shouldRejectInvalidRegex() {
        assertThatThrownBy(() -> ConditionOperator.REGEX.test("a", "("))
                .isInstanceOf(PatternSyntaxException.class);
    }
}
