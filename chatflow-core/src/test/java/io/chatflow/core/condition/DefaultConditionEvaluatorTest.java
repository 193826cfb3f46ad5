package io.chatflow.core.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chatflow.core.execution.executor.ExecutionContext;
import io.chatflow.core.template.SimpleTemplateResolver;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultConditionEvaluator")
class DefaultConditionEvaluatorTest {

    private final DefaultConditionEvaluator evaluator =
            new DefaultConditionEvaluator(
                    new SimpleTemplateResolver(),
                    Map.of("needs_help", (value, context) -> value.toLowerCase().contains("help")));

    private ExecutionContext context(String message) {
        return ExecutionContext.builder()
                .userMessage(message)
                .variables(Map.of("lookup", Map.of("status", "OPEN")))
                .build();
    }

    @Test
    void shouldDefaultVariableToUserMessage() throws Exception {
        // When
        ConditionOutcome outcome =
                evaluator.evaluate(
                        Map.of("operator", "contains", "value", "refund"),
                        context("I want a Refund"));

        // Then
        assertThat(outcome.met()).isTrue();
        assertThat(outcome.rule()).isEqualTo("contains");
        assertThat(outcome.value()).isEqualTo("I want a Refund");
    }

    @Test
    void shouldResolveVariableFromPriorNodeOutput() throws Exception {
        // When
        ConditionOutcome outcome =
                evaluator.evaluate(
                        Map.of("variable", "{{lookup.status}}", "operator", "equals", "value", "open"),
                        context("status?"));

        // Then
        assertThat(outcome.met()).isTrue();
        assertThat(outcome.value()).isEqualTo("OPEN");
    }

    @Test
    void shouldApplyNamedPredicate() throws Exception {
        // When / Then
        assertThat(evaluator.evaluate(Map.of("predicate", "needs_help"), context("I need help")).met())
                .isTrue();
        assertThat(evaluator.evaluate(Map.of("predicate", "needs_help"), context("bye")).met())
                .isFalse();
        assertThat(evaluator.hasPredicate("needs_help")).isTrue();
    }

    @Test
    void shouldRejectUnknownPredicate() {
        assertThatThrownBy(() -> evaluator.evaluate(Map.of("predicate", "nope"), context("x")))
                .isInstanceOf(ConditionEvaluationException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void shouldRejectMissingOperator() {
        assertThatThrownBy(() -> evaluator.evaluate(Map.of(), context("x")))
                .isInstanceOf(ConditionEvaluationException.class)
                .hasMessageContaining("Unknown operator");
    }

    @Test
    void shouldWrapInvalidRegex() {
        assertThatThrownBy(
                        () ->
                                evaluator.evaluate(
                                        Map.of("operator", "regex", "value", "("), context("x")))
                .isInstanceOf(ConditionEvaluationException.class)
                .hasMessageContaining("Invalid regex");
    }
}
