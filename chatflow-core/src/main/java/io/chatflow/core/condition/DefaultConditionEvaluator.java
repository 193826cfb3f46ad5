package io.chatflow.core.condition;

import io.chatflow.core.execution.executor.ExecutionContext;
import io.chatflow.core.template.TemplateResolver;
import java.util.Map;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;

/// Evaluates operator comparisons and named predicates.
///
/// ### Configuration keys
/// - `variable`: template for the left-hand value, default `{{input}}`
/// - `operator`: one of {@link ConditionOperator}'s wire names
/// - `value`: template for the right-hand value, default empty
/// - `predicate`: name of a registered {@link ConditionPredicate}; takes precedence over `operator`
///
/// @implNote Immutable and thread-safe.
public final class DefaultConditionEvaluator implements ConditionEvaluator {

    public static final String DEFAULT_VARIABLE = "{{input}}";

    private final TemplateResolver templateResolver;
    private final Map<String, ConditionPredicate> predicates;

    public DefaultConditionEvaluator(
            TemplateResolver templateResolver, Map<String, ConditionPredicate> predicates) {
        this.templateResolver = Objects.requireNonNull(templateResolver, "templateResolver");
        this.predicates = Map.copyOf(predicates);
    }

    @Override
    public ConditionOutcome evaluate(Map<String, Object> config, ExecutionContext context)
            throws ConditionEvaluationException {
        Map<String, Object> values = context.templateVariables();
        String variable = stringOr(config.get("variable"), DEFAULT_VARIABLE);
        String actual = templateResolver.resolve(variable, values);

        Object predicateName = config.get("predicate");
        if (predicateName != null) {
            ConditionPredicate predicate = predicates.get(predicateName.toString());
            if (predicate == null) {
                throw new ConditionEvaluationException("Unknown predicate: " + predicateName);
            }
            return new ConditionOutcome(
                    predicate.test(actual, context), "predicate:" + predicateName, actual);
        }

        Object operatorName = config.get("operator");
        ConditionOperator operator =
                ConditionOperator.parse(operatorName != null ? operatorName.toString() : null)
                        .orElseThrow(
                                () ->
                                        new ConditionEvaluationException(
                                                "Unknown operator: " + operatorName));

        String expected = templateResolver.resolve(stringOr(config.get("value"), ""), values);
        try {
            return new ConditionOutcome(operator.test(actual, expected), operator.wireName(), actual);
        } catch (PatternSyntaxException e) {
            throw new ConditionEvaluationException("Invalid regex: " + e.getPattern(), e);
        }
    }

    /// Returns true if a predicate with this name is registered.
    public boolean hasPredicate(String name) {
        return predicates.containsKey(name);
    }

    private static String stringOr(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }
}
