package io.chatflow.core.execution.executor;

import io.chatflow.core.condition.ConditionEvaluationException;
import io.chatflow.core.condition.ConditionEvaluator;
import io.chatflow.core.condition.ConditionOperator;
import io.chatflow.core.condition.ConditionOutcome;
import io.chatflow.core.condition.DefaultConditionEvaluator;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Evaluates a condition and outputs a boolean; the engine follows the
/// outgoing edge labeled with that boolean.
///
/// @see io.chatflow.core.condition.DefaultConditionEvaluator for configuration keys
public class ConditionNodeExecutor implements NodeExecutor {

    private static final int VALUE_PREVIEW_LIMIT = 100;

    private final ConditionEvaluator evaluator;

    public ConditionNodeExecutor(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.CONDITION;
    }

    @Override
    public NodeResult execute(Node node, ExecutionContext context) {
        try {
            ConditionOutcome outcome = evaluator.evaluate(node.config(), context);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("condition_met", outcome.met());
            metadata.put("operator", outcome.rule());
            metadata.put("variable_value", ConfigValues.truncate(outcome.value(), VALUE_PREVIEW_LIMIT));
            return NodeResult.success(outcome.met(), metadata);
        } catch (ConditionEvaluationException e) {
            return NodeResult.failure("Condition evaluation failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            return NodeResult.failure("Condition predicate threw: " + e, e);
        }
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> problems = new ArrayList<>();
        if (ConfigValues.hasText(config, "predicate")) {
            String name = config.get("predicate").toString();
            if (evaluator instanceof DefaultConditionEvaluator defaults
                    && !defaults.hasPredicate(name)) {
                problems.add("Unknown condition predicate: " + name);
            }
            return problems;
        }
        if (!ConfigValues.hasText(config, "operator")) {
            problems.add("Condition node requires an 'operator' or a 'predicate'");
        } else if (ConditionOperator.parse(config.get("operator").toString()).isEmpty()) {
            problems.add("Unknown condition operator: " + config.get("operator"));
        }
        return problems;
    }
}
