package io.chatflow.core.condition;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/// Comparison operators available to condition nodes.
///
/// String comparisons ignore case. Numeric operators compare the operands as
/// decimal numbers and are false when either side is not numeric.
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    GT("gt"),
    LT("lt"),
    GTE("gte"),
    LTE("lte"),
    IS_EMPTY("is_empty"),
    IS_NOT_EMPTY("is_not_empty"),
    REGEX("regex");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Looks an operator up by its wire name, ignoring case.
    ///
    /// @param name the wire name, may be null
    /// @return the operator, or empty if unknown
    public static Optional<ConditionOperator> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ConditionOperator operator : values()) {
            if (operator.wireName.equals(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /// Applies the operator.
    ///
    /// @param actual the resolved variable value, not null
    /// @param expected the resolved comparison value, not null (ignored by emptiness checks)
    /// @return the comparison outcome
    /// @throws java.util.regex.PatternSyntaxException if `expected` is an invalid regex
    public boolean test(String actual, String expected) {
        String left = actual.toLowerCase(Locale.ROOT);
        String right = expected.toLowerCase(Locale.ROOT);
        return switch (this) {
            case EQUALS -> left.equals(right);
            case NOT_EQUALS -> !left.equals(right);
            case CONTAINS -> left.contains(right);
            case NOT_CONTAINS -> !left.contains(right);
            case STARTS_WITH -> left.startsWith(right);
            case ENDS_WITH -> left.endsWith(right);
            case GT -> compareNumbers(actual, expected, 1, false);
            case LT -> compareNumbers(actual, expected, -1, false);
            case GTE -> compareNumbers(actual, expected, 1, true);
            case LTE -> compareNumbers(actual, expected, -1, true);
            case IS_EMPTY -> actual.isBlank();
            case IS_NOT_EMPTY -> !actual.isBlank();
            case REGEX -> Pattern.compile(expected, Pattern.CASE_INSENSITIVE).matcher(actual).find();
        };
    }

    private static boolean compareNumbers(
            String actual, String expected, int direction, boolean orEqual) {
        try {
            int cmp =
                    Double.compare(
                            Double.parseDouble(actual.trim()), Double.parseDouble(expected.trim()));
            return cmp == direction || (orEqual && cmp == 0);
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
