package io.healthcontroller.selector;

import io.healthcontroller.enums.SelectorOperator;
import io.healthcontroller.models.LabelSelector;
import io.healthcontroller.models.LabelSelectorRequirement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Converts stored label selectors into matchers and applies the health check matching rule.
 */
@Slf4j
public final class LabelSelectors {

    private LabelSelectors() {
        // Utility class
    }

    /**
     * Parse a label selector. A null selector yields an empty selector.
     *
     * @throws InvalidSelectorException on an unknown operator, a missing key, or a value list
     *         that does not fit the operator
     */
    public static Selector toSelector(LabelSelector labelSelector) throws InvalidSelectorException {
        List<Selector.Requirement> requirements = new ArrayList<>();
        if (labelSelector == null) {
            return new Selector(requirements);
        }

        Map<String, String> matchLabels = labelSelector.getMatchLabels() != null
                ? new TreeMap<>(labelSelector.getMatchLabels())
                : Map.of();
        for (Map.Entry<String, String> entry : matchLabels.entrySet()) {
            validateKey(entry.getKey());
            requirements.add(new Selector.Requirement(entry.getKey(), SelectorOperator.IN, Set.of(nullToEmpty(entry.getValue()))));
        }

        if (labelSelector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement expression : labelSelector.getMatchExpressions()) {
                requirements.add(toRequirement(expression));
            }
        }

        requirements.sort(Comparator.comparing(Selector.Requirement::getKey));
        return new Selector(requirements);
    }

    /**
     * Health check matching rule: a selector that fails to parse or is empty matches nothing.
     */
    public static boolean matchesLabels(LabelSelector labelSelector, Map<String, String> labels) {
        Selector selector;
        try {
            selector = toSelector(labelSelector);
        } catch (InvalidSelectorException e) {
            log.warn("Ignoring invalid label selector {}: {}", labelSelector, e.getMessage());
            return false;
        }
        if (selector.isEmpty()) {
            return false;
        }
        return selector.matches(labels);
    }

    private static Selector.Requirement toRequirement(LabelSelectorRequirement expression) throws InvalidSelectorException {
        if (expression == null) {
            throw new InvalidSelectorException("null match expression");
        }
        validateKey(expression.getKey());

        SelectorOperator operator = SelectorOperator.fromString(expression.getOperator());
        if (operator == null) {
            throw new InvalidSelectorException("unknown operator '" + expression.getOperator() + "' for key " + expression.getKey());
        }

        Set<String> values = expression.getValues() != null ? new TreeSet<>(expression.getValues()) : new TreeSet<>();
        switch (operator) {
            case IN:
            case NOT_IN:
                if (values.isEmpty()) {
                    throw new InvalidSelectorException("operator " + operator.getValue() + " requires values for key " + expression.getKey());
                }
                break;
            case EXISTS:
            case DOES_NOT_EXIST:
                if (!values.isEmpty()) {
                    throw new InvalidSelectorException("operator " + operator.getValue() + " takes no values for key " + expression.getKey());
                }
                break;
            default:
                break;
        }
        return new Selector.Requirement(expression.getKey(), operator, values);
    }

    private static void validateKey(String key) throws InvalidSelectorException {
        if (key == null || key.isBlank()) {
            throw new InvalidSelectorException("label selector key must not be empty");
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
