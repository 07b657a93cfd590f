package io.healthcontroller.selector;

import io.healthcontroller.enums.SelectorOperator;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed, immutable label selector. All requirements must hold for a match.
 */
public final class Selector {

    private final List<Requirement> requirements;

    Selector(List<Requirement> requirements) {
        this.requirements = Collections.unmodifiableList(requirements);
    }

    public boolean isEmpty() {
        return requirements.isEmpty();
    }

    public List<Requirement> getRequirements() {
        return requirements;
    }

    public boolean matches(Map<String, String> labels) {
        Map<String, String> actual = labels != null ? labels : Map.of();
        for (Requirement requirement : requirements) {
            if (!requirement.matches(actual)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return requirements.toString();
    }

    @Getter
    public static final class Requirement {
        private final String key;
        private final SelectorOperator operator;
        private final Set<String> values;

        Requirement(String key, SelectorOperator operator, Set<String> values) {
            this.key = key;
            this.operator = operator;
            this.values = values;
        }

        boolean matches(Map<String, String> labels) {
            switch (operator) {
                case IN:
                    return labels.containsKey(key) && values.contains(labels.get(key));
                case NOT_IN:
                    return !labels.containsKey(key) || !values.contains(labels.get(key));
                case EXISTS:
                    return labels.containsKey(key);
                case DOES_NOT_EXIST:
                    return !labels.containsKey(key);
                default:
                    return false;
            }
        }

        @Override
        public String toString() {
            switch (operator) {
                case EXISTS:
                    return key;
                case DOES_NOT_EXIST:
                    return "!" + key;
                default:
                    return key + " " + operator.getValue() + " " + values;
            }
        }
    }
}
