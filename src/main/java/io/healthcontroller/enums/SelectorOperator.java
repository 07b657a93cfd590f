package io.healthcontroller.enums;

/**
 * Operators of set-based label selector expressions.
 */
public enum SelectorOperator {
    IN("In"),
    NOT_IN("NotIn"),
    EXISTS("Exists"),
    DOES_NOT_EXIST("DoesNotExist");

    private final String value;

    SelectorOperator(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SelectorOperator fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (SelectorOperator operator : SelectorOperator.values()) {
            if (operator.value.equalsIgnoreCase(trimmed) || operator.name().equalsIgnoreCase(trimmed)) {
                return operator;
            }
        }

        return null;
    }
}
