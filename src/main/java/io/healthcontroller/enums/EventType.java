package io.healthcontroller.enums;

/**
 * Severity of a policy event.
 */
public enum EventType {
    NORMAL,
    WARNING
}
