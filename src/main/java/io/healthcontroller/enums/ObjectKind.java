package io.healthcontroller.enums;

/**
 * Kinds of objects whose changes can trigger a health check reconciliation.
 */
public enum ObjectKind {
    CLUSTER,
    MACHINE,
    NODE
}
