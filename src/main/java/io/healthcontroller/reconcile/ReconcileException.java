package io.healthcontroller.reconcile;

import io.healthcontroller.models.ObjectKey;
import lombok.Getter;

/**
 * Failed reconciliation pass for one policy. A failure to write the policy back
 * is attached as a suppressed exception rather than replacing the original cause.
 */
@Getter
public class ReconcileException extends Exception {

    private final ObjectKey policyKey;

    public ReconcileException(ObjectKey policyKey, String message, Throwable cause) {
        super(message, cause);
        this.policyKey = policyKey;
    }
}
