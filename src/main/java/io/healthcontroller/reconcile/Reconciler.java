package io.healthcontroller.reconcile;

import io.healthcontroller.models.ObjectKey;

/**
 * Converges one object towards its desired state. Must be safe to call repeatedly.
 */
public interface Reconciler {

    ReconcileResult reconcile(ObjectKey key) throws Exception;
}
