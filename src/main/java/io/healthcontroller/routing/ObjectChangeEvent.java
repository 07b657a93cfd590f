package io.healthcontroller.routing;

import io.healthcontroller.enums.ObjectKind;
import io.healthcontroller.models.ObjectKey;

import java.util.List;

/**
 * A change observed on a Cluster, Machine or Node. Each variant knows which
 * {@link EventRouter} mapping handles it.
 */
public abstract class ObjectChangeEvent {

    public abstract ObjectKind getKind();

    abstract List<ObjectKey> routeWith(EventRouter router);
}
