package io.healthcontroller.routing;

import io.healthcontroller.enums.ObjectKind;
import io.healthcontroller.models.Node;
import io.healthcontroller.models.ObjectKey;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Node change on a target cluster. Carries the cluster it was observed on since node
 * names are only unique within one cluster.
 */
@Getter
@ToString
public class NodeChangeEvent extends ObjectChangeEvent {

    private final ObjectKey clusterKey;
    private final Node node;

    public NodeChangeEvent(ObjectKey clusterKey, Node node) {
        this.clusterKey = clusterKey;
        this.node = node;
    }

    @Override
    public ObjectKind getKind() {
        return ObjectKind.NODE;
    }

    @Override
    List<ObjectKey> routeWith(EventRouter router) {
        return router.nodeToPolicies(clusterKey, node);
    }
}
