package io.healthcontroller.routing;

import io.healthcontroller.enums.ObjectKind;
import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.ObjectKey;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class ClusterChangeEvent extends ObjectChangeEvent {

    private final Cluster cluster;

    public ClusterChangeEvent(Cluster cluster) {
        this.cluster = cluster;
    }

    @Override
    public ObjectKind getKind() {
        return ObjectKind.CLUSTER;
    }

    @Override
    List<ObjectKey> routeWith(EventRouter router) {
        return router.clusterToPolicies(cluster);
    }
}
