package io.healthcontroller.remote;

import io.healthcontroller.models.Node;

/**
 * Callbacks for node changes streamed from a target cluster.
 */
public interface NodeWatchListener {

    void onNodeChanged(Node node);

    /**
     * @param node the last known state of the deleted node, or a bare node carrying only its name
     */
    void onNodeDeleted(Node node);

    void onError(Throwable error);
}
