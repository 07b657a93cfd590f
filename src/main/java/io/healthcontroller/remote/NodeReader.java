package io.healthcontroller.remote;

import io.healthcontroller.models.Node;

import java.util.Optional;

/**
 * Read access to the nodes of one target cluster.
 */
public interface NodeReader {

    Optional<Node> getNode(String nodeName);
}
