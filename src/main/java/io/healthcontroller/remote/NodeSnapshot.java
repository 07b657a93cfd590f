package io.healthcontroller.remote;

import io.healthcontroller.models.Node;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Full node listing together with the store revision it was read at.
 */
@Getter
@AllArgsConstructor
public class NodeSnapshot {
    private final List<Node> nodes;
    private final long revision;
}
