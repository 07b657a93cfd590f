package io.healthcontroller.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Namespaced identity of a stored object.
 */
@Getter
@EqualsAndHashCode
public final class ObjectKey {

    private final String namespace;
    private final String name;

    private ObjectKey(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    public static ObjectKey of(String namespace, String name) {
        if (namespace == null || namespace.isBlank() || name == null || name.isBlank()) {
            throw new IllegalArgumentException("namespace and name are required, got '" + namespace + "/" + name + "'");
        }
        return new ObjectKey(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
