package io.healthcontroller.store;

import io.healthcontroller.models.ObjectKey;
import lombok.Getter;

/**
 * Thrown when an object the caller depends on is absent from the store.
 */
@Getter
public class ResourceNotFoundException extends Exception {

    private final String kind;
    private final ObjectKey key;

    public ResourceNotFoundException(String kind, ObjectKey key) {
        super(kind + " " + key + " not found");
        this.kind = kind;
        this.key = key;
    }
}
