package io.healthcontroller.store;

/**
 * Thrown when a compare-and-swap write loses against a concurrent writer.
 */
public class ConflictException extends Exception {

    public ConflictException(String message) {
        super(message);
    }
}
