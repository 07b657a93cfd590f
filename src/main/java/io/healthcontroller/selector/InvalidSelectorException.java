package io.healthcontroller.selector;

/**
 * Thrown when a label selector cannot be turned into a matcher.
 */
public class InvalidSelectorException extends Exception {

    public InvalidSelectorException(String message) {
        super(message);
    }
}
