package io.github.reugn.props4j.exceptions;

/**
 * Thrown when a property wire name is {@code null} or empty.
 */
public class InvalidPropertyNameException extends IllegalArgumentException {

    public InvalidPropertyNameException(String message) {
        super(message);
    }
}
