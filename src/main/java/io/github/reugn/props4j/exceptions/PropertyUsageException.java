package io.github.reugn.props4j.exceptions;

/**
 * Thrown when a property operation is invoked against an instance whose class does not carry
 * the kind tag the operation requires.
 */
public class PropertyUsageException extends IllegalStateException {
    private final Class<?> type;

    public PropertyUsageException(Class<?> type, String message) {
        super(message + " (got " + type.getName() + ")");
        this.type = type;
    }

    public Class<?> type() {
        return type;
    }
}
