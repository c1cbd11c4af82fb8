package io.github.reugn.props4j.exceptions;

/**
 * Thrown when an output type is initialized from a payload that is not a mapping.
 */
public class PayloadTypeMismatchException extends IllegalArgumentException {
    private final Class<?> type;

    public PayloadTypeMismatchException(Class<?> type, Object payload) {
        super("Expected value to be a Map when initializing " + type.getSimpleName() + ", got "
                + (payload == null ? "null" : payload.getClass().getName()));
        this.type = type;
    }

    public Class<?> type() {
        return type;
    }
}
