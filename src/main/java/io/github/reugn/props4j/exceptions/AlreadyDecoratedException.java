package io.github.reugn.props4j.exceptions;

import io.github.reugn.props4j.TypeKind;

/**
 * Thrown when a class that already carries a kind tag is marked as an input or output type again.
 */
public class AlreadyDecoratedException extends IllegalStateException {
    private final Class<?> type;
    private final TypeKind existingKind;

    public AlreadyDecoratedException(Class<?> type, TypeKind existingKind) {
        super("Cannot apply @InputType and @OutputType more than once: " + type.getName()
                + " is already registered as an " + existingKind.displayName() + " type");
        this.type = type;
        this.existingKind = existingKind;
    }

    public Class<?> type() {
        return type;
    }

    public TypeKind existingKind() {
        return existingKind;
    }
}
