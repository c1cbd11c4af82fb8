package io.github.reugn.props4j.exceptions;

import io.github.reugn.props4j.TypeKind;

/**
 * Thrown when a type introspection query targets a class lacking the required kind tag.
 */
public class MissingTypeKindException extends IllegalStateException {
    private final Class<?> type;
    private final TypeKind requiredKind;

    public MissingTypeKindException(Class<?> type, TypeKind requiredKind) {
        super(type.getName() + " is not registered as an " + requiredKind.displayName() + " type");
        this.type = type;
        this.requiredKind = requiredKind;
    }

    public Class<?> type() {
        return type;
    }

    public TypeKind requiredKind() {
        return requiredKind;
    }
}
