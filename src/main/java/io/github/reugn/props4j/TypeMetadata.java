package io.github.reugn.props4j;

import java.util.Map;

/**
 * Registered metadata of a property type: its kind tag and its declaration.
 *
 * @param kind        the kind tag
 * @param type        the registered class
 * @param declaration the declared properties and getters
 */
public record TypeMetadata(TypeKind kind, Class<?> type, TypeDeclaration declaration) {

    public Class<?> declaringType() {
        return declaration.declaringType();
    }

    /**
     * @return in-memory name to descriptor, in declaration order
     */
    public Map<String, PropertyDescriptor> properties() {
        return declaration.properties();
    }

    /**
     * @return wire name to declared return type, for every getter
     */
    public Map<String, TypeExpr> getters() {
        return declaration.getters();
    }

    /**
     * @return {@code true} if the registered class is a native mapping type
     */
    public boolean isMapping() {
        return Map.class.isAssignableFrom(type);
    }
}
