package io.github.reugn.props4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The properties and getters a class declares, before a kind tag is attached.
 *
 * <p>Generated classes build their declaration in a static initializer:
 * <pre>{@code
 * static {
 *     PropertyTypes.markAsInputType(BucketArgsImpl.class, TypeDeclaration.builder(BucketArgs.class)
 *             .property("name", PropertyDescriptor.of("bucketName").withType(TypeExpr.plain(String.class)))
 *             .getter("bucketName", TypeExpr.plain(String.class))
 *             .build());
 * }
 * }</pre>
 *
 * @param declaringType the class the properties were declared on
 * @param properties    in-memory name to descriptor, in declaration order
 * @param getters       wire name to declared return type, for every getter of the class
 */
public record TypeDeclaration(Class<?> declaringType,
                              Map<String, PropertyDescriptor> properties,
                              Map<String, TypeExpr> getters) {

    public TypeDeclaration {
        Objects.requireNonNull(declaringType, "declaringType");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        getters = Collections.unmodifiableMap(new LinkedHashMap<>(getters));
    }

    public static Builder builder(Class<?> declaringType) {
        return new Builder(declaringType);
    }

    /**
     * Accumulates properties and getters in declaration order.
     */
    public static final class Builder {
        private final Class<?> declaringType;
        private final Map<String, PropertyDescriptor> properties = new LinkedHashMap<>();
        private final Map<String, TypeExpr> getters = new LinkedHashMap<>();

        private Builder(Class<?> declaringType) {
            this.declaringType = declaringType;
        }

        /**
         * Adds a declared property.
         *
         * @param fieldName  the in-memory name
         * @param descriptor the descriptor, with its declared type attached
         * @return this builder
         * @throws IllegalArgumentException if {@code fieldName} was already added
         */
        public Builder property(String fieldName, PropertyDescriptor descriptor) {
            Objects.requireNonNull(descriptor, "descriptor");
            if (properties.putIfAbsent(fieldName, descriptor) != null) {
                throw new IllegalArgumentException("Duplicate property '" + fieldName + "' in "
                        + declaringType.getSimpleName());
            }
            return this;
        }

        /**
         * Adds a getter reading {@code wireName}.
         *
         * @param wireName   the wire name the getter reads
         * @param returnType the getter's declared return type
         * @return this builder
         * @throws IllegalArgumentException if a getter for {@code wireName} was already added
         */
        public Builder getter(String wireName, TypeExpr returnType) {
            PropertyTypes.requireName(wireName);
            Objects.requireNonNull(returnType, "returnType");
            if (getters.putIfAbsent(wireName, returnType) != null) {
                throw new IllegalArgumentException("Duplicate getter for '" + wireName + "' in "
                        + declaringType.getSimpleName());
            }
            return this;
        }

        public TypeDeclaration build() {
            return new TypeDeclaration(declaringType, properties, getters);
        }
    }
}
