package io.github.reugn.props4j;

import io.github.reugn.props4j.exceptions.InvalidPropertyNameException;

/**
 * Immutable description of one property: its wire name, its default value and its declared type.
 *
 * <p>The default is either a value (possibly {@code null}) or the {@link #ABSENT} sentinel,
 * which means no default was declared. The declared type is attached once the declaration
 * that introduced the property has been scanned; until then it is {@code null}.
 *
 * @param name         the wire name; never empty
 * @param defaultValue the default value, or {@link #ABSENT}
 * @param type         the declared type, or {@code null} if not attached yet
 */
public record PropertyDescriptor(String name, Object defaultValue, TypeExpr type) {

    /**
     * Sentinel marking a property declared without a default. Distinct from every legal value,
     * {@code null} included.
     */
    public static final Object ABSENT = new Object() {
        @Override
        public String toString() {
            return "ABSENT";
        }
    };

    public PropertyDescriptor {
        PropertyTypes.requireName(name);
    }

    /**
     * Creates a descriptor without a default value.
     *
     * @param name the wire name
     * @return a new descriptor
     * @throws InvalidPropertyNameException if {@code name} is null or empty
     */
    public static PropertyDescriptor of(String name) {
        return new PropertyDescriptor(name, ABSENT, null);
    }

    /**
     * Creates a descriptor with a default value.
     *
     * @param name         the wire name
     * @param defaultValue the default, {@code null} allowed
     * @return a new descriptor
     * @throws InvalidPropertyNameException if {@code name} is null or empty
     */
    public static PropertyDescriptor of(String name, Object defaultValue) {
        return new PropertyDescriptor(name, defaultValue, null);
    }

    /**
     * @return {@code true} unless the default is {@link #ABSENT}
     */
    public boolean hasDefault() {
        return defaultValue != ABSENT;
    }

    /**
     * Returns a copy of this descriptor carrying the given declared type.
     */
    public PropertyDescriptor withType(TypeExpr type) {
        return new PropertyDescriptor(name, defaultValue, type);
    }
}
