package io.github.reugn.props4j;

/**
 * The kind tag carried by every registered property type.
 */
public enum TypeKind {
    /**
     * Properties are settable and back a flat wire name to value map.
     */
    INPUT("input", "@InputType"),
    /**
     * Properties are read-only, normally populated once from an external payload.
     */
    OUTPUT("output", "@OutputType");

    private final String displayName;
    private final String annotation;

    TypeKind(String displayName, String annotation) {
        this.displayName = displayName;
        this.annotation = annotation;
    }

    /**
     * @return lower-case name used in diagnostics
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return the annotation marking declarations of this kind, as written in source
     */
    public String annotation() {
        return annotation;
    }
}
