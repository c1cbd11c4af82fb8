package io.github.reugn.props4j;

import io.github.reugn.props4j.exceptions.AlreadyDecoratedException;
import io.github.reugn.props4j.exceptions.InvalidPropertyNameException;
import io.github.reugn.props4j.exceptions.MissingTypeKindException;
import io.github.reugn.props4j.exceptions.PayloadTypeMismatchException;
import io.github.reugn.props4j.exceptions.PropertyUsageException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the property type runtime: registration, the access protocol and type
 * introspection.
 *
 * <p>Classes generated for {@code @InputType} and {@code @OutputType} declarations call into
 * this class from every synthesized method, so user code rarely needs it directly. It is also
 * the API for hand-written property types and for external code (serializers, validators)
 * inspecting registered classes.
 *
 * <p><b>Access protocol:</b>
 * <table border="1">
 *   <caption>Operations by kind</caption>
 *   <tr><th>Operation</th><th>Input type</th><th>Output type</th><th>Undecorated</th></tr>
 *   <tr><td>{@link #get}</td><td>reads the value store</td>
 *       <td>translates the name, then reads the mapping or the value store</td>
 *       <td>{@link PropertyUsageException}</td></tr>
 *   <tr><td>{@link #set}</td><td>writes the value store</td>
 *       <td>{@link PropertyUsageException}</td><td>{@link PropertyUsageException}</td></tr>
 *   <tr><td>{@link #inputTypeToMap}</td><td>copy of the value store</td>
 *       <td>{@link PropertyUsageException}</td><td>{@link PropertyUsageException}</td></tr>
 * </table>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * BucketArgs args = new BucketArgsImpl();
 * args.name("logs");
 * PropertyTypes.get(args, "bucketName");    // "logs"
 * PropertyTypes.inputTypeToMap(args);       // {bucketName=logs}
 * }</pre>
 *
 * @see TypeRegistry
 * @see TypeUnwrapper
 */
public final class PropertyTypes {

    private PropertyTypes() {
    }

    // ==================== DESCRIPTORS ====================

    /**
     * Creates a descriptor without a default value.
     *
     * @throws InvalidPropertyNameException if {@code name} is null or empty
     */
    public static PropertyDescriptor property(String name) {
        return PropertyDescriptor.of(name);
    }

    /**
     * Creates a descriptor with a default value, {@code null} allowed.
     *
     * @throws InvalidPropertyNameException if {@code name} is null or empty
     */
    public static PropertyDescriptor property(String name, Object defaultValue) {
        return PropertyDescriptor.of(name, defaultValue);
    }

    static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidPropertyNameException("Expected a non-empty property name, got "
                    + (name == null ? "null" : "''"));
        }
    }

    // ==================== REGISTRATION ====================

    /**
     * Marks {@code type} as an input type with the given declaration.
     *
     * @param type        the class implementing {@link PropertyHolder}
     * @param declaration its declared properties and getters
     * @return {@code type}
     * @throws AlreadyDecoratedException if {@code type} or its declaring class carries a kind tag
     */
    public static <T> Class<T> markAsInputType(Class<T> type, TypeDeclaration declaration) {
        return mark(type, TypeKind.INPUT, declaration);
    }

    /**
     * Marks a hand-written class as an input type, scanning its own fields and
     * {@code @Getter} methods.
     *
     * @throws AlreadyDecoratedException if {@code type} already carries a kind tag
     */
    public static <T> Class<T> markAsInputType(Class<T> type) {
        return mark(type, TypeKind.INPUT, DeclarationScanner.declaration(type));
    }

    /**
     * Marks {@code type} as an output type with the given declaration.
     *
     * @param type        the class implementing {@link PropertyHolder} or {@link Map}
     * @param declaration its declared properties and getters
     * @return {@code type}
     * @throws AlreadyDecoratedException if {@code type} or its declaring class carries a kind tag
     */
    public static <T> Class<T> markAsOutputType(Class<T> type, TypeDeclaration declaration) {
        return mark(type, TypeKind.OUTPUT, declaration);
    }

    /**
     * Marks a hand-written class as an output type, scanning its own fields and
     * {@code @Getter} methods.
     *
     * @throws AlreadyDecoratedException if {@code type} already carries a kind tag
     */
    public static <T> Class<T> markAsOutputType(Class<T> type) {
        return mark(type, TypeKind.OUTPUT, DeclarationScanner.declaration(type));
    }

    private static <T> Class<T> mark(Class<T> type, TypeKind kind, TypeDeclaration declaration) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(declaration, "declaration");
        boolean holder = PropertyHolder.class.isAssignableFrom(type);
        boolean mapping = kind == TypeKind.OUTPUT && Map.class.isAssignableFrom(type);
        if (!holder && !mapping) {
            throw new IllegalArgumentException(type.getName() + " must implement PropertyHolder"
                    + (kind == TypeKind.OUTPUT ? " or Map" : "") + " to be used as an "
                    + kind.displayName() + " type");
        }
        TypeRegistry.register(type, kind, declaration);
        return type;
    }

    public static boolean isInputType(Class<?> type) {
        return kindOf(type) == TypeKind.INPUT;
    }

    public static boolean isOutputType(Class<?> type) {
        return kindOf(type) == TypeKind.OUTPUT;
    }

    /**
     * Returns the registered metadata of {@code type}, or of its nearest registered superclass.
     */
    public static Optional<TypeMetadata> metadata(Class<?> type) {
        return Optional.ofNullable(TypeRegistry.lookup(type));
    }

    private static TypeKind kindOf(Class<?> type) {
        TypeMetadata metadata = TypeRegistry.lookup(type);
        return metadata == null ? null : metadata.kind();
    }

    // ==================== ACCESS PROTOCOL ====================

    /**
     * Reads a property value by wire name.
     *
     * <p>Output types first translate the name through {@link PropertyNameTranslator} when the
     * instance implements it. Mapping-based output types are read through {@link Map#get}.
     *
     * @param instance an instance of an input or output type
     * @param name     the wire name
     * @return the value, or {@code null} if unset
     * @throws InvalidPropertyNameException if {@code name} is null or empty
     * @throws PropertyUsageException       if the instance's class is neither kind
     */
    public static Object get(Object instance, String name) {
        requireName(name);
        Objects.requireNonNull(instance, "instance");
        TypeMetadata metadata = TypeRegistry.lookup(instance.getClass());
        if (metadata == null) {
            throw new PropertyUsageException(instance.getClass(),
                    "get can only be used with classes decorated with @InputType or @OutputType");
        }
        if (metadata.kind() == TypeKind.INPUT) {
            return store(instance).get(name);
        }
        String key = name;
        if (instance instanceof PropertyNameTranslator) {
            key = ((PropertyNameTranslator) instance).translateProperty(name);
        }
        if (instance instanceof Map) {
            return ((Map<?, ?>) instance).get(key);
        }
        return store(instance).get(key);
    }

    /**
     * Reads a property declared as {@code Optional<T>}. A stored {@code Optional} is returned as is.
     */
    @SuppressWarnings("unchecked")
    public static <T> Optional<T> getOptional(Object instance, String name) {
        Object value = get(instance, name);
        if (value instanceof Optional) {
            return (Optional<T>) value;
        }
        return Optional.ofNullable((T) value);
    }

    /**
     * Writes a property value by wire name, overwriting any previous value.
     *
     * @param instance an instance of an input type
     * @param name     the wire name
     * @param value    the value, {@code null} allowed
     * @throws InvalidPropertyNameException if {@code name} is null or empty
     * @throws PropertyUsageException       if the instance's class is not an input type
     */
    public static void set(Object instance, String name, Object value) {
        requireName(name);
        requireKind(instance, TypeKind.INPUT, "set can only be used with classes decorated with @InputType");
        store(instance).put(name, value);
    }

    /**
     * Writes a property declared as {@code Optional<T>}; the unwrapped value is stored.
     */
    public static void setOptional(Object instance, String name, Optional<?> value) {
        set(instance, name, value == null ? null : value.orElse(null));
    }

    /**
     * Returns a copy of the value store of an input type instance.
     *
     * @throws PropertyUsageException if the instance's class is not an input type
     */
    public static Map<String, Object> inputTypeToMap(Object instance) {
        requireKind(instance, TypeKind.INPUT, "inputTypeToMap can only be used with classes decorated with @InputType");
        return store(instance).snapshot();
    }

    // ==================== OUTPUT INITIALIZATION ====================

    /**
     * Replaces the value store of an output type instance with the entries of {@code payload}.
     *
     * @throws PayloadTypeMismatchException if {@code payload} is not a {@link Map}
     * @throws PropertyUsageException       if the instance's class is not an output type
     */
    public static void initialize(Object instance, Object payload) {
        Map<String, ?> values = requireMapping(instance.getClass(), payload);
        requireKind(instance, TypeKind.OUTPUT, "Only classes decorated with @OutputType can be initialized from a payload");
        store(instance).replaceAll(values);
    }

    /**
     * Checks that a payload used to initialize {@code type} is a mapping.
     *
     * @throws PayloadTypeMismatchException if it is not
     */
    @SuppressWarnings("unchecked")
    public static Map<String, ?> requireMapping(Class<?> type, Object payload) {
        if (!(payload instanceof Map)) {
            throw new PayloadTypeMismatchException(type, payload);
        }
        return (Map<String, ?>) payload;
    }

    // ==================== EQUALITY ====================

    /**
     * Structural equality: same runtime class and equal value stores.
     */
    public static boolean valuesEqual(PropertyHolder self, Object other) {
        if (self == other) {
            return true;
        }
        if (other == null || self.getClass() != other.getClass()) {
            return false;
        }
        return self.valueStore().equals(((PropertyHolder) other).valueStore());
    }

    public static int valuesHashCode(PropertyHolder self) {
        return self.valueStore().hashCode();
    }

    // ==================== TYPE INTROSPECTION ====================

    /**
     * Maps the wire name of every getter of an output type to its unwrapped return type.
     *
     * @throws MissingTypeKindException if {@code type} is not an output type
     */
    public static Map<String, TypeExpr> outputTypeTypes(Class<?> type) {
        TypeMetadata metadata = TypeRegistry.lookup(type);
        if (metadata == null || metadata.kind() != TypeKind.OUTPUT) {
            throw new MissingTypeKindException(type, TypeKind.OUTPUT);
        }
        Map<String, TypeExpr> types = new LinkedHashMap<>();
        metadata.getters().forEach((name, returnType) -> types.put(name, TypeUnwrapper.unwrap(returnType)));
        return types;
    }

    /**
     * Maps the wire name of every declared property of {@code type} to its unwrapped type.
     * Registered classes answer from their metadata; any other class, a subclass of a registered
     * one included, is scanned for its own fields.
     */
    public static Map<String, TypeExpr> resourceTypes(Class<?> type) {
        TypeMetadata metadata = TypeRegistry.lookup(type);
        boolean own = metadata != null && (metadata.type() == type || metadata.declaringType() == type);
        Map<String, PropertyDescriptor> properties = own
                ? metadata.properties()
                : DeclarationScanner.scan(type);
        Map<String, TypeExpr> types = new LinkedHashMap<>();
        for (PropertyDescriptor descriptor : properties.values()) {
            if (descriptor.type() != null) {
                types.put(descriptor.name(), TypeUnwrapper.unwrap(descriptor.type()));
            }
        }
        return types;
    }

    /**
     * @see TypeUnwrapper#unwrapOptional(TypeExpr)
     */
    public static TypeExpr unwrapOptionalType(TypeExpr type) {
        return TypeUnwrapper.unwrapOptional(type);
    }

    /**
     * @see TypeUnwrapper#unwrap(TypeExpr)
     */
    public static TypeExpr unwrapType(TypeExpr type) {
        return TypeUnwrapper.unwrap(type);
    }

    // ==================== HELPERS ====================

    private static void requireKind(Object instance, TypeKind kind, String message) {
        Objects.requireNonNull(instance, "instance");
        TypeMetadata metadata = TypeRegistry.lookup(instance.getClass());
        if (metadata == null || metadata.kind() != kind) {
            throw new PropertyUsageException(instance.getClass(), message);
        }
    }

    private static ValueStore store(Object instance) {
        if (!(instance instanceof PropertyHolder)) {
            throw new PropertyUsageException(instance.getClass(), "Expected an instance implementing PropertyHolder");
        }
        return ((PropertyHolder) instance).valueStore();
    }
}
