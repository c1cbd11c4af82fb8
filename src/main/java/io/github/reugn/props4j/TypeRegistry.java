package io.github.reugn.props4j;

import io.github.reugn.props4j.exceptions.AlreadyDecoratedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Side table holding the metadata of every registered property type, keyed by class identity.
 *
 * <p>Entries are inserted once and never replaced or removed. A generated class registers
 * itself together with its declaration class from its static initializer, so lookups first
 * initialize the queried class and, failing that, its generated {@code {ClassName}Impl}
 * companion. Subclasses of a registered class share its metadata, and may only be registered
 * under the same kind.
 *
 * <p>Classes found to have no generated companion are remembered, so repeated queries on
 * unrelated classes do not load classes by name again.
 */
final class TypeRegistry {

    /**
     * Suffix of the class generated for a declaration.
     */
    static final String GENERATED_SUFFIX = "Impl";

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);

    private static final ConcurrentMap<Class<?>, TypeMetadata> METADATA = new ConcurrentHashMap<>();

    static final Set<Class<?>> WITHOUT_COMPANION = ConcurrentHashMap.newKeySet();

    private TypeRegistry() {
    }

    /**
     * Registers {@code type}, and the declaration class if it differs, under the given kind.
     *
     * @throws AlreadyDecoratedException if either class already carries a kind tag, or a
     *                                    superclass carries the other kind
     */
    static TypeMetadata register(Class<?> type, TypeKind kind, TypeDeclaration declaration) {
        // A class that registers itself while initializing must win over this call
        initialize(type);

        TypeMetadata inherited = lookup(type.getSuperclass());
        if (inherited != null && inherited.kind() != kind) {
            throw new AlreadyDecoratedException(type, inherited.kind());
        }

        TypeMetadata metadata = new TypeMetadata(kind, type, declaration);
        claim(type, metadata);

        Class<?> declaringType = declaration.declaringType();
        if (declaringType != type) {
            try {
                claim(declaringType, metadata);
            } catch (AlreadyDecoratedException e) {
                METADATA.remove(type, metadata);
                throw e;
            }
        }

        int count = declaration.properties().size();
        if (count == 0 && declaration.getters().isEmpty()) {
            LOGGER.warn("Registered {} type {} declares no properties; may be misconfigured",
                    kind.displayName(), type.getName());
        } else {
            LOGGER.debug("Registered {} as {} type with {} propert{} and {} getter{}",
                    type.getName(), kind.displayName(), count, count == 1 ? "y" : "ies",
                    declaration.getters().size(), declaration.getters().size() == 1 ? "" : "s");
        }
        return metadata;
    }

    /**
     * Finds the metadata of {@code type} or of its nearest registered superclass.
     *
     * @return the metadata, or {@code null} if neither the class nor a superclass is registered
     */
    static TypeMetadata lookup(Class<?> type) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            TypeMetadata metadata = find(c);
            if (metadata != null) {
                return metadata;
            }
        }
        return null;
    }

    /**
     * Name of the class generated for a declaration: nesting chain joined by {@code _},
     * followed by {@link #GENERATED_SUFFIX}, in the declaration's package.
     */
    static String companionName(Class<?> declaration) {
        StringBuilder simpleName = new StringBuilder(declaration.getSimpleName());
        for (Class<?> outer = declaration.getDeclaringClass(); outer != null; outer = outer.getDeclaringClass()) {
            simpleName.insert(0, outer.getSimpleName() + "_");
        }
        String packageName = declaration.getPackageName();
        return (packageName.isEmpty() ? "" : packageName + ".") + simpleName + GENERATED_SUFFIX;
    }

    private static TypeMetadata find(Class<?> type) {
        TypeMetadata metadata = METADATA.get(type);
        if (metadata != null || type.isPrimitive() || type.isArray() || type.isInterface()) {
            return metadata;
        }
        if (WITHOUT_COMPANION.contains(type)) {
            return null;
        }
        initialize(type);
        metadata = METADATA.get(type);
        if (metadata != null) {
            return metadata;
        }
        if (type.isAnonymousClass() || type.isLocalClass() || !initializeCompanion(type)) {
            WITHOUT_COMPANION.add(type);
            return null;
        }
        return METADATA.get(type);
    }

    private static void initialize(Class<?> type) {
        try {
            Class.forName(type.getName(), true, type.getClassLoader());
        } catch (ClassNotFoundException e) {
            LOGGER.debug("Unable to initialize {} by name; relying on existing registrations", type.getName(), e);
        }
    }

    private static boolean initializeCompanion(Class<?> declaration) {
        String companion = companionName(declaration);
        try {
            Class.forName(companion, true, declaration.getClassLoader());
            return true;
        } catch (ClassNotFoundException e) {
            LOGGER.trace("No generated companion {} for {}", companion, declaration.getName());
            return false;
        }
    }

    private static void claim(Class<?> key, TypeMetadata metadata) {
        TypeMetadata existing = METADATA.putIfAbsent(key, metadata);
        if (existing != null) {
            throw new AlreadyDecoratedException(key, existing.kind());
        }
    }
}
