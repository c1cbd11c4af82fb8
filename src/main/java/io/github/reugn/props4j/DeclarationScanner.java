package io.github.reugn.props4j;

import io.github.reugn.props4j.annotation.DefaultValue;
import io.github.reugn.props4j.annotation.Getter;
import io.github.reugn.props4j.annotation.Property;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reflective counterpart of the compile-time scanner, used for hand-written property types
 * registered through {@link PropertyTypes#markAsInputType(Class)} or
 * {@link PropertyTypes#markAsOutputType(Class)}.
 *
 * <p>Only the class's own fields are read, in declaration order. Static, transient and
 * synthetic fields are skipped, as is the {@link ValueStore} field of the holder itself.
 */
final class DeclarationScanner {

    private DeclarationScanner() {
    }

    /**
     * Maps the in-memory name of every declared field to its descriptor.
     *
     * @param type the class to scan
     * @return field name to descriptor, in declaration order, declared types attached
     * @throws IllegalArgumentException if a {@code @DefaultValue} literal does not parse
     */
    static Map<String, PropertyDescriptor> scan(Class<?> type) {
        Map<String, PropertyDescriptor> properties = new LinkedHashMap<>();
        for (Field field : type.getDeclaredFields()) {
            if (!isPropertyField(field)) {
                continue;
            }
            Property property = field.getAnnotation(Property.class);
            String wireName = property != null ? property.value() : field.getName();

            DefaultValue defaultValue = field.getAnnotation(DefaultValue.class);
            Object value = PropertyDescriptor.ABSENT;
            if (defaultValue != null) {
                value = Literals.parse(defaultValue.value(), field.getType());
            }
            properties.put(field.getName(),
                    new PropertyDescriptor(wireName, value, TypeExpr.of(field.getGenericType())));
        }
        return properties;
    }

    /**
     * Builds the full declaration of a class: its fields as properties, a getter per property,
     * and a getter per {@link Getter}-annotated method.
     */
    static TypeDeclaration declaration(Class<?> type) {
        Map<String, PropertyDescriptor> properties = scan(type);
        Map<String, TypeExpr> getters = new LinkedHashMap<>();
        properties.values().forEach(p -> getters.putIfAbsent(p.name(), p.type()));

        Method[] methods = type.getDeclaredMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName));
        for (Method method : methods) {
            Getter getter = method.getAnnotation(Getter.class);
            if (getter == null) {
                continue;
            }
            String wireName = getter.value().isEmpty() ? method.getName() : getter.value();
            getters.putIfAbsent(wireName, TypeExpr.of(method.getGenericReturnType()));
        }

        TypeDeclaration.Builder builder = TypeDeclaration.builder(type);
        properties.forEach(builder::property);
        getters.forEach(builder::getter);
        return builder.build();
    }

    private static boolean isPropertyField(Field field) {
        int modifiers = field.getModifiers();
        return !Modifier.isStatic(modifiers)
                && !Modifier.isTransient(modifiers)
                && !field.isSynthetic()
                && field.getType() != ValueStore.class;
    }
}
