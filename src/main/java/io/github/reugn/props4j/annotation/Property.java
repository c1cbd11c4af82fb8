package io.github.reugn.props4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Gives a property an explicit wire name, different from its in-memory name.
 * <p>
 * On a property method of an {@link InputType} or {@link OutputType} declaration:
 * <pre>
 * {@code
 * @Property("bucketName")
 * public abstract String name();
 * }
 * </pre>
 * <p>
 * On a field of a resource class, read by
 * {@link io.github.reugn.props4j.PropertyTypes#resourceTypes(Class)}:
 * <pre>
 * {@code
 * public class Bucket {
 *     @Property("bucketName")
 *     CompletableFuture<String> name;
 * }
 * }
 * </pre>
 *
 * @see DefaultValue
 */
@Target({ElementType.METHOD, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Property {
    /**
     * The wire name. Must not be empty.
     *
     * @return the wire name
     */
    String value();
}
