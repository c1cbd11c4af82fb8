package io.github.reugn.props4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tags a zero-argument method as a property getter reading the given wire name.
 * <p>
 * An abstract {@code @Getter} method gets a body reading the value store; a concrete one is
 * kept as written. Either way the getter is listed by
 * {@link io.github.reugn.props4j.PropertyTypes#outputTypeTypes(Class)}, but it is not a declared
 * property of the class.
 * <pre>
 * {@code
 * @OutputType
 * public abstract class ClusterResult {
 *     @Getter("node_count")
 *     public abstract Integer nodes();
 *
 *     @Getter
 *     public String endpoint() {
 *         String host = (String) PropertyTypes.get(this, "endpoint");
 *         return host == null ? "localhost" : host;
 *     }
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Getter {
    /**
     * The wire name; defaults to the method name.
     *
     * @return the wire name, or empty to use the method name
     */
    String value() default "";
}
