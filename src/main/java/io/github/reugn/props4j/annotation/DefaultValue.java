package io.github.reugn.props4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the default value of a property as a string literal.
 * <p>
 * The literal is parsed according to the property type and recorded in the property's
 * {@link io.github.reugn.props4j.PropertyDescriptor}. It is not written to the value store:
 * reading an unset property still yields {@code null}.
 *
 * <pre>
 * {@code
 * @InputType
 * public abstract class ServerArgs {
 *     @DefaultValue("localhost")
 *     public abstract String host();
 *
 *     @DefaultValue("8080")
 *     public abstract Integer port();
 *
 *     @DefaultValue("null")
 *     public abstract String proxy();
 * }
 * }
 * </pre>
 * <p>
 * Supported property types:
 * <ul>
 *   <li>Wrapper types: Integer, Long, Double, Float, Boolean, Byte, Short, Character</li>
 *   <li>String ({@code ""} is the empty string)</li>
 *   <li>{@code "null"} for any reference type</li>
 * </ul>
 *
 * @see Property
 */
@Target({ElementType.METHOD, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface DefaultValue {
    /**
     * The default value as a string literal, e.g. {@code "42"}, {@code "true"}, {@code "100L"}.
     *
     * @return the literal
     */
    String value();
}
