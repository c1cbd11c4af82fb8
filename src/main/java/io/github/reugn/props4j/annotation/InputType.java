package io.github.reugn.props4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an abstract class as an input type declaration.
 * <p>
 * Every abstract, zero-argument, non-void method declared by the class is a property. The
 * method name is the property's in-memory name; its wire name defaults to the same string and
 * can be overridden with {@link Property}. The annotation processor generates a final
 * {@code {ClassName}Impl} subclass whose accessors read and write a single value store under
 * the wire names.
 *
 * <p><b>Example:</b>
 * <pre>
 * {@code
 * @InputType
 * public abstract class BucketArgs {
 *     @Property("bucketName")
 *     public abstract String name();
 *
 *     public abstract void name(String value);     // placeholder setter, implemented for you
 *
 *     @DefaultValue("3")
 *     public abstract Integer replicas();
 * }
 *
 * // Usage
 * BucketArgsImpl args = new BucketArgsImpl();
 * args.name("logs");
 * args.replicas(5);                                // setter synthesized even if not declared
 * PropertyTypes.inputTypeToMap(args);              // {bucketName=logs, replicas=5}
 * }
 * </pre>
 *
 * <p><b>Setters:</b>
 * <ul>
 *   <li>An abstract {@code void name(T value)} method is a placeholder and gets an
 *       implementation writing the value store.</li>
 *   <li>A concrete {@code void name(T value)} method is preserved as written.</li>
 *   <li>Without any declared setter, one is added to the generated class.</li>
 * </ul>
 *
 * <p>A class may carry only one of {@code @InputType} and {@link OutputType}.
 *
 * @see OutputType
 * @see Property
 * @see io.github.reugn.props4j.PropertyTypes
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.CLASS)
public @interface InputType {
}
