package io.github.reugn.props4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an abstract class as an output type declaration.
 * <p>
 * Properties are declared the same way as for {@link InputType} but are read-only: the
 * generated {@code {ClassName}Impl} gets getters only. Unless the class declares its own
 * constructor or extends {@link java.util.Map}, the generated class is initialized from a
 * payload map:
 * <pre>
 * {@code
 * @OutputType
 * public abstract class BucketResult {
 *     public abstract String arn();
 *
 *     @Property("bucket_domain")
 *     public abstract Optional<String> domain();
 * }
 *
 * BucketResult result = new BucketResultImpl(Map.of("arn", "arn:1"));
 * BucketResult other = BucketResultImpl.fromPayload(payload);   // rejects non-map payloads
 * }
 * </pre>
 *
 * <p>A declaration extending {@link java.util.Map} is looked up through the map itself;
 * implementing {@link io.github.reugn.props4j.PropertyNameTranslator} changes the lookup keys.
 *
 * @see InputType
 * @see Getter
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.CLASS)
public @interface OutputType {
}
