package io.github.reugn.props4j;

/**
 * Hook an output type implements to look its values up under keys other than the wire names.
 *
 * <p>For example, an output type whose payload arrives with {@code snake_case} keys:
 * <pre>{@code
 * @OutputType
 * public abstract class BucketResult implements PropertyNameTranslator {
 *     public abstract String bucketName();
 *
 *     @Override
 *     public String translateProperty(String wireName) {
 *         return CASE_TABLE.getOrDefault(wireName, wireName);
 *     }
 * }
 * }</pre>
 *
 * <p>Without this hook the wire name is used as the lookup key.
 */
@FunctionalInterface
public interface PropertyNameTranslator {

    /**
     * @param wireName the wire name requested by a getter
     * @return the key to look the value up under
     */
    String translateProperty(String wireName);
}
