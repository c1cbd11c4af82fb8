package io.github.reugn.props4j.integration;

import com.google.testing.compile.JavaFileObjects;
import io.github.reugn.props4j.PropertyDescriptor;
import io.github.reugn.props4j.PropertyTypes;
import io.github.reugn.props4j.TypeExpr;
import io.github.reugn.props4j.TypeKind;
import io.github.reugn.props4j.TypeMetadata;
import io.github.reugn.props4j.exceptions.InvalidPropertyNameException;
import io.github.reugn.props4j.exceptions.PayloadTypeMismatchException;
import io.github.reugn.props4j.exceptions.PropertyUsageException;
import io.github.reugn.props4j.util.RuntimeTestHelper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * E2E integration tests for @InputType.
 * These tests execute the generated classes and verify runtime behavior.
 */
@DisplayName("Input Type Examples (E2E)")
class InputTypeExamplesTest {

    private static final JavaFileObject BUCKET_ARGS = JavaFileObjects.forSourceString("example.BucketArgs",
            """
                    package example;

                    import io.github.reugn.props4j.annotation.DefaultValue;
                    import io.github.reugn.props4j.annotation.InputType;
                    import io.github.reugn.props4j.annotation.Property;

                    import java.util.Optional;

                    @InputType
                    public abstract class BucketArgs {
                        @Property("bucketName")
                        public abstract String name();

                        public abstract void name(String newName);

                        @DefaultValue("3")
                        public abstract Integer replicas();

                        public abstract Optional<String> region();
                    }
                    """);

    private RuntimeTestHelper helper;

    @BeforeEach
    void setUp() {
        helper = RuntimeTestHelper.compile(BUCKET_ARGS);
    }

    @Test
    @DisplayName("Setter then getter returns the written value")
    void setThenGet() {
        Object args = helper.newInstance("example.BucketArgsImpl");

        helper.invokeOn(args, "name", "logs");
        helper.invokeOn(args, "replicas", 5);

        assertThat(helper.invokeOn(args, "name")).isEqualTo("logs");
        assertThat(helper.invokeOn(args, "replicas")).isEqualTo(5);
        assertThat(PropertyTypes.get(args, "bucketName")).isEqualTo("logs");
    }

    @Test
    @DisplayName("Unset property reads null, its default is not applied")
    void unsetPropertyIsNull() {
        Object args = helper.newInstance("example.BucketArgsImpl");

        assertThat(helper.invokeOn(args, "replicas")).isNull();
        assertThat(PropertyTypes.get(args, "unknown")).isNull();
    }

    @Test
    @DisplayName("Setter overwrites the previous value")
    void setOverwrites() {
        Object args = helper.newInstance("example.BucketArgsImpl");

        helper.invokeOn(args, "name", "logs");
        helper.invokeOn(args, "name", "metrics");
        helper.invokeOn(args, "name", (Object) null);

        assertThat(helper.invokeOn(args, "name")).isNull();
        assertThat(PropertyTypes.inputTypeToMap(args)).containsExactly(entry("bucketName", null));
    }

    @Test
    @DisplayName("inputTypeToMap uses wire names in write order")
    void toMap() {
        Object args = helper.newInstance("example.BucketArgsImpl");

        helper.invokeOn(args, "replicas", 3);
        helper.invokeOn(args, "name", "x");

        Map<String, Object> map = PropertyTypes.inputTypeToMap(args);
        assertThat(map).containsExactly(entry("replicas", 3), entry("bucketName", "x"));

        map.put("bucketName", "changed");
        assertThat(helper.invokeOn(args, "name")).isEqualTo("x");
    }

    @Test
    @DisplayName("Optional properties store the unwrapped value")
    void optionalProperty() {
        Object args = helper.newInstance("example.BucketArgsImpl");

        assertThat(helper.invokeOn(args, "region")).isEqualTo(Optional.empty());

        helper.invokeOn(args, "region", Optional.of("eu-west-1"));
        assertThat(helper.invokeOn(args, "region")).isEqualTo(Optional.of("eu-west-1"));
        assertThat(PropertyTypes.inputTypeToMap(args)).containsEntry("region", "eu-west-1");

        helper.invokeOn(args, "region", Optional.empty());
        assertThat(PropertyTypes.inputTypeToMap(args)).containsEntry("region", null);
    }

    @Test
    @DisplayName("Generated and declaration classes are both input types")
    void kindQueries() {
        Class<?> declaration = helper.loadClass("example.BucketArgs");
        Class<?> generated = helper.loadClass("example.BucketArgsImpl");

        assertThat(PropertyTypes.isInputType(declaration)).isTrue();
        assertThat(PropertyTypes.isInputType(generated)).isTrue();
        assertThat(PropertyTypes.isOutputType(declaration)).isFalse();
    }

    @Test
    @DisplayName("Metadata records descriptors with defaults and declared types")
    void metadata() {
        TypeMetadata metadata = PropertyTypes.metadata(helper.loadClass("example.BucketArgs")).orElseThrow();

        assertThat(metadata.kind()).isEqualTo(TypeKind.INPUT);
        assertThat(metadata.type()).isEqualTo(helper.loadClass("example.BucketArgsImpl"));
        assertThat(metadata.declaringType()).isEqualTo(helper.loadClass("example.BucketArgs"));
        assertThat(metadata.properties()).containsOnlyKeys("name", "replicas", "region");

        PropertyDescriptor name = metadata.properties().get("name");
        assertThat(name.name()).isEqualTo("bucketName");
        assertThat(name.hasDefault()).isFalse();
        assertThat(name.type()).isEqualTo(TypeExpr.plain(String.class));

        PropertyDescriptor replicas = metadata.properties().get("replicas");
        assertThat(replicas.defaultValue()).isEqualTo(3);

        assertThat(metadata.getters()).containsEntry("region", TypeExpr.optional(TypeExpr.plain(String.class)));
    }

    @Test
    @DisplayName("Instances with equal stores are equal")
    void equality() {
        Object first = helper.newInstance("example.BucketArgsImpl");
        Object second = helper.newInstance("example.BucketArgsImpl");
        assertThat(first).isEqualTo(second);

        helper.invokeOn(first, "name", "logs");
        assertThat(first).isNotEqualTo(second);

        helper.invokeOn(second, "name", "logs");
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }

    @Test
    @DisplayName("Empty wire name is rejected")
    void invalidName() {
        Object args = helper.newInstance("example.BucketArgsImpl");

        assertThatThrownBy(() -> PropertyTypes.set(args, "", "x"))
                .isInstanceOf(InvalidPropertyNameException.class);
        assertThatThrownBy(() -> PropertyTypes.get(args, null))
                .isInstanceOf(InvalidPropertyNameException.class);
    }

    @Test
    @DisplayName("Input types cannot be initialized from a payload")
    void initializeRejected() {
        Object args = helper.newInstance("example.BucketArgsImpl");

        assertThatThrownBy(() -> PropertyTypes.initialize(args, Map.of("bucketName", "x")))
                .isInstanceOf(PropertyUsageException.class);
        assertThatThrownBy(() -> PropertyTypes.initialize(args, "x"))
                .isInstanceOf(PayloadTypeMismatchException.class);
    }

    @Test
    @DisplayName("Declaration constructor may write properties")
    void constructorWrites() {
        JavaFileObject source = JavaFileObjects.forSourceString("example.TaggedArgs",
                """
                        package example;

                        import io.github.reugn.props4j.annotation.InputType;

                        @InputType
                        public abstract class TaggedArgs {
                            protected TaggedArgs(String tag) {
                                tag(tag);
                            }

                            public abstract String tag();

                            public abstract void tag(String value);
                        }
                        """);
        RuntimeTestHelper tagged = RuntimeTestHelper.compile(source);

        Object args = tagged.newInstance("example.TaggedArgsImpl", new Class<?>[]{String.class}, "blue");

        assertThat(tagged.invokeOn(args, "tag")).isEqualTo("blue");
        assertThat(PropertyTypes.inputTypeToMap(args)).containsExactly(entry("tag", "blue"));
    }

    @Test
    @DisplayName("Concrete user setter runs instead of a generated one")
    void userSetter() {
        JavaFileObject source = JavaFileObjects.forSourceString("example.ServerArgs",
                """
                        package example;

                        import io.github.reugn.props4j.PropertyTypes;
                        import io.github.reugn.props4j.annotation.InputType;

                        @InputType
                        public abstract class ServerArgs {
                            public abstract Integer port();

                            public void port(Integer value) {
                                PropertyTypes.set(this, "port", value == null ? null : Math.max(value, 1));
                            }
                        }
                        """);
        RuntimeTestHelper server = RuntimeTestHelper.compile(source);

        Object args = server.newInstance("example.ServerArgsImpl");
        server.invokeOn(args, "port", -5);

        assertThat(server.invokeOn(args, "port")).isEqualTo(1);
        assertThat(server.loadClass("example.ServerArgsImpl").getDeclaredMethods())
                .noneMatch(m -> m.getName().equals("port") && m.getParameterCount() == 1);
    }
}
