package io.confcheck.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.confcheck.core.model.ConfigPath;
import io.confcheck.core.range.RangeError;
import io.confcheck.core.range.Ranges;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy. Verifies the common fields and the kind each concrete type
 * reports.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void configExceptionIsAbstractAndRoot() {
        assertThat(ConfigException.class).isAbstract();
        assertThat(ConfigException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void concreteTypesExtendConfigException() {
        List.of(
                        ConfigMergeException.class,
                        ProfileResolveException.class,
                        ConfigAccessException.class,
                        SchemaDefinitionException.class,
                        RangeInvariantException.class,
                        ConfigValidationException.class)
                .forEach(type -> assertThat(type.getSuperclass()).isEqualTo(ConfigException.class));
    }

    // --- Caller errors are assertion violations ---

    @Test
    void mergeExceptionIsAssertionViolation() {
        var ex = new ConfigMergeException("mergeSansProfiles", "Unknown key 'x'", ConfigPath.of("x"), List.of("a"));

        assertThat(ex.kind()).isEqualTo(ConfigException.Kind.ASSERTION_VIOLATION);
        assertThat(ex.who()).isEqualTo("mergeSansProfiles");
        assertThat(ex.detail()).isEqualTo("Unknown key 'x'");
        assertThat(ex.irritants()).containsExactly(ConfigPath.of("x"), List.of("a"));
    }

    @Test
    void accessSchemaAndRangeInvariantExceptionsAreAssertionViolations() {
        assertThat(new ConfigAccessException("access", "No setting 'x' at []").kind())
                .isEqualTo(ConfigException.Kind.ASSERTION_VIOLATION);
        assertThat(new SchemaDefinitionException("schema", "Duplicate key 'x'").kind())
                .isEqualTo(ConfigException.Kind.ASSERTION_VIOLATION);
        assertThat(new RangeInvariantException("fold", "bad").kind())
                .isEqualTo(ConfigException.Kind.ASSERTION_VIOLATION);
    }

    // --- Data errors are errors ---

    @Test
    void profileResolveExceptionNamesTheProfile() {
        var ex = new ProfileResolveException("applyProfiles", "prod", List.of("dev"));

        assertThat(ex.kind()).isEqualTo(ConfigException.Kind.ERROR);
        assertThat(ex.profileName()).isEqualTo("prod");
        assertThat(ex.getMessage()).contains("prod");
        assertThat(ex.irritants()).containsExactly(List.of("dev"));
    }

    @Test
    void validationExceptionCarriesRangeError() {
        var error = new RangeError(Ranges.booleanRange(false), ConfigPath.of("db", "ssl"), "yes");
        var ex = new ConfigValidationException("make", error);

        assertThat(ex.kind()).isEqualTo(ConfigException.Kind.ERROR);
        assertThat(ex.rangeError()).isSameAs(error);
        assertThat(ex.getMessage()).isEqualTo("Invalid configuration: " + error.message());
        assertThat(ex.irritants()).containsExactly(ConfigPath.of("db", "ssl"), "yes", "boolean");
    }

    // --- Rendering ---

    @Test
    void irritantsMayBeNull() {
        var ex = new ConfigAccessException("access", "No setting", (Object) null);

        assertThat(ex.irritants()).containsExactly((Object) null);
    }

    @Test
    void toStringShowsKindWhoAndIrritants() {
        var ex = new ConfigMergeException("mergeConfigMaps", "Expected a map", ConfigPath.of("db"));

        assertThat(ex.toString())
                .startsWith("assertion-violation: Expected a map [mergeConfigMaps]")
                .contains("[db]");
    }
}
