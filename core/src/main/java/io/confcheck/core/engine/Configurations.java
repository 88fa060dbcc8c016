package io.confcheck.core.engine;

import io.confcheck.core.error.ConfigValidationException;
import io.confcheck.core.model.ConfigPath;
import io.confcheck.core.model.Schema;
import io.confcheck.core.model.SettingDiff;
import io.confcheck.core.range.Completion;
import io.confcheck.core.range.RangeError;
import io.confcheck.core.range.ScalarFolder;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for turning raw maps into {@link Configuration}s and for working with them.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class Configurations {

    private static final Logger LOG = LoggerFactory.getLogger(Configurations.class);

    private Configurations() {}

    /**
     * Applies {@code profileNames} to {@code configMap}, validates and completes it.
     *
     * @param schema       the schema to validate against
     * @param profileNames profiles to overlay, in order; may be empty
     * @param configMap    raw top-level map
     * @return the validated configuration
     * @throws ConfigValidationException if any value is out of range; carries the {@link RangeError}
     */
    public static Configuration make(Schema schema, List<String> profileNames, Object configMap) {
        Objects.requireNonNull(schema, "schema must not be null");
        List<String> profiles = profileNames == null ? List.of() : List.copyOf(profileNames);
        Completion completion = ConfigNormalizer.normalizeAndCheck(schema, profiles, configMap);
        if (completion instanceof RangeError error) {
            LOG.warn(
                    "Configuration rejected: schema={}, profiles={}, {}",
                    schema.description(),
                    profiles,
                    error.message());
            throw new ConfigValidationException("make", error);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) completion.completedValue();
        LOG.info(
                "Configuration created: schema={}, profiles={}, keys={}",
                schema.description(),
                profiles,
                map.size());
        return new Configuration(schema, map);
    }

    /**
     * Compares two configurations setting by setting. Sections never appear as entries of their own;
     * their settings do, with paths qualified by the section keys. Integral numbers compare by value,
     * so {@code 8080} and {@code 8080L} are the same setting value.
     *
     * @return a lazy stream of differences in declaration order; empty if the configurations agree
     */
    public static Stream<SettingDiff> diff(Schema schema, Configuration a, Configuration b) {
        return diff(schema, ConfigPath.root(), a.map(), b.map());
    }

    /**
     * Folds {@code folder} over every scalar leaf of {@code configMap}, settings before sections at
     * each level, in declaration order. {@code configMap} may be raw or normalized; a top-level
     * {@value ProfileMerger#PROFILES_KEY} key is ignored.
     *
     * @throws io.confcheck.core.error.RangeInvariantException if the map does not validate
     */
    public static <A> A reduceScalarSettings(Schema schema, ScalarFolder<A> folder, A init, Object configMap) {
        Object base = configMap instanceof Map<?, ?> map && map.containsKey(ProfileMerger.PROFILES_KEY)
                ? ProfileMerger.applyProfiles(schema, map, List.of())
                : configMap;
        return ConfigNormalizer.schemaRange(schema).fold(ConfigPath.root(), folder, init, base);
    }

    // --- Private helpers ---

    private static Stream<SettingDiff> diff(Schema schema, ConfigPath path, Map<?, ?> a, Map<?, ?> b) {
        Stream<SettingDiff> settings = schema.settings().stream()
                .filter(s -> !sameValue(a.get(s.key()), b.get(s.key())))
                .map(s -> new SettingDiff(path.child(s.key()), a.get(s.key()), b.get(s.key())));
        Stream<SettingDiff> sections = schema.sections().stream()
                .flatMap(s -> diff(s.schema(), path.child(s.key()), subMap(a, s.key()), subMap(b, s.key())));
        return Stream.concat(settings, sections);
    }

    private static boolean sameValue(Object a, Object b) {
        if (isIntegral(a) && isIntegral(b)) {
            return toBigInteger(a).equals(toBigInteger(b));
        }
        if (a instanceof List<?> left && b instanceof List<?> right) {
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!sameValue(left.get(i), right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map<?, ?> left && b instanceof Map<?, ?> right) {
            if (!left.keySet().equals(right.keySet())) {
                return false;
            }
            for (Map.Entry<?, ?> entry : left.entrySet()) {
                if (!sameValue(entry.getValue(), right.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.deepEquals(a, b);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    private static BigInteger toBigInteger(Object value) {
        return value instanceof BigInteger big ? big : BigInteger.valueOf(((Number) value).longValue());
    }

    private static Map<?, ?> subMap(Map<?, ?> map, String key) {
        return map.get(key) instanceof Map<?, ?> sub ? sub : Map.of();
    }
}
