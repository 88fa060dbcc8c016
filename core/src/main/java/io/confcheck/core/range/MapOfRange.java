package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Homogeneous maps. Every key and every value is validated at the path extended by the entry's key;
 * the first rejection, key or value, wins.
 */
final class MapOfRange extends AbstractRange {

    private final Range keyRange;
    private final Range valueRange;

    MapOfRange(Range keyRange, Range valueRange) {
        super("map from " + keyRange.description() + " to " + valueRange.description());
        this.keyRange = keyRange;
        this.valueRange = valueRange;
    }

    @Override
    public Completion complete(ConfigPath path, Object raw) {
        if (raw == null) {
            return Completion.completed(Collections.emptyMap());
        }
        if (!(raw instanceof Map<?, ?> map)) {
            return reject(path, raw);
        }
        Map<Object, Object> completed = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            ConfigPath entryPath = path.child(entry.getKey());
            Completion key = keyRange.complete(entryPath, entry.getKey());
            if (key instanceof RangeError error) {
                return error;
            }
            Completion value = valueRange.complete(entryPath, entry.getValue());
            if (value instanceof RangeError error) {
                return error;
            }
            completed.put(key.completedValue(), value.completedValue());
        }
        return Completion.completed(Collections.unmodifiableMap(completed));
    }

    @Override
    public <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value) {
        completeForFold(this, path, value);
        if (value == null) {
            return init;
        }
        A acc = init;
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            ConfigPath entryPath = path.child(entry.getKey());
            acc = keyRange.fold(entryPath, folder, acc, entry.getKey());
            acc = valueRange.fold(entryPath, folder, acc, entry.getValue());
        }
        return acc;
    }
}
