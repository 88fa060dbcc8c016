package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Homogeneous sequences, optionally collapsed into a set. Elements are validated in order and the
 * first rejected element aborts the whole sequence.
 */
final class SequenceRange extends AbstractRange {

    private final Range elementRange;
    private final boolean asSet;

    private SequenceRange(String description, Range elementRange, boolean asSet) {
        super(description);
        this.elementRange = elementRange;
        this.asSet = asSet;
    }

    static SequenceRange sequenceOf(Range elementRange) {
        return new SequenceRange("sequence of " + elementRange.description(), elementRange, false);
    }

    static SequenceRange setOf(Range elementRange) {
        return new SequenceRange("set of " + elementRange.description(), elementRange, true);
    }

    @Override
    public Completion complete(ConfigPath path, Object raw) {
        if (raw == null) {
            return Completion.completed(asSet ? Collections.emptySet() : Collections.emptyList());
        }
        List<?> elements = asList(raw);
        if (elements == null) {
            return reject(path, raw);
        }
        List<Object> completed = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            Completion element = elementRange.complete(path.index(i), elements.get(i));
            if (element instanceof RangeError error) {
                return error;
            }
            completed.add(element.completedValue());
        }
        if (asSet) {
            return Completion.completed(Collections.unmodifiableSet(new LinkedHashSet<>(completed)));
        }
        return Completion.completed(Collections.unmodifiableList(completed));
    }

    @Override
    public <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value) {
        Object completed = completeForFold(this, path, value);
        // sets fold their collapsed elements, sequences their raw ones
        List<?> elements;
        if (asSet) {
            elements = new ArrayList<>((Collection<?>) completed);
        } else {
            elements = value == null ? List.of() : asList(value);
        }
        A acc = init;
        for (int i = 0; i < elements.size(); i++) {
            acc = elementRange.fold(path.index(i), folder, acc, elements.get(i));
        }
        return acc;
    }

    /** Views a sequenceable value as a list, or returns {@code null} if it is not sequenceable. */
    static List<?> asList(Object raw) {
        if (raw instanceof List<?> list) {
            return list;
        }
        if (raw instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (raw instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }
}
