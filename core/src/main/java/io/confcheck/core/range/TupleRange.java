package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fixed-position sequences. Positions are zipped with the element ranges, so surplus elements and
 * surplus ranges are dropped rather than reported.
 */
final class TupleRange extends AbstractRange {

    private final List<Range> positions;

    TupleRange(List<Range> positions) {
        super(positions.stream().map(Range::description).collect(Collectors.joining(", ", "tuple of (", ")")));
        this.positions = List.copyOf(positions);
    }

    @Override
    public Completion complete(ConfigPath path, Object raw) {
        List<?> elements = SequenceRange.asList(raw);
        if (elements == null) {
            return reject(path, raw);
        }
        int size = Math.min(elements.size(), positions.size());
        List<Object> completed = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Completion element = positions.get(i).complete(path.index(i), elements.get(i));
            if (element instanceof RangeError error) {
                return error;
            }
            completed.add(element.completedValue());
        }
        return Completion.completed(Collections.unmodifiableList(completed));
    }

    @Override
    public <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value) {
        completeForFold(this, path, value);
        List<?> elements = SequenceRange.asList(value);
        int size = Math.min(elements.size(), positions.size());
        A acc = init;
        for (int i = 0; i < size; i++) {
            acc = positions.get(i).fold(path.index(i), folder, acc, elements.get(i));
        }
        return acc;
    }
}
