package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;
import java.util.List;
import java.util.stream.Collectors;

/** First-match alternation. Earlier alternatives win even when a later one fits better. */
final class AnyOfRange extends AbstractRange {

    private final List<Range> alternatives;

    AnyOfRange(List<Range> alternatives) {
        super(alternatives.stream().map(Range::description).collect(Collectors.joining(", ", "any of (", ")")));
        this.alternatives = List.copyOf(alternatives);
    }

    @Override
    public Completion complete(ConfigPath path, Object raw) {
        for (Range alternative : alternatives) {
            Completion completion = alternative.complete(path, raw);
            if (!completion.isError()) {
                return completion;
            }
        }
        return reject(path, raw);
    }

    @Override
    public <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value) {
        for (Range alternative : alternatives) {
            if (!alternative.complete(path, value).isError()) {
                return alternative.fold(path, folder, init, value);
            }
        }
        // no alternative accepts the value; let the precondition report it
        completeForFold(this, path, value);
        return init;
    }
}
