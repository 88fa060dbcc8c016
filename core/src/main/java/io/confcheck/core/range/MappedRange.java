package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;
import java.util.function.Function;

/**
 * Post-processes the completed value of another range. Errors of the wrapped range pass through
 * untouched. Folds as a single leaf carrying the post-processed value.
 */
final class MappedRange extends AbstractRange {

    private final Range range;
    private final Function<Object, Object> mapper;

    MappedRange(String description, Range range, Function<Object, Object> mapper) {
        super(description);
        this.range = range;
        this.mapper = mapper;
    }

    @Override
    public Completion complete(ConfigPath path, Object raw) {
        Completion completion = range.complete(path, raw);
        if (completion.isError()) {
            return completion;
        }
        return Completion.completed(mapper.apply(completion.completedValue()));
    }

    @Override
    public <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value) {
        return folder.apply(this, path, init, completeForFold(this, path, value));
    }
}
