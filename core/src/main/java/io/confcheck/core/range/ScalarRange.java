package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;
import java.util.Objects;

/**
 * A range over single values. Its fold completes the value and hands the result to the folder
 * exactly once.
 */
public final class ScalarRange extends AbstractRange {

    private final Completer completer;

    public ScalarRange(String description, Completer completer) {
        super(description);
        this.completer = Objects.requireNonNull(completer, "completer must not be null");
    }

    @Override
    public Completion complete(ConfigPath path, Object raw) {
        return completer.complete(this, path, raw);
    }

    @Override
    public <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value) {
        return folder.apply(this, path, init, completeForFold(this, path, value));
    }
}
