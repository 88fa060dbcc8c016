package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;

/** Callback for {@link Range#fold}: receives each scalar leaf together with the range governing it. */
@FunctionalInterface
public interface ScalarFolder<A> {

    A apply(Range range, ConfigPath path, A accumulator, Object scalar);
}
