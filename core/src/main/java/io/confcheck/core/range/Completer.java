package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;

/**
 * Completion function of a {@link ScalarRange}. Receives the range itself so rejections can name it
 * via {@link Range#reject}.
 */
@FunctionalInterface
public interface Completer {

    Completion complete(Range self, ConfigPath path, Object raw);
}
