package io.confcheck.core.model;

/** A node of a {@link Schema}: either a {@link Setting} leaf or a {@link Section} subtree. */
public sealed interface SchemaEntry permits Setting, Section {

    /** The key under which this entry appears in a configuration map. */
    String key();

    /** Whether the resolved value of this entry becomes the default for same-named entries nested below it. */
    boolean inherit();
}
