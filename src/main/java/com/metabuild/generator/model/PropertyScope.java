package com.metabuild.generator.model;

/**
 * Kind of model part a property applies to.
 */
public enum PropertyScope {
    PROJECT,
    MODULE,
    TARGET,
    SOURCE_FILE;

    /** True if {@code other} is nested deeper than this scope. */
    public boolean isOuterTo(PropertyScope other) {
        return ordinal() < other.ordinal();
    }
}
