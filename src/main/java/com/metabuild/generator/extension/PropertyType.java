package com.metabuild.generator.extension;

/**
 * Type of a property's value, as far as the model compiler needs to know it.
 * Values assigned to path properties are converted into path expressions.
 */
public enum PropertyType {
    ANY,
    STRING,
    BOOL,
    LIST,
    PATH,
    PATH_LIST;

    public boolean isPath() {
        return this == PATH || this == PATH_LIST;
    }

    public boolean isList() {
        return this == LIST || this == PATH_LIST;
    }
}
