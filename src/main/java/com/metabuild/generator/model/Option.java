package com.metabuild.generator.model;

import java.util.List;
import java.util.Map;

import com.metabuild.generator.parser.SourcePosition;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A build option: a named choice the user makes when building, e.g.
 * {@code BUILD} with values {@code debug} and {@code release}.
 *
 * Options with a list of values are expanded into configurations by
 * formats without conditional syntax; options without one are fixed to their
 * default there.
 */
@Value
@Builder(toBuilder = true)
public class Option {

    @NonNull
    String name;

    /** Allowed values, or {@code null} if any value is allowed. */
    List<String> values;

    /** Human-readable labels of values, used in configuration names. */
    @Singular("valueLabel")
    Map<String, String> valueLabels;

    String defaultValue;

    String description;

    SourcePosition position;

    /** True if the option has a finite, non-empty set of values. */
    public boolean isEnumerable() {
        return values != null && !values.isEmpty();
    }

    /** The label of {@code value}; the value itself if no label was given. */
    public String getLabel(String value) {
        return valueLabels.getOrDefault(value, value);
    }
}
