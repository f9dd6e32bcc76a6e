package com.metabuild.generator.model;

import java.util.Map;

import com.metabuild.generator.model.expr.Expression;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One concrete configuration produced by flattening: a value for every
 * enumerable option, the fully resolved project-level variables under it and
 * the resolved variables of every target built in it, keyed by target name.
 */
@Value
@Builder
public class FlattenedConfiguration {

    @NonNull
    String name;

    @NonNull
    @Singular("optionValue")
    Map<String, String> optionValues;

    @NonNull
    @Singular("variable")
    Map<String, Expression> variables;

    @NonNull
    @Singular("target")
    Map<String, Map<String, Expression>> targets;
}
