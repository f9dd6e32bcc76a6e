package com.metabuild.generator.error;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;

/**
 * A variable is defined in terms of itself, directly or through other variables.
 */
public class SelfReferenceException extends GeneratorException {

    private static final long serialVersionUID = 1L;

    private final String variableName;
    private final List<String> cycle;

    public SelfReferenceException(String variableName, List<String> cycle, SourcePosition position) {
        super(buildMessage(variableName, cycle), position);
        this.variableName = variableName;
        this.cycle = List.copyOf(cycle);
    }

    public String getVariableName() {
        return variableName;
    }

    /** Names of the variables forming the loop, starting and ending with {@link #getVariableName()}. */
    public List<String> getCycle() {
        return cycle;
    }

    private static String buildMessage(String variableName, List<String> cycle) {
        String msg = "variable \"" + variableName + "\" is defined recursively, references itself";
        if (cycle.size() > 2) {
            msg += " (" + String.join(" -> ", cycle) + ")";
        }
        return msg;
    }
}
