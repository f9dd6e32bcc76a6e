package com.metabuild.generator.context;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Variable that is set but never referenced anywhere.
 */
public record UnusedVariableWarning(String variableName, SourcePosition position) implements Diagnostic {

    @Override
    public String message() {
        return "variable \"" + variableName + "\" is never used";
    }
}
