package com.metabuild.generator.error;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Reference to a variable that exists neither in any enclosing scope nor as a property.
 */
public class UnresolvedReferenceException extends GeneratorException {

    private static final long serialVersionUID = 1L;

    private final String variableName;

    public UnresolvedReferenceException(String variableName, SourcePosition position) {
        super("unknown variable \"" + variableName + "\"", position);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
