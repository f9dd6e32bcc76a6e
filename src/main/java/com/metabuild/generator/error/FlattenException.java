package com.metabuild.generator.error;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Raised when a conditional model cannot be flattened into explicit configurations.
 */
public class FlattenException extends GeneratorException {

    private static final long serialVersionUID = 1L;

    public FlattenException(String message) {
        super(message);
    }

    public FlattenException(String message, SourcePosition position) {
        super(message, position);
    }
}
