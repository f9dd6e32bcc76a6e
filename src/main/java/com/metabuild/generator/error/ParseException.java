package com.metabuild.generator.error;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Structural error in the parsed input (unknown target type, duplicate target, bad scope etc.).
 */
public class ParseException extends GeneratorException {

    private static final long serialVersionUID = 1L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, SourcePosition position) {
        super(message, position);
    }
}
