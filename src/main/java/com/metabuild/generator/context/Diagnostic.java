package com.metabuild.generator.context;

import com.metabuild.generator.parser.SourcePosition;

/**
 * A message reported to the user, with the input location it refers to.
 */
public interface Diagnostic {

    String message();

    SourcePosition position();

    /** Compiler-style text, {@code file:line:column: message}. */
    default String format() {
        return position() == null ? message() : position() + ": " + message();
    }
}
