package com.metabuild.generator.error;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Base class for every fatal error raised while compiling a project model.
 *
 * The message is printed compiler-style, {@code file:line:column: message},
 * when a position is known.
 */
public class GeneratorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String detail;
    private SourcePosition position;

    public GeneratorException(String message) {
        this(message, null);
    }

    public GeneratorException(String message, SourcePosition position) {
        super(message);
        this.detail = message;
        this.position = position;
    }

    public GeneratorException(String message, SourcePosition position, Throwable cause) {
        super(message, cause);
        this.detail = message;
        this.position = position;
    }

    /** The message without position information. */
    public String getDetail() {
        return detail;
    }

    /** Position of the offending construct, or {@code null} if it cannot be attributed. */
    public SourcePosition getPosition() {
        return position;
    }

    /**
     * Attaches a coarse position (e.g. the enclosing statement) if the error
     * was raised without one. An existing position is never overwritten.
     */
    public GeneratorException withPositionIfMissing(SourcePosition fallback) {
        if (this.position == null) {
            this.position = fallback;
        }
        return this;
    }

    @Override
    public String getMessage() {
        if (position != null) {
            return position + ": " + detail;
        }
        return detail;
    }
}
