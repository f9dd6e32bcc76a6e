package com.metabuild.generator.parser;

/**
 * Location of a construct in an input file. Line and column are optional.
 */
public record SourcePosition(String filename, Integer line, Integer column) {

    public static SourcePosition of(String filename, int line, int column) {
        return new SourcePosition(filename, line, column);
    }

    public static SourcePosition ofFile(String filename) {
        return new SourcePosition(filename, null, null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (filename != null) {
            sb.append(filename);
        }
        if (line != null) {
            if (sb.length() > 0) sb.append(':');
            sb.append(line);
        }
        if (column != null) {
            if (sb.length() > 0) sb.append(':');
            sb.append(column);
        }
        return sb.toString();
    }
}
