package com.metabuild.generator.context;

import com.metabuild.generator.parser.SourcePosition;

public record Warning(String message, SourcePosition position) implements Diagnostic {
}
