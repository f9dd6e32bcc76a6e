package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

public record BoolvalNode(boolean value, SourcePosition position) implements ValueNode {
}
