package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

public record LiteralNode(String text, SourcePosition position) implements ValueNode {
}
