package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

/**
 * {@code $(var)}.
 */
public record VarReferenceNode(String var, SourcePosition position) implements ValueNode {
}
