package com.metabuild.generator.parser.ast;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Adjacent values without whitespace between them, e.g. {@code lib$(name).a}.
 */
public record ConcatNode(List<ValueNode> values, SourcePosition position) implements ValueNode {

    public ConcatNode {
        values = List.copyOf(values);
    }
}
