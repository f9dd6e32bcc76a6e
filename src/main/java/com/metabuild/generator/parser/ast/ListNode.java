package com.metabuild.generator.parser.ast;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;

public record ListNode(List<ValueNode> values, SourcePosition position) implements ValueNode {

    public ListNode {
        values = List.copyOf(values);
    }
}
