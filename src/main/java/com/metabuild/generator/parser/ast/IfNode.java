package com.metabuild.generator.parser.ast;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;

public record IfNode(ValueNode cond, List<StatementNode> content, SourcePosition position) implements StatementNode {

    public IfNode {
        content = List.copyOf(content);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
