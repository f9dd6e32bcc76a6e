package com.metabuild.generator.parser.ast;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;

/**
 * {@code type name : base1, base2 { content }}.
 */
public record TargetNode(String type, String name, List<String> baseTemplates, List<StatementNode> content,
                         SourcePosition position) implements StatementNode {

    public TargetNode {
        baseTemplates = List.copyOf(baseTemplates);
        content = List.copyOf(content);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
