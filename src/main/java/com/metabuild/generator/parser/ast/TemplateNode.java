package com.metabuild.generator.parser.ast;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;

/**
 * {@code template name : bases { content }}.
 */
public record TemplateNode(String name, List<String> baseTemplates, List<StatementNode> content,
                           SourcePosition position) implements StatementNode {

    public TemplateNode {
        baseTemplates = List.copyOf(baseTemplates);
        content = List.copyOf(content);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
